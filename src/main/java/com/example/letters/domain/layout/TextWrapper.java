package com.example.letters.domain.layout;

import com.example.letters.domain.model.FontFace;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy word wrapper. Words are never hyphenated; a word wider than the line stands on its own line.
 */
public class TextWrapper {

    private final TextMetrics metrics;

    public TextWrapper(TextMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Wraps a paragraph into lines no wider than {@code maxWidth} (except for single oversized words).
     *
     * @param text     paragraph text; runs of whitespace collapse to single spaces
     * @param maxWidth available width in points
     * @param face     face used to measure
     * @param size     font size in points
     * @return lines in reading order, empty for blank text
     */
    public List<String> wrap(String text, double maxWidth, FontFace face, double size) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return lines;
        }
        StringBuilder current = new StringBuilder();
        for (String word : text.strip().split("\\s+")) {
            if (current.length() == 0) {
                current.append(word);
                continue;
            }
            String candidate = current + " " + word;
            if (metrics.width(candidate, face, size) > maxWidth) {
                lines.add(current.toString());
                current.setLength(0);
                current.append(word);
            } else {
                current.append(' ').append(word);
            }
        }
        if (current.length() > 0) {
            lines.add(current.toString());
        }
        return lines;
    }
}
