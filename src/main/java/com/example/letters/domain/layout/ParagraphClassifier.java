package com.example.letters.domain.layout;

import com.example.letters.domain.model.ParagraphKind;

/**
 * Tells section headings apart from running text.
 * A heading is fully upper-case, at most ten words long and does not end like a sentence.
 */
public class ParagraphClassifier {

    static final int MAX_HEADING_WORDS = 10;

    public ParagraphKind classify(String paragraph) {
        if (paragraph == null) {
            return ParagraphKind.BODY;
        }
        String trimmed = paragraph.strip();
        if (trimmed.isEmpty() || !isUpperCase(trimmed)) {
            return ParagraphKind.BODY;
        }
        if (trimmed.split("\\s+").length > MAX_HEADING_WORDS) {
            return ParagraphKind.BODY;
        }
        char last = trimmed.charAt(trimmed.length() - 1);
        if (last == '.' || last == '!' || last == '?' || last == ',') {
            return ParagraphKind.BODY;
        }
        return ParagraphKind.HEADING;
    }

    /**
     * Requires at least one cased letter and no lower-case letters; digits and punctuation are neutral.
     */
    private boolean isUpperCase(String text) {
        boolean cased = false;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            if (Character.isLowerCase(codePoint)) {
                return false;
            }
            if (Character.isUpperCase(codePoint) || Character.isTitleCase(codePoint)) {
                cased = true;
            }
            i += Character.charCount(codePoint);
        }
        return cased;
    }
}
