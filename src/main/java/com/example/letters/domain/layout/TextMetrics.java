package com.example.letters.domain.layout;

import com.example.letters.domain.model.FontFace;

/**
 * Measures rendered text. Both layout passes must share one instance, otherwise their wrapping
 * (and therefore their page counts) can differ.
 */
public interface TextMetrics {

    /**
     * @param text text to measure, as it will be drawn
     * @param face font face used for drawing
     * @param size font size in points
     * @return advance width in points
     */
    double width(String text, FontFace face, double size);
}
