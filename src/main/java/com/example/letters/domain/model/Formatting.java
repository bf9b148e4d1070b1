package com.example.letters.domain.model;

import com.example.letters.domain.exception.ConfigurationException;

/**
 * Body text formatting. Sizes and spacing are in points, the indent and closing reserve in inches.
 */
public record Formatting(
        FontFamily fontFamily,
        double fontSize,
        double lineSpacing,
        double paragraphSpacing,
        boolean indentParagraphs,
        double indentSize,
        double closingReserve
) {

    private static final double ADDRESS_LINE_FACTOR = 1.2;

    public Formatting {
        if (fontFamily == null) {
            throw new ConfigurationException("Font family is required.");
        }
        if (!(fontSize > 0)) {
            throw new ConfigurationException("Font size must be positive but was " + fontSize);
        }
        if (!(lineSpacing > 0)) {
            throw new ConfigurationException("Line spacing must be positive but was " + lineSpacing);
        }
        if (!(paragraphSpacing >= 0)) {
            throw new ConfigurationException("Paragraph spacing must be non-negative but was " + paragraphSpacing);
        }
        if (!(indentSize >= 0)) {
            throw new ConfigurationException("Indent size must be non-negative but was " + indentSize);
        }
        if (!(closingReserve >= 0)) {
            throw new ConfigurationException("Closing reserve must be non-negative but was " + closingReserve);
        }
    }

    public static Formatting defaults() {
        return new Formatting(FontFamily.TIMES, 11, 1.5, 12, true, 0.5, 3.0);
    }

    /**
     * @return distance between two body baselines in points
     */
    public double lineHeight() {
        return fontSize * lineSpacing;
    }

    /**
     * @return distance between two address or signature lines in points
     */
    public double addressLineHeight() {
        return fontSize * ADDRESS_LINE_FACTOR;
    }

    public Formatting withFontFamily(FontFamily family) {
        return new Formatting(family, fontSize, lineSpacing, paragraphSpacing, indentParagraphs, indentSize, closingReserve);
    }
}
