package com.example.letters.domain.model;

import com.example.letters.domain.exception.ConfigurationException;

/**
 * Page margins in inches. The bottom margin is also the lowest baseline body text may use.
 */
public record Margins(
        double top,
        double bottom,
        double left,
        double right
) {

    public Margins {
        requireNonNegative("top", top);
        requireNonNegative("bottom", bottom);
        requireNonNegative("left", left);
        requireNonNegative("right", right);
    }

    /**
     * @return margins used for windowed-envelope letters
     */
    public static Margins defaults() {
        return new Margins(1.25, 0.75, 1.25, 1.25);
    }

    private static void requireNonNegative(String name, double value) {
        if (!(value >= 0)) {
            throw new ConfigurationException("Margin '" + name + "' must be non-negative but was " + value);
        }
    }
}
