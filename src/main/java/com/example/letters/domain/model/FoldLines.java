package com.example.letters.domain.model;

import com.example.letters.domain.exception.ConfigurationException;

import java.util.List;

/**
 * Tri-fold tick marks drawn near both page edges at the given offsets (inches from the top).
 */
public record FoldLines(
        boolean enabled,
        List<Double> positions,
        FoldLineStyle style
) {

    public FoldLines {
        positions = positions != null ? List.copyOf(positions) : List.of();
        style = style != null ? style : FoldLineStyle.defaults();
        for (Double position : positions) {
            if (!(position >= 0)) {
                throw new ConfigurationException("Fold line position must be non-negative but was " + position);
            }
        }
    }

    public static FoldLines defaults() {
        return new FoldLines(true, List.of(3.67, 7.33), FoldLineStyle.defaults());
    }

    public static FoldLines disabled() {
        return new FoldLines(false, List.of(), FoldLineStyle.defaults());
    }
}
