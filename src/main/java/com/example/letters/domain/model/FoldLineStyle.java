package com.example.letters.domain.model;

import com.example.letters.domain.exception.ConfigurationException;

/**
 * Appearance of the fold tick marks. Lengths are in millimetres, the stroke width in points.
 */
public record FoldLineStyle(
        double lineLengthMm,
        double marginOffsetMm,
        RgbColor color,
        double lineWidth,
        LineStyle lineStyle
) {

    public FoldLineStyle {
        if (!(lineLengthMm > 0)) {
            throw new ConfigurationException("Fold line length must be positive but was " + lineLengthMm);
        }
        if (!(marginOffsetMm >= 0)) {
            throw new ConfigurationException("Fold line offset must be non-negative but was " + marginOffsetMm);
        }
        if (!(lineWidth > 0)) {
            throw new ConfigurationException("Fold line width must be positive but was " + lineWidth);
        }
        color = color != null ? color : RgbColor.RULE_GRAY;
        lineStyle = lineStyle != null ? lineStyle : LineStyle.SOLID;
    }

    public static FoldLineStyle defaults() {
        return new FoldLineStyle(4, 3, RgbColor.fromHex("#CCCCCC"), 0.5, LineStyle.SOLID);
    }
}
