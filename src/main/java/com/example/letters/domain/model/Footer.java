package com.example.letters.domain.model;

import com.example.letters.domain.exception.ConfigurationException;

/**
 * Footer drawn identically on every page; the default centre template is {@code Page {page} of {total}}.
 */
public record Footer(
        boolean enabled,
        String left,
        String center,
        String right,
        double fontSize,
        RgbColor color,
        boolean ruleAbove
) {

    public Footer {
        left = left != null ? left : "";
        center = center != null ? center : "";
        right = right != null ? right : "";
        color = color != null ? color : RgbColor.fromHex("#666666");
        if (!(fontSize > 0)) {
            throw new ConfigurationException("Footer font size must be positive but was " + fontSize);
        }
    }

    public static Footer defaults() {
        return new Footer(true, "", "Page {page} of {total}", "", 10, RgbColor.fromHex("#666666"), true);
    }

    public Footer withEnabled(boolean value) {
        return new Footer(value, left, center, right, fontSize, color, ruleAbove);
    }
}
