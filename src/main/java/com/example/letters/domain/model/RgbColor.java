package com.example.letters.domain.model;

import com.example.letters.domain.exception.ConfigurationException;

import java.util.regex.Pattern;

/**
 * 8-bit RGB color parsed from {@code #RRGGBB} notation.
 */
public record RgbColor(int red, int green, int blue) {

    private static final Pattern HEX = Pattern.compile("#?[0-9a-fA-F]{6}");

    public static final RgbColor BLACK = new RgbColor(0, 0, 0);
    public static final RgbColor RULE_GRAY = new RgbColor(204, 204, 204);

    public RgbColor {
        requireChannel(red);
        requireChannel(green);
        requireChannel(blue);
    }

    /**
     * Parses a hex color such as {@code #CCCCCC}; the leading hash is optional.
     *
     * @param hex configured color
     * @return parsed color
     * @throws ConfigurationException when the value is not six hex digits
     */
    public static RgbColor fromHex(String hex) {
        if (hex == null || !HEX.matcher(hex.trim()).matches()) {
            throw new ConfigurationException("Color must be in #RRGGBB form but was " + hex);
        }
        String digits = hex.trim().startsWith("#") ? hex.trim().substring(1) : hex.trim();
        return new RgbColor(
                Integer.parseInt(digits.substring(0, 2), 16),
                Integer.parseInt(digits.substring(2, 4), 16),
                Integer.parseInt(digits.substring(4, 6), 16)
        );
    }

    public float redFraction() {
        return red / 255f;
    }

    public float greenFraction() {
        return green / 255f;
    }

    public float blueFraction() {
        return blue / 255f;
    }

    private static void requireChannel(int value) {
        if (value < 0 || value > 255) {
            throw new ConfigurationException("Color channel out of range: " + value);
        }
    }
}
