package com.example.letters.domain.model;

import com.example.letters.domain.exception.ConfigurationException;

/**
 * Named font families available for letters, each with a regular and an emphasized face.
 */
public enum FontFamily {
    TIMES("Times-Roman", FontFace.TIMES_ROMAN, FontFace.TIMES_BOLD),
    HELVETICA("Helvetica", FontFace.HELVETICA, FontFace.HELVETICA_BOLD),
    COURIER("Courier", FontFace.COURIER, FontFace.COURIER_BOLD);

    private final String familyName;
    private final FontFace regular;
    private final FontFace emphasized;

    FontFamily(String familyName, FontFace regular, FontFace emphasized) {
        this.familyName = familyName;
        this.regular = regular;
        this.emphasized = emphasized;
    }

    public String familyName() {
        return familyName;
    }

    public FontFace regular() {
        return regular;
    }

    public FontFace emphasized() {
        return emphasized;
    }

    /**
     * Resolves a family from its display name ({@code Times-Roman}) or enum name ({@code TIMES}).
     *
     * @param rawValue configured family name
     * @return matching family
     * @throws ConfigurationException when the name is unknown
     */
    public static FontFamily fromName(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new ConfigurationException("Font family is required.");
        }
        String value = rawValue.trim();
        for (FontFamily family : values()) {
            if (family.familyName.equalsIgnoreCase(value) || family.name().equalsIgnoreCase(value)) {
                return family;
            }
        }
        throw new ConfigurationException("Unsupported font family: " + rawValue);
    }
}
