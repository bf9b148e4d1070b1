package com.example.letters.domain.model;

import com.example.letters.domain.exception.ConfigurationException;

import java.util.Locale;

/**
 * Horizontal placement of the letter date.
 * {@code RIGHT} aligns the date flush with the recipient box's right edge.
 */
public enum DateAlignment {
    LEFT,
    CENTER,
    RIGHT;

    /**
     * Parses a configuration value such as {@code "right"}.
     *
     * @param rawValue alignment name, case-insensitive
     * @return matching alignment
     * @throws ConfigurationException when the value is not one of left, center, right
     */
    public static DateAlignment fromString(String rawValue) {
        if (rawValue == null) {
            throw new ConfigurationException("Date alignment is required.");
        }
        try {
            return DateAlignment.valueOf(rawValue.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Unsupported date alignment: " + rawValue);
        }
    }
}
