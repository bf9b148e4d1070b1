package com.example.letters.domain.model;

import com.example.letters.domain.exception.ConfigurationException;

import java.util.Locale;

public enum LineStyle {
    SOLID,
    DASHED;

    public static LineStyle fromString(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return SOLID;
        }
        try {
            return valueOf(rawValue.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Unsupported fold line style: " + rawValue);
        }
    }
}
