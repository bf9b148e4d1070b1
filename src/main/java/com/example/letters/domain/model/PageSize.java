package com.example.letters.domain.model;

import com.example.letters.domain.exception.ConfigurationException;

/**
 * Physical page size in inches.
 */
public record PageSize(double width, double height) {

    public static final PageSize US_LETTER = new PageSize(8.5, 11);

    public PageSize {
        if (!(width > 0) || !(height > 0)) {
            throw new ConfigurationException("Page size must be positive but was " + width + "x" + height);
        }
    }
}
