package com.example.letters.domain.model;

import com.example.letters.domain.exception.ConfigurationException;

/**
 * Position of the date line in inches from the top-left corner.
 * With {@link DateAlignment#RIGHT} the {@code x} value is ignored.
 */
public record DatePosition(
        double x,
        double y,
        DateAlignment alignment
) {

    public DatePosition {
        if (!(x >= 0) || !(y >= 0)) {
            throw new ConfigurationException("Date position must be non-negative: (" + x + ", " + y + ")");
        }
        if (alignment == null) {
            alignment = DateAlignment.LEFT;
        }
    }

    public static DatePosition defaults() {
        return new DatePosition(4.875, 1.7, DateAlignment.RIGHT);
    }
}
