package com.example.letters.domain.model;

import com.example.letters.domain.exception.ConfigurationException;

/**
 * Box in inches, measured from the top-left corner of the page, that holds an address block.
 * The height is optional; without it the box is treated as a single horizontal edge.
 */
public record AddressPosition(
        double x,
        double y,
        double width,
        Double height
) {

    public AddressPosition {
        if (!(x >= 0) || !(y >= 0)) {
            throw new ConfigurationException("Address box origin must be non-negative: (" + x + ", " + y + ")");
        }
        if (!(width > 0)) {
            throw new ConfigurationException("Address box width must be positive but was " + width);
        }
        if (height != null && !(height > 0)) {
            throw new ConfigurationException("Address box height must be positive when set but was " + height);
        }
    }

    public static AddressPosition returnAddressDefaults() {
        return new AddressPosition(0.5, 0.625, 3.5, 1.0);
    }

    public static AddressPosition recipientAddressDefaults() {
        return new AddressPosition(0.75, 2.0625, 4.0, 1.125);
    }

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + (height != null ? height : 0);
    }

    /**
     * Checks whether two boxes share any area (touching edges do not count).
     *
     * @param other box to compare with
     * @return {@code true} when the boxes overlap
     */
    public boolean overlaps(AddressPosition other) {
        boolean horizontal = x < other.right() && other.x() < right();
        boolean vertical = y < other.bottom() && other.y() < bottom();
        return horizontal && vertical;
    }
}
