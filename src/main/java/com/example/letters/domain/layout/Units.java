package com.example.letters.domain.layout;

/**
 * Conversions from configuration units to points (1/72 inch).
 */
public final class Units {

    public static final double POINTS_PER_INCH = 72.0;
    public static final double POINTS_PER_MILLIMETER = POINTS_PER_INCH / 25.4;

    private Units() {
    }

    public static double inches(double value) {
        return value * POINTS_PER_INCH;
    }

    public static double millimeters(double value) {
        return value * POINTS_PER_MILLIMETER;
    }
}
