package com.example.letters.domain.model;

/**
 * Closed set of faces the layout engine may ask a surface to draw with.
 */
public enum FontFace {
    TIMES_ROMAN,
    TIMES_BOLD,
    HELVETICA,
    HELVETICA_BOLD,
    COURIER,
    COURIER_BOLD
}
