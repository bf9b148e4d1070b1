package com.example.letters.domain.layout;

import com.example.letters.domain.model.PageSize;

/**
 * Converts top-down layout coordinates into the bottom-up user space of a drawing surface.
 * This is the only place where the origin flips.
 */
public record PageCoordinates(double pageWidth, double pageHeight) {

    public static PageCoordinates of(PageSize pageSize) {
        return new PageCoordinates(Units.inches(pageSize.width()), Units.inches(pageSize.height()));
    }

    public double toSurfaceY(double fromTop) {
        return pageHeight - fromTop;
    }
}
