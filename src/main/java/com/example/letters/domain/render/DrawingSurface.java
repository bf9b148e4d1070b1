package com.example.letters.domain.render;

import com.example.letters.domain.model.FontFace;
import com.example.letters.domain.model.LineStyle;
import com.example.letters.domain.model.RgbColor;

/**
 * Target of the page renderer. Coordinates are in points with the origin at the bottom-left corner
 * of the page; callers convert from top-down layout positions before drawing.
 * <p>
 * A surface belongs to a single render call and is not safe for concurrent use.
 */
public interface DrawingSurface extends AutoCloseable {

    /**
     * Starts a new page; the first call starts page 1. Drawing before the first call is an error.
     */
    void newPage();

    void drawText(double x, double y, String text, FontFace face, double size, RgbColor color);

    void drawLine(double x1, double y1, double x2, double y2, RgbColor color, double width, LineStyle style);

    /**
     * @return number of pages started so far
     */
    int pageCount();

    /**
     * Completes the document.
     *
     * @return serialized document
     */
    byte[] finish();

    /**
     * Releases the surface's buffers; safe to call after {@link #finish()} and on error paths.
     */
    @Override
    void close();
}
