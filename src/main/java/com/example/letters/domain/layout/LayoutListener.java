package com.example.letters.domain.layout;

import com.example.letters.domain.model.PageRole;

/**
 * Receives the output of {@link LetterLayoutEngine} in document order.
 */
public interface LayoutListener {

    /**
     * Called before any text of the page is placed; the first call is for page 1.
     *
     * @param pageNumber 1-based page number
     * @param role       header role of the page
     */
    default void onPageStart(int pageNumber, PageRole role) {
    }

    default void onText(PlacedText text) {
    }

    /**
     * @return listener that ignores everything, used when only the page count matters
     */
    static LayoutListener discarding() {
        return new LayoutListener() {
        };
    }
}
