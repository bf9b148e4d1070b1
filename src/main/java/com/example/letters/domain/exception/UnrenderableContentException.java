package com.example.letters.domain.exception;

import java.util.Locale;

/**
 * Raised when a single paragraph is taller than the content area of an empty continuation page.
 * Paragraphs are never split across pages, so such a paragraph cannot be placed anywhere.
 */
public class UnrenderableContentException extends DomainException {

    private final int paragraphIndex;

    /**
     * Creates the exception for the paragraph that could not be placed.
     *
     * @param paragraphIndex zero-based index of the paragraph in the letter body
     * @param requiredPoints vertical space the paragraph needs
     * @param availablePoints vertical space of an empty continuation page
     */
    public UnrenderableContentException(int paragraphIndex, double requiredPoints, double availablePoints) {
        super(String.format(Locale.ROOT,
                "Paragraph %d needs %.1fpt but a page only offers %.1fpt; shorten or split it.",
                paragraphIndex + 1, requiredPoints, availablePoints));
        this.paragraphIndex = paragraphIndex;
    }

    public int paragraphIndex() {
        return paragraphIndex;
    }
}
