package com.example.letters.domain.model;

/**
 * Finished PDF bytes together with the number of pages they contain.
 */
public record RenderedLetter(
        byte[] content,
        int pageCount
) {
}
