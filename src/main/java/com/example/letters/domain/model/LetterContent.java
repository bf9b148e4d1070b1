package com.example.letters.domain.model;

import java.util.List;

/**
 * Drafted letter text split into its salutation, body paragraphs and closing phrase.
 */
public record LetterContent(
        String salutation,
        List<String> paragraphs,
        String closing
) {

    public LetterContent {
        paragraphs = paragraphs != null ? List.copyOf(paragraphs) : List.of();
    }
}
