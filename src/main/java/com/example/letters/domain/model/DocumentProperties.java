package com.example.letters.domain.model;

import java.time.LocalDate;

/**
 * Descriptive metadata stored inside the generated document.
 */
public record DocumentProperties(
        String title,
        String author,
        String subject,
        LocalDate creationDate
) {

    /**
     * Derives the document title, author and subject from the letter.
     *
     * @param request letter being rendered
     * @return metadata for the output document
     */
    public static DocumentProperties of(LetterRequest request) {
        return new DocumentProperties(
                "Letter to " + request.recipient().name(),
                request.sender().name(),
                request.subject(),
                request.date()
        );
    }
}
