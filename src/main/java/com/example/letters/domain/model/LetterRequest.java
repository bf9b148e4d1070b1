package com.example.letters.domain.model;

import com.example.letters.domain.exception.LetterRequestException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything needed to lay out one letter. Body paragraphs are plain strings in reading order.
 */
public record LetterRequest(
        Sender sender,
        Recipient recipient,
        String subject,
        String salutation,
        List<String> paragraphs,
        String closing,
        LocalDate date
) {

    public static final String DEFAULT_CLOSING = "Respectfully";

    public LetterRequest {
        if (sender == null) {
            throw new LetterRequestException("Sender is required.");
        }
        if (recipient == null) {
            throw new LetterRequestException("Recipient is required.");
        }
        if (date == null) {
            throw new LetterRequestException("Letter date is required.");
        }
        subject = subject == null ? "" : subject.strip();
        salutation = salutation == null ? "" : salutation.strip();
        closing = closing == null || closing.isBlank() ? DEFAULT_CLOSING : closing.strip();
        paragraphs = copyParagraphs(paragraphs);
    }

    private static List<String> copyParagraphs(List<String> paragraphs) {
        if (paragraphs == null) {
            return List.of();
        }
        List<String> copy = new ArrayList<>(paragraphs.size());
        for (String paragraph : paragraphs) {
            copy.add(paragraph == null ? "" : paragraph);
        }
        return Collections.unmodifiableList(copy);
    }
}
