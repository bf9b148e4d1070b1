package com.example.letters.interfaces.api.dto;

import com.example.letters.domain.model.LetterRequest;

import java.time.LocalDate;
import java.util.List;

/**
 * API-layer DTO for a fully structured letter. A missing date means "today".
 */
public record LetterPdfRequest(
        SenderPayload sender,
        RecipientPayload recipient,
        String subject,
        String salutation,
        List<String> paragraphs,
        String closing,
        LocalDate date
) {

    /**
     * Maps the payload to the domain request.
     *
     * @param fallbackDate date used when the payload carries none
     * @return domain request
     * @throws com.example.letters.domain.exception.LetterRequestException when sender or recipient is missing
     */
    public LetterRequest toDomain(LocalDate fallbackDate) {
        return new LetterRequest(
                sender != null ? sender.toDomain() : null,
                recipient != null ? recipient.toDomain() : null,
                subject,
                salutation,
                paragraphs,
                closing,
                date != null ? date : fallbackDate
        );
    }
}
