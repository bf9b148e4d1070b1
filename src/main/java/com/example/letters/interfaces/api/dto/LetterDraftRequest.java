package com.example.letters.interfaces.api.dto;

import com.example.letters.domain.model.LetterDraft;

import java.time.LocalDate;

/**
 * API-layer DTO for a drafted letter whose text still contains its salutation and closing.
 */
public record LetterDraftRequest(
        SenderPayload sender,
        RecipientPayload recipient,
        String subject,
        String content,
        LocalDate date
) {

    public LetterDraft toDomain() {
        return new LetterDraft(
                sender != null ? sender.toDomain() : null,
                recipient != null ? recipient.toDomain() : null,
                subject,
                content,
                date
        );
    }
}
