package com.example.letters.domain.model;

import java.time.LocalDate;

/**
 * A drafted letter for one recipient: free text that still contains its salutation and closing.
 * The date may be {@code null}, in which case the letter is dated on the day it is rendered.
 */
public record LetterDraft(
        Sender sender,
        Recipient recipient,
        String subject,
        String content,
        LocalDate date
) {
}
