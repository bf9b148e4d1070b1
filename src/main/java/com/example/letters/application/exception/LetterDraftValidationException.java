package com.example.letters.application.exception;

/**
 * Thrown when drafted letter text cannot be turned into a letter (empty text, no body between the
 * salutation and the closing).
 */
public class LetterDraftValidationException extends UseCaseValidationException {

    /**
     * @param message validation message suitable for display
     */
    public LetterDraftValidationException(String message) {
        super(message);
    }
}
