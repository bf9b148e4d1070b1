package com.example.letters.domain.exception;

/**
 * Raised when a letter request is missing one of the parts every letter needs (sender, recipient, date).
 */
public class LetterRequestException extends DomainException {

    public LetterRequestException(String message) {
        super(message);
    }
}
