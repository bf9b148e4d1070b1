package com.example.letters.domain.layout;

/**
 * What a placed line of text belongs to.
 */
public enum TextRole {
    RETURN_ADDRESS,
    DATE,
    RECIPIENT_ADDRESS,
    SUBJECT,
    SALUTATION,
    HEADING,
    BODY,
    CLOSING,
    SIGNATURE
}
