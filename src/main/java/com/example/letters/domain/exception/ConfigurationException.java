package com.example.letters.domain.exception;

/**
 * Raised when a layout configuration value (margins, address boxes, formatting, colors) is invalid.
 * Thrown eagerly while the configuration records are constructed, never in the middle of a render.
 */
public class ConfigurationException extends DomainException {

    /**
     * Creates the exception with the violated invariant.
     *
     * @param message description of the offending value
     */
    public ConfigurationException(String message) {
        super(message);
    }
}
