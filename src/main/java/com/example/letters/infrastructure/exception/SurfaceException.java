package com.example.letters.infrastructure.exception;

/**
 * Infrastructure-layer exception that signals PDFBox failed while drawing, measuring or saving a letter.
 * Never retried: it points at an IO problem outside the layout core.
 */
public class SurfaceException extends InfrastructureException {

    /**
     * Creates the exception with a contextual message and the root cause from PDFBox.
     *
     * @param message description shared with the application layer
     * @param cause   low-level PDFBox exception
     */
    public SurfaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
