package com.example.letters.interfaces.api.error;

import java.time.Instant;
import java.util.Map;

/**
 * JSON error envelope returned by the letter endpoints.
 * {@code details} is {@code null} unless the failure carries structured data, such as the number of the
 * paragraph that could not be placed.
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        Map<String, Object> details
) {
    /**
     * Builds an envelope without details.
     *
     * @param status  HTTP status code
     * @param error   stable error code
     * @param message human readable explanation
     * @param path    request path that produced the error
     * @return error envelope stamped with the current time
     */
    public static ErrorResponse of(int status, String error, String message, String path) {
        return of(status, error, message, path, null);
    }

    /**
     * Builds an envelope that also reports structured details.
     *
     * @param details machine readable context, or {@code null} for none
     * @return error envelope stamped with the current time
     */
    public static ErrorResponse of(int status, String error, String message, String path, Map<String, Object> details) {
        return new ErrorResponse(Instant.now(), status, error, message, path, details);
    }
}
