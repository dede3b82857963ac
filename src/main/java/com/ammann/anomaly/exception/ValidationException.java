/* (C)2026 */
package com.ammann.anomaly.exception;

/**
 * Exception indicating that a client-supplied parameter or value does not meet
 * the required constraints for the requested operation.
 *
 * <p>Mapped to HTTP 400 (Bad Request) by {@link GlobalExceptionHandler}.
 * Provides factory methods for common validation failure patterns.
 */
public class ValidationException extends ApiException {

    public ValidationException(String message) {
        super(message, null);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Creates validation exception for invalid parameter.
     */
    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
                String.format("Invalid parameter '%s': got '%s', expected %s",
                        paramName, value, expected));
    }

    /**
     * Creates validation exception for a stream id that is already registered.
     */
    public static ValidationException duplicateStream(String streamId) {
        return new ValidationException(
                String.format("Stream '%s' already exists", streamId));
    }
}
