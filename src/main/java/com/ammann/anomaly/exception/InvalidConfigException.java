/* (C)2026 */
package com.ammann.anomaly.exception;

/**
 * Malformed construction parameters for a detector or sample source.
 *
 * <p>Fatal to construction: the instance being built is never created.
 * Mapped to HTTP 400 by {@link GlobalExceptionHandler} like any other
 * {@link ValidationException}.
 */
public class InvalidConfigException extends ValidationException {

    public InvalidConfigException(String message) {
        super(message);
    }

    /**
     * Creates a config exception for a parameter outside its allowed range.
     */
    public static InvalidConfigException outOfRange(String paramName, Object value, String expected) {
        return new InvalidConfigException(
                String.format("Invalid configuration '%s': got '%s', expected %s",
                        paramName, value, expected));
    }
}
