/* (C)2026 */
package com.ammann.anomaly.exception;

/**
 * A sample that cannot enter the sliding window (NaN, infinite or missing).
 *
 * <p>Only the offending sample is rejected; the window and the statistic stay
 * exactly as they were before the call and the stream keeps running.
 */
public class InvalidInputException extends ValidationException {

    private final Double rejectedValue;

    public InvalidInputException(String message, Double rejectedValue) {
        super(message);
        this.rejectedValue = rejectedValue;
    }

    /**
     * Creates an input exception for a non-finite sample.
     */
    public static InvalidInputException nonFinite(double sample) {
        return new InvalidInputException(
                String.format("Invalid sample: got '%s', expected a finite number", sample),
                sample);
    }

    /**
     * Creates an input exception for a missing sample.
     */
    public static InvalidInputException missing() {
        return new InvalidInputException("Invalid sample: value is missing", null);
    }

    /** The rejected value, or {@code null} if the sample was missing. */
    public Double getRejectedValue() {
        return rejectedValue;
    }
}
