package com.apilifecycle.policy;

/**
 * Thrown when a date input cannot be turned into an absolute instant.
 * Raised at policy construction or configuration binding, never while evaluating.
 */
public class DateParseException extends IllegalArgumentException {

    public DateParseException(String message) {
        super(message);
    }

    public DateParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
