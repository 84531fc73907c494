package com.z254.horizon.domain.exception;

/**
 * Raised when a snapshot, stream or variety payload is missing required fields.
 * Malformed input is rejected, never coerced.
 */
public class SignalValidationException extends HorizonException {

    private final String field;

    public SignalValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    public static SignalValidationException missing(String field) {
        return new SignalValidationException(field, "Required field missing: " + field);
    }
}
