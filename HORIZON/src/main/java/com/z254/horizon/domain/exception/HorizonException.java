package com.z254.horizon.domain.exception;

/**
 * Base exception for HORIZON failures.
 */
public class HorizonException extends RuntimeException {

    public HorizonException(String message) {
        super(message);
    }

    public HorizonException(String message, Throwable cause) {
        super(message, cause);
    }
}
