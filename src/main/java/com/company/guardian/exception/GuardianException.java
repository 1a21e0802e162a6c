package com.company.guardian.exception;

/**
 * Base type for errors raised by the guardian engine.
 */
public class GuardianException extends RuntimeException {

    public GuardianException(String message) {
        super(message);
    }

    public GuardianException(String message, Throwable cause) {
        super(message, cause);
    }
}
