package com.company.guardian.exception;

public class AlertSendException extends GuardianException {

    public AlertSendException(String message) {
        super(message);
    }

    public AlertSendException(String message, Throwable cause) {
        super(message, cause);
    }
}
