package com.company.guardian.exception;

import lombok.Getter;

@Getter
public class InvalidScheduleException extends GuardianException {

    private final String schedule;

    public InvalidScheduleException(String schedule, Throwable cause) {
        super("Invalid schedule '" + schedule + "': " + (cause != null ? cause.getMessage() : "unparsable"), cause);
        this.schedule = schedule;
    }

    public InvalidScheduleException(String schedule, String reason) {
        super("Invalid schedule '" + schedule + "': " + reason);
        this.schedule = schedule;
    }
}
