package com.company.guardian.exception;

public class ExecutionNotFoundException extends GuardianException {
    public ExecutionNotFoundException(Long executionId) {
        super("Execution not found: " + executionId);
    }
}
