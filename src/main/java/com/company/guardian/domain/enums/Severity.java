package com.company.guardian.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    INFO("info"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String code;

    Severity(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Parses request and configuration input.
     *
     * @throws IllegalArgumentException for a missing or unknown severity
     */
    @JsonCreator
    public static Severity fromString(String severity) {
        if (severity == null || severity.isBlank()) {
            throw new IllegalArgumentException("Severity is required");
        }
        for (Severity value : values()) {
            if (value.code.equalsIgnoreCase(severity.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + severity);
    }

    /**
     * Reads stored values, where an unreadable severity falls back to warning.
     */
    public static Severity fromStoredValue(String severity) {
        try {
            return fromString(severity);
        } catch (IllegalArgumentException e) {
            return WARNING;
        }
    }
}
