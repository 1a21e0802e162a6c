package com.company.guardian.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of detection the engine can raise. The code is the stable name used in dedup keys
 * and persisted alert history.
 */
public enum AlertType {
    JOB_FAILED("JobFailed", Severity.WARNING),
    DEAD_MAN_TRIGGERED("DeadManTriggered", Severity.CRITICAL),
    SUSPENDED_TOO_LONG("SuspendedTooLong", Severity.WARNING),
    SLA_BREACHED("SLABreached", Severity.WARNING),
    DURATION_REGRESSION("DurationRegression", Severity.WARNING),
    STUCK_JOB("StuckJob", Severity.WARNING),
    TEST("Test", Severity.INFO);

    private final String code;
    private final Severity defaultSeverity;

    AlertType(String code, Severity defaultSeverity) {
        this.code = code;
        this.defaultSeverity = defaultSeverity;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public Severity getDefaultSeverity() {
        return defaultSeverity;
    }

    @JsonCreator
    public static AlertType fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (AlertType type : values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown alert type: " + code);
    }
}
