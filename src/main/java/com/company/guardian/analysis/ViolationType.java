package com.company.guardian.analysis;

/**
 * SLA violation kinds; the code is the last segment of the alert dedup key.
 */
public enum ViolationType {
    SUCCESS_RATE("SuccessRate"),
    MAX_DURATION("MaxDuration");

    private final String code;

    ViolationType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
