package com.company.guardian.domain;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.time.Instant;

/**
 * One run of a tracked workload. Immutable; completion produces a new instance.
 */
@Value
@Builder
public class ExecutionRecord {
    Long id;
    WorkloadRef workload;
    String runName;
    Instant startTime;
    @With
    Instant completionTime;
    @With
    Boolean succeeded;
    @With
    Integer exitCode;
    @With
    String reason;

    public boolean isRunning() {
        return completionTime == null;
    }

    public boolean isSuccessful() {
        return Boolean.TRUE.equals(succeeded);
    }

    /**
     * Wall-clock duration of a completed run, or null while running.
     */
    public Duration getDuration() {
        if (startTime == null || completionTime == null) {
            return null;
        }
        return Duration.between(startTime, completionTime);
    }
}
