package com.company.guardian.analysis;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
@Builder
public class DeadManResult {
    boolean triggered;
    String message;
    Instant lastSuccess;
    Duration expectedInterval;
    Duration timeSinceSuccess;
    Instant deadline;
    int missedCount;

    public static DeadManResult notTriggered() {
        return DeadManResult.builder().triggered(false).build();
    }
}
