package com.company.guardian.domain.monitor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuspendedHandlingConfig {
    private Boolean pauseMonitoring;

    // No suspended-too-long alerting when null
    private Duration alertIfSuspendedFor;

    public boolean isPauseMonitoring() {
        return pauseMonitoring == null || pauseMonitoring;
    }
}
