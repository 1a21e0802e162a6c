package com.company.guardian.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Rolling-window statistics for a workload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionMetrics {
    private int windowDays;
    private int totalRuns;
    private int successfulRuns;
    private int failedRuns;

    // Percentage in [0, 100]
    private double successRate;

    private Duration avgDuration;
    private Duration p50Duration;
    private Duration p95Duration;
    private Duration p99Duration;
}
