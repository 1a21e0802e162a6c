package com.company.guardian.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkloadMetricsResponse {
    private String namespace;
    private String name;
    private int windowDays;
    private int totalRuns;
    private int successfulRuns;
    private int failedRuns;
    private double successRate;
    private Long avgDurationMs;
    private Long p50DurationMs;
    private Long p95DurationMs;
    private Long p99DurationMs;
}
