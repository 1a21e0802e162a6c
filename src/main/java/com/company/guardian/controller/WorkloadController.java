package com.company.guardian.controller;

import com.company.guardian.analysis.SlaAnalyzer;
import com.company.guardian.domain.ExecutionMetrics;
import com.company.guardian.domain.TrackedWorkload;
import com.company.guardian.domain.WorkloadRef;
import com.company.guardian.domain.monitor.SlaConfig;
import com.company.guardian.dto.request.RegisterWorkloadRequest;
import com.company.guardian.dto.response.WorkloadMetricsResponse;
import com.company.guardian.exception.WorkloadNotFoundException;
import com.company.guardian.schedule.CronSchedule;
import com.company.guardian.workload.InMemoryTrackedWorkloadProvider;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/api/v1/workloads")
@Tag(name = "Workloads", description = "Register monitored workloads and read their run statistics")
@RequiredArgsConstructor
@Slf4j
public class WorkloadController {

    private final InMemoryTrackedWorkloadProvider workloadProvider;
    private final SlaAnalyzer slaAnalyzer;
    private final Clock clock;

    @PutMapping
    @Operation(summary = "Register or update a workload", description = "Replaces the workload's schedule and monitoring policy")
    public ResponseEntity<TrackedWorkload> register(@Valid @RequestBody RegisterWorkloadRequest request) {
        // Rejects unparsable schedules up front
        CronSchedule.parse(request.getSchedule());

        TrackedWorkload workload = TrackedWorkload.builder()
                .ref(WorkloadRef.of(request.getNamespace(), request.getName()))
                .schedule(request.getSchedule())
                .timezone(request.getTimezone())
                .suspended(request.isSuspended())
                .createdAt(request.getCreatedAt() != null ? request.getCreatedAt() : clock.instant())
                .lastSuccessfulTime(request.getLastSuccessfulTime())
                .monitorName(request.getMonitorName())
                .monitor(request.getMonitor())
                .activeAlerts(request.getActiveAlerts())
                .build();

        return ResponseEntity.ok(workloadProvider.register(workload));
    }

    @GetMapping
    @Operation(summary = "List registered workloads")
    public ResponseEntity<List<TrackedWorkload>> list() {
        return ResponseEntity.ok(workloadProvider.list());
    }

    @DeleteMapping("/{namespace}/{name}")
    @Operation(summary = "Stop monitoring a workload")
    public ResponseEntity<Void> remove(@PathVariable String namespace, @PathVariable String name) {
        WorkloadRef ref = WorkloadRef.of(namespace, name);
        if (!workloadProvider.remove(ref)) {
            throw new WorkloadNotFoundException(ref);
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{namespace}/{name}/metrics")
    @Operation(summary = "Run statistics over a rolling window")
    public ResponseEntity<WorkloadMetricsResponse> metrics(
            @PathVariable String namespace,
            @PathVariable String name,
            @RequestParam(defaultValue = "" + SlaConfig.DEFAULT_WINDOW_DAYS) int windowDays) {

        WorkloadRef ref = WorkloadRef.of(namespace, name);
        if (windowDays < 1) {
            throw new IllegalArgumentException("windowDays must be at least 1");
        }

        ExecutionMetrics metrics = slaAnalyzer.getMetrics(ref, windowDays);

        return ResponseEntity.ok(WorkloadMetricsResponse.builder()
                .namespace(namespace)
                .name(name)
                .windowDays(metrics.getWindowDays())
                .totalRuns(metrics.getTotalRuns())
                .successfulRuns(metrics.getSuccessfulRuns())
                .failedRuns(metrics.getFailedRuns())
                .successRate(metrics.getSuccessRate())
                .avgDurationMs(toMillis(metrics.getAvgDuration()))
                .p50DurationMs(toMillis(metrics.getP50Duration()))
                .p95DurationMs(toMillis(metrics.getP95Duration()))
                .p99DurationMs(toMillis(metrics.getP99Duration()))
                .build());
    }

    private static Long toMillis(Duration duration) {
        return duration != null ? duration.toMillis() : null;
    }
}
