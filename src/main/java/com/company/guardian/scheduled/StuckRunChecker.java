package com.company.guardian.scheduled;

import com.company.guardian.alerting.AlertContext;
import com.company.guardian.alerting.AlertKeys;
import com.company.guardian.config.GuardianProperties;
import com.company.guardian.domain.ExecutionRecord;
import com.company.guardian.domain.TrackedWorkload;
import com.company.guardian.domain.WorkloadRef;
import com.company.guardian.domain.enums.AlertType;
import com.company.guardian.domain.monitor.MonitorConfig;
import com.company.guardian.domain.monitor.StuckRunConfig;
import com.company.guardian.repository.ExecutionStore;
import com.company.guardian.schedule.MaintenanceWindowEvaluator;
import com.company.guardian.util.TimeUtils;
import com.company.guardian.workload.TrackedWorkloadProvider;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Raises StuckJob when a run of a workload has been in progress longer than its configured
 * limit. Detection only; stuck runs are never terminated.
 */
@Component
@Slf4j
public class StuckRunChecker extends PeriodicCoordinator {

    private final TrackedWorkloadProvider workloadProvider;
    private final ExecutionStore store;
    private final MaintenanceWindowEvaluator maintenanceWindows;
    private final WorkloadAlerts workloadAlerts;
    private final GuardianProperties properties;
    private final Clock clock;

    public StuckRunChecker(TrackedWorkloadProvider workloadProvider,
                           ExecutionStore store,
                           MaintenanceWindowEvaluator maintenanceWindows,
                           WorkloadAlerts workloadAlerts,
                           GuardianProperties properties,
                           Clock clock,
                           TaskScheduler taskScheduler,
                           MeterRegistry meterRegistry) {
        super(taskScheduler, meterRegistry);
        this.workloadProvider = workloadProvider;
        this.store = store;
        this.maintenanceWindows = maintenanceWindows;
        this.workloadAlerts = workloadAlerts;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    protected String name() {
        return "stuck-run";
    }

    @Override
    protected Duration interval() {
        return properties.getScheduler().getStuckCheckInterval();
    }

    @Override
    protected Duration startupGracePeriod() {
        return properties.getScheduler().getStartupGracePeriod();
    }

    @Override
    protected void tick() {
        for (TrackedWorkload workload : workloadProvider.list()) {
            try {
                check(workload);
            } catch (DataAccessException e) {
                log.warn("Stuck-run check for {} failed reading executions", workload.getRef(), e);
            } catch (Exception e) {
                log.error("Stuck-run check failed for {}", workload.getRef(), e);
            }
        }
    }

    private void check(TrackedWorkload workload) {
        MonitorConfig monitor = workload.getMonitor();
        if (monitor == null) {
            return;
        }
        StuckRunConfig stuckRun = monitor.getStuckRun();
        if (stuckRun == null || !stuckRun.isEnabled() || stuckRun.getAfterDuration() == null) {
            return;
        }
        if (workload.isSuspended() && monitor.pausesWhenSuspended()) {
            log.debug("Workload {} suspended, stuck-run check paused", workload.getRef());
            return;
        }
        Instant now = clock.instant();
        if (maintenanceWindows.isInMaintenanceWindow(monitor.getMaintenanceWindows(), now, workload.getTimezone())) {
            log.debug("Workload {} in maintenance window, stuck-run check skipped", workload.getRef());
            return;
        }

        WorkloadRef ref = workload.getRef();
        Duration threshold = stuckRun.getAfterDuration();
        String key = AlertKeys.of(ref, AlertType.STUCK_JOB);

        // Oldest running execution decides
        List<ExecutionRecord> running = store.getRunningExecutions(ref);
        Optional<ExecutionRecord> stuck = running.stream()
                .filter(e -> Duration.between(e.getStartTime(), now).compareTo(threshold) > 0)
                .min(Comparator.comparing(ExecutionRecord::getStartTime));

        if (stuck.isEmpty()) {
            workloadAlerts.resolve(workload, AlertType.STUCK_JOB, key);
            return;
        }

        ExecutionRecord execution = stuck.get();
        Duration runningFor = Duration.between(execution.getStartTime(), now);
        String message = String.format("Job has been running for %s (threshold: %s)",
                TimeUtils.formatDuration(runningFor), TimeUtils.formatDuration(threshold));

        AlertContext context = new AlertContext();
        context.getMetrics().put("executionId", execution.getId());
        if (execution.getRunName() != null) {
            context.getMetrics().put("runName", execution.getRunName());
        }
        context.getMetrics().put("runningFor", TimeUtils.formatDuration(runningFor));

        workloadAlerts.raise(workload, workloadAlerts.build(workload, AlertType.STUCK_JOB, key,
                "Stuck job detected: " + ref, message, context));
    }
}
