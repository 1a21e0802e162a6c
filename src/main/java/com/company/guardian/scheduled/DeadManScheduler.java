package com.company.guardian.scheduled;

import com.company.guardian.alerting.AlertContext;
import com.company.guardian.alerting.AlertKeys;
import com.company.guardian.analysis.DeadManResult;
import com.company.guardian.analysis.SlaAnalyzer;
import com.company.guardian.config.GuardianProperties;
import com.company.guardian.domain.TrackedWorkload;
import com.company.guardian.domain.WorkloadRef;
import com.company.guardian.domain.enums.AlertType;
import com.company.guardian.domain.monitor.DeadManSwitchConfig;
import com.company.guardian.domain.monitor.MonitorConfig;
import com.company.guardian.domain.monitor.SuspendedHandlingConfig;
import com.company.guardian.exception.InsufficientHistoryException;
import com.company.guardian.exception.InvalidScheduleException;
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
import java.util.List;
import java.util.stream.Collectors;

/**
 * Raises DeadManTriggered when a workload has gone too long without a successful run, and
 * SuspendedTooLong when it has been suspended past its threshold.
 */
@Component
@Slf4j
public class DeadManScheduler extends PeriodicCoordinator {

    private final TrackedWorkloadProvider workloadProvider;
    private final SlaAnalyzer slaAnalyzer;
    private final MaintenanceWindowEvaluator maintenanceWindows;
    private final SuspensionTracker suspensionTracker;
    private final WorkloadAlerts workloadAlerts;
    private final GuardianProperties properties;
    private final Clock clock;

    public DeadManScheduler(TrackedWorkloadProvider workloadProvider,
                            SlaAnalyzer slaAnalyzer,
                            MaintenanceWindowEvaluator maintenanceWindows,
                            SuspensionTracker suspensionTracker,
                            WorkloadAlerts workloadAlerts,
                            GuardianProperties properties,
                            Clock clock,
                            TaskScheduler taskScheduler,
                            MeterRegistry meterRegistry) {
        super(taskScheduler, meterRegistry);
        this.workloadProvider = workloadProvider;
        this.slaAnalyzer = slaAnalyzer;
        this.maintenanceWindows = maintenanceWindows;
        this.suspensionTracker = suspensionTracker;
        this.workloadAlerts = workloadAlerts;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    protected String name() {
        return "dead-man";
    }

    @Override
    protected Duration interval() {
        return properties.getScheduler().getDeadManInterval();
    }

    @Override
    protected Duration startupGracePeriod() {
        return properties.getScheduler().getStartupGracePeriod();
    }

    @Override
    protected void tick() {
        List<TrackedWorkload> workloads = workloadProvider.list();
        suspensionTracker.retainOnly(workloads.stream().map(TrackedWorkload::getRef).collect(Collectors.toList()));

        for (TrackedWorkload workload : workloads) {
            try {
                evaluate(workload);
            } catch (InsufficientHistoryException e) {
                log.debug("Dead-man check skipped for {}: {}", workload.getRef(), e.getMessage());
            } catch (InvalidScheduleException e) {
                log.warn("Dead-man check skipped for {}: {}", workload.getRef(), e.getMessage());
            } catch (DataAccessException e) {
                log.warn("Dead-man check for {} failed reading history", workload.getRef(), e);
            } catch (Exception e) {
                log.error("Dead-man check failed for {}", workload.getRef(), e);
            }
        }
    }

    private void evaluate(TrackedWorkload workload) {
        MonitorConfig monitor = workload.getMonitor();
        if (monitor == null) {
            return;
        }
        Instant now = clock.instant();

        checkSuspension(workload, monitor, now);

        if (workload.isSuspended() && monitor.pausesWhenSuspended()) {
            log.debug("Workload {} suspended, dead-man check paused", workload.getRef());
            return;
        }

        DeadManSwitchConfig deadMan = monitor.getDeadManSwitch();
        if (deadMan == null || !deadMan.isEnabled()) {
            return;
        }

        if (maintenanceWindows.isInMaintenanceWindow(monitor.getMaintenanceWindows(), now, workload.getTimezone())) {
            log.debug("Workload {} in maintenance window, dead-man check skipped", workload.getRef());
            return;
        }

        DeadManResult result = slaAnalyzer.checkDeadManSwitch(workload, deadMan);
        WorkloadRef ref = workload.getRef();
        String key = AlertKeys.of(ref, AlertType.DEAD_MAN_TRIGGERED);

        if (result.isTriggered()) {
            AlertContext context = new AlertContext();
            context.getMetrics().put("missedCount", result.getMissedCount());
            if (result.getTimeSinceSuccess() != null) {
                context.getMetrics().put("timeSinceSuccess", TimeUtils.formatDuration(result.getTimeSinceSuccess()));
            }
            workloadAlerts.raise(workload, workloadAlerts.build(workload, AlertType.DEAD_MAN_TRIGGERED, key,
                    "Dead-man's switch triggered: " + ref, result.getMessage(), context));
        } else {
            workloadAlerts.resolve(workload, AlertType.DEAD_MAN_TRIGGERED, key);
        }
    }

    private void checkSuspension(TrackedWorkload workload, MonitorConfig monitor, Instant now) {
        SuspendedHandlingConfig handling = monitor.getSuspendedHandling();
        if (handling == null || handling.getAlertIfSuspendedFor() == null) {
            return;
        }

        WorkloadRef ref = workload.getRef();
        Duration threshold = handling.getAlertIfSuspendedFor();
        String key = AlertKeys.of(ref, AlertType.SUSPENDED_TOO_LONG);

        SuspensionObservation observation = suspensionTracker.observe(ref, workload.isSuspended(), threshold, now);
        if (observation == SuspensionObservation.SUSPENDED_TOO_LONG) {
            Duration suspendedFor = suspensionTracker.suspendedSince(ref)
                    .map(since -> Duration.between(since, now))
                    .orElse(threshold);
            String message = String.format("Workload has been suspended for %s (threshold: %s)",
                    TimeUtils.formatDuration(suspendedFor), TimeUtils.formatDuration(threshold));
            workloadAlerts.raise(workload, workloadAlerts.build(workload, AlertType.SUSPENDED_TOO_LONG, key,
                    "Workload suspended for too long: " + ref, message, null));
        } else if (observation == SuspensionObservation.RESUMED) {
            workloadAlerts.resolve(workload, AlertType.SUSPENDED_TOO_LONG, key);
        }
    }
}
