package com.company.guardian.scheduled;

import com.company.guardian.alerting.AlertContext;
import com.company.guardian.alerting.AlertKeys;
import com.company.guardian.analysis.RegressionResult;
import com.company.guardian.analysis.SlaAnalyzer;
import com.company.guardian.analysis.SlaResult;
import com.company.guardian.analysis.SlaViolation;
import com.company.guardian.analysis.ViolationType;
import com.company.guardian.config.GuardianProperties;
import com.company.guardian.domain.ExecutionMetrics;
import com.company.guardian.domain.TrackedWorkload;
import com.company.guardian.domain.WorkloadRef;
import com.company.guardian.domain.enums.AlertType;
import com.company.guardian.domain.monitor.MonitorConfig;
import com.company.guardian.domain.monitor.SlaConfig;
import com.company.guardian.exception.InsufficientHistoryException;
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

/**
 * Re-evaluates success rate, max duration and P95 regression for every workload with an SLA
 * policy. Only runs while this replica holds leadership.
 */
@Component
@Slf4j
public class SlaRecalculationScheduler extends PeriodicCoordinator {

    private final TrackedWorkloadProvider workloadProvider;
    private final SlaAnalyzer slaAnalyzer;
    private final MaintenanceWindowEvaluator maintenanceWindows;
    private final WorkloadAlerts workloadAlerts;
    private final LeadershipGate leadershipGate;
    private final GuardianProperties properties;
    private final Clock clock;

    public SlaRecalculationScheduler(TrackedWorkloadProvider workloadProvider,
                                     SlaAnalyzer slaAnalyzer,
                                     MaintenanceWindowEvaluator maintenanceWindows,
                                     WorkloadAlerts workloadAlerts,
                                     LeadershipGate leadershipGate,
                                     GuardianProperties properties,
                                     Clock clock,
                                     TaskScheduler taskScheduler,
                                     MeterRegistry meterRegistry) {
        super(taskScheduler, meterRegistry);
        this.workloadProvider = workloadProvider;
        this.slaAnalyzer = slaAnalyzer;
        this.maintenanceWindows = maintenanceWindows;
        this.workloadAlerts = workloadAlerts;
        this.leadershipGate = leadershipGate;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    protected String name() {
        return "sla-recalculation";
    }

    @Override
    protected Duration interval() {
        return properties.getScheduler().getSlaRecalculationInterval();
    }

    @Override
    protected Duration startupGracePeriod() {
        return properties.getScheduler().getStartupGracePeriod();
    }

    @Override
    protected void tick() {
        if (!leadershipGate.isLeader()) {
            log.debug("Not leader, skipping SLA recalculation");
            return;
        }

        for (TrackedWorkload workload : workloadProvider.list()) {
            try {
                recalculate(workload);
            } catch (DataAccessException e) {
                log.warn("SLA recalculation for {} failed reading history", workload.getRef(), e);
            } catch (Exception e) {
                log.error("SLA recalculation failed for {}", workload.getRef(), e);
            }
        }
    }

    private void recalculate(TrackedWorkload workload) {
        MonitorConfig monitor = workload.getMonitor();
        if (monitor == null || monitor.getSla() == null || !monitor.getSla().isEnabled()) {
            return;
        }
        if (workload.isSuspended() && monitor.pausesWhenSuspended()) {
            log.debug("Workload {} suspended, SLA recalculation paused", workload.getRef());
            return;
        }
        Instant now = clock.instant();
        if (maintenanceWindows.isInMaintenanceWindow(monitor.getMaintenanceWindows(), now, workload.getTimezone())) {
            log.debug("Workload {} in maintenance window, SLA recalculation skipped", workload.getRef());
            return;
        }

        SlaConfig sla = monitor.getSla();
        WorkloadRef ref = workload.getRef();

        ExecutionMetrics metrics;
        SlaResult result;
        try {
            metrics = slaAnalyzer.getMetrics(ref, sla.effectiveWindowDays());
            result = slaAnalyzer.checkSla(ref, sla);
        } catch (InsufficientHistoryException e) {
            log.debug("SLA check skipped for {}: {}", ref, e.getMessage());
            return;
        }

        if (!result.isPassed()) {
            for (SlaViolation violation : result.getViolations()) {
                AlertContext context = AlertContext.builder()
                        .successRate(metrics.getSuccessRate())
                        .build();
                context.getMetrics().put("current", violation.getCurrent());
                context.getMetrics().put("threshold", violation.getThreshold());
                workloadAlerts.raise(workload, workloadAlerts.build(workload, AlertType.SLA_BREACHED,
                        AlertKeys.sla(ref, violation.getType()), "SLA breach: " + ref,
                        violation.getMessage(), context));
            }
        } else {
            workloadAlerts.resolve(workload, AlertType.SLA_BREACHED,
                    AlertKeys.sla(ref, ViolationType.SUCCESS_RATE),
                    AlertKeys.sla(ref, ViolationType.MAX_DURATION));
        }

        checkRegression(workload, sla);
    }

    private void checkRegression(TrackedWorkload workload, SlaConfig sla) {
        WorkloadRef ref = workload.getRef();
        RegressionResult regression;
        try {
            regression = slaAnalyzer.checkDurationRegression(ref, sla);
        } catch (InsufficientHistoryException e) {
            log.debug("Regression check skipped for {}: {}", ref, e.getMessage());
            return;
        }

        String key = AlertKeys.of(ref, AlertType.DURATION_REGRESSION);
        if (regression.isDetected()) {
            AlertContext context = new AlertContext();
            context.getMetrics().put("baselineP95", TimeUtils.formatDuration(regression.getBaselineP95()));
            context.getMetrics().put("currentP95", TimeUtils.formatDuration(regression.getCurrentP95()));
            context.getMetrics().put("percentageIncrease", regression.getPercentageIncrease());
            workloadAlerts.raise(workload, workloadAlerts.build(workload, AlertType.DURATION_REGRESSION, key,
                    "Duration regression: " + ref, regression.getMessage(), context));
        } else {
            workloadAlerts.resolve(workload, AlertType.DURATION_REGRESSION, key);
        }
    }
}
