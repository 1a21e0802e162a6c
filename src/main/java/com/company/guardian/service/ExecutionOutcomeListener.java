package com.company.guardian.service;

import com.company.guardian.alerting.Alert;
import com.company.guardian.alerting.AlertContext;
import com.company.guardian.alerting.AlertDispatcher;
import com.company.guardian.alerting.AlertKeys;
import com.company.guardian.alerting.SuggestedFixes;
import com.company.guardian.config.SchedulingConfig;
import com.company.guardian.domain.ExecutionRecord;
import com.company.guardian.domain.TrackedWorkload;
import com.company.guardian.domain.WorkloadRef;
import com.company.guardian.domain.enums.AlertType;
import com.company.guardian.event.ExecutionCompletedEvent;
import com.company.guardian.scheduled.WorkloadAlerts;
import com.company.guardian.workload.InMemoryTrackedWorkloadProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.Optional;

/**
 * Reacts to completed runs: a success withdraws delayed alerts still waiting to fire, a failure
 * raises JobFailed for monitored workloads. Runs off the request thread once the completion has
 * been committed, so channel I/O never holds the ingestion transaction.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ExecutionOutcomeListener {

    private final AlertDispatcher alertDispatcher;
    private final WorkloadAlerts workloadAlerts;
    private final InMemoryTrackedWorkloadProvider workloadProvider;

    @Async(SchedulingConfig.EVENT_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onExecutionCompleted(ExecutionCompletedEvent event) {
        ExecutionRecord execution = event.getExecution();
        WorkloadRef ref = execution.getWorkload();

        try {
            if (execution.isSuccessful()) {
                int cancelled = alertDispatcher.cancelPendingAlertsForWorkload(ref.getNamespace(), ref.getName());
                if (cancelled > 0) {
                    log.info("Successful run of {} cancelled {} pending alerts", ref, cancelled);
                }
                workloadProvider.find(ref).ifPresent(w ->
                        workloadAlerts.resolve(w, AlertType.JOB_FAILED, AlertKeys.of(ref, AlertType.JOB_FAILED)));
                return;
            }

            Optional<TrackedWorkload> workload = workloadProvider.find(ref);
            if (workload.isEmpty() || workload.get().getMonitor() == null) {
                log.debug("Failed run of unmonitored workload {}, no alert", ref);
                return;
            }

            AlertContext context = AlertContext.builder()
                    .exitCode(execution.getExitCode())
                    .reason(execution.getReason())
                    .suggestedFix(SuggestedFixes.forFailure(execution.getExitCode(), execution.getReason()))
                    .build();

            Alert alert = workloadAlerts.build(workload.get(), AlertType.JOB_FAILED,
                    AlertKeys.of(ref, AlertType.JOB_FAILED), "Job failed: " + ref,
                    failureMessage(execution), context);
            workloadAlerts.raise(workload.get(), alert);
        } catch (Exception e) {
            log.error("Failed to process completion of execution {}", execution.getId(), e);
        }
    }

    static String failureMessage(ExecutionRecord execution) {
        String run = execution.getRunName() != null ? execution.getRunName() : "#" + execution.getId();
        StringBuilder message = new StringBuilder("Run ").append(run).append(" failed");
        if (execution.getReason() != null && !execution.getReason().isBlank()) {
            message.append(" with reason: ").append(execution.getReason());
        }
        if (execution.getExitCode() != null && execution.getExitCode() != 0) {
            message.append(" (exit code: ").append(execution.getExitCode()).append(")");
        }
        return message.toString();
    }
}
