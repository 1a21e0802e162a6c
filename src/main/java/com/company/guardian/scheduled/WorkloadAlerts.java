package com.company.guardian.scheduled;

import com.company.guardian.alerting.Alert;
import com.company.guardian.alerting.AlertContext;
import com.company.guardian.alerting.AlertDispatcher;
import com.company.guardian.alerting.DispatchResult;
import com.company.guardian.domain.TrackedWorkload;
import com.company.guardian.domain.enums.AlertType;
import com.company.guardian.domain.enums.Severity;
import com.company.guardian.domain.monitor.AlertingConfig;
import com.company.guardian.repository.ExecutionStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Raise and resolve steps shared by the detectors.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WorkloadAlerts {

    private final AlertDispatcher dispatcher;
    private final ExecutionStore store;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public Alert build(TrackedWorkload workload, AlertType type, String key, String title,
                       String message, AlertContext context) {
        AlertingConfig alerting = alertingOf(workload);
        Severity severity = alerting != null ? alerting.severityFor(type) : type.getDefaultSeverity();
        return Alert.builder()
                .key(key)
                .type(type)
                .severity(severity)
                .title(title)
                .message(message)
                .workload(workload.getRef())
                .monitorName(workload.getMonitorName())
                .context(context != null ? context : new AlertContext())
                .timestamp(clock.instant())
                .build();
    }

    /**
     * Dispatches unless the workload status already carries an active alert of the same type.
     */
    public DispatchResult raise(TrackedWorkload workload, Alert alert) {
        if (workload.hasActiveAlert(alert.getType())) {
            log.debug("Workload {} already has an active {} alert", workload.getRef(), alert.getType().getCode());
            return DispatchResult.SUPPRESSED;
        }
        meterRegistry.counter("guardian.detections", "type", alert.getType().getCode()).increment();
        DispatchResult result = dispatcher.dispatch(alert, alertingOf(workload));
        log.warn("{} for {}: {} ({})", alert.getType().getCode(), workload.getRef(), alert.getMessage(), result);
        return result;
    }

    /**
     * Cancels any pending send, clears suppression for each key and marks the stored history of
     * the type resolved.
     */
    public void resolve(TrackedWorkload workload, AlertType type, String... keys) {
        boolean wasAlerting = false;
        for (String key : keys) {
            wasAlerting |= dispatcher.cancelPendingAlert(key);
            wasAlerting |= dispatcher.clearAlert(key);
        }
        if (wasAlerting) {
            log.info("{} resolved for {}", type.getCode(), workload.getRef());
        }
        try {
            store.resolveAlert(type, workload.getRef().getNamespace(), workload.getRef().getName());
        } catch (DataAccessException e) {
            log.error("Failed to resolve {} history for {}", type.getCode(), workload.getRef(), e);
        }
    }

    private static AlertingConfig alertingOf(TrackedWorkload workload) {
        return workload.getMonitor() != null ? workload.getMonitor().getAlerting() : null;
    }
}
