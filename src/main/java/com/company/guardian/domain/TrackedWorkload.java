package com.company.guardian.domain;

import com.company.guardian.domain.enums.AlertType;
import com.company.guardian.domain.monitor.MonitorConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot of a recurring job under monitoring, as maintained by the workload provider.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TrackedWorkload {

    private WorkloadRef ref;

    // Recurring schedule, 5-field cron or a macro such as @daily
    private String schedule;
    private String timezone;
    private boolean suspended;

    private Instant createdAt;
    private Instant lastSuccessfulTime;

    // Name of the monitor policy that selected this workload
    private String monitorName;
    private MonitorConfig monitor;

    @Builder.Default
    private List<ActiveAlert> activeAlerts = new ArrayList<>();

    public boolean hasActiveAlert(AlertType type) {
        if (activeAlerts == null) {
            return false;
        }
        return activeAlerts.stream().anyMatch(a -> a.getType() == type);
    }
}
