package com.company.guardian.domain.monitor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-workload monitoring policy. Every section is optional; absent sections fall back to
 * the defaults documented on each section type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitorConfig {
    private DeadManSwitchConfig deadManSwitch;
    private SlaConfig sla;
    private SuspendedHandlingConfig suspendedHandling;
    private StuckRunConfig stuckRun;
    private AlertingConfig alerting;

    @Builder.Default
    private List<MaintenanceWindow> maintenanceWindows = new ArrayList<>();

    /**
     * Suspended workloads are skipped unless pausing is explicitly disabled.
     */
    public boolean pausesWhenSuspended() {
        return suspendedHandling == null || suspendedHandling.isPauseMonitoring();
    }
}
