package com.company.guardian.domain.monitor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MaintenanceWindow {
    private String name;
    // Cron expression for the window start
    private String schedule;
    private Duration duration;
    private String timezone;
    private Boolean suppressAlerts;

    public boolean isSuppressAlerts() {
        return suppressAlerts == null || suppressAlerts;
    }
}
