package com.company.guardian.alerting;

import com.company.guardian.domain.WorkloadRef;
import com.company.guardian.domain.enums.AlertType;
import com.company.guardian.domain.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A candidate notification. The key identifies the logical condition for suppression.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Alert {
    private String key;
    private AlertType type;
    private Severity severity;
    private String title;
    private String message;
    private WorkloadRef workload;
    private String monitorName;

    @Builder.Default
    private AlertContext context = new AlertContext();

    private Instant timestamp;
}
