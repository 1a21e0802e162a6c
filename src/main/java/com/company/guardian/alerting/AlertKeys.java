package com.company.guardian.alerting;

import com.company.guardian.analysis.ViolationType;
import com.company.guardian.domain.WorkloadRef;
import com.company.guardian.domain.enums.AlertType;

/**
 * Dedup key layout: {@code <namespace>/<name>/<Type>} and
 * {@code <namespace>/<name>/SLA/<Violation>} for SLA breaches.
 */
public final class AlertKeys {

    private AlertKeys() {
    }

    public static String of(WorkloadRef workload, AlertType type) {
        return workload.keyPrefix() + type.getCode();
    }

    public static String sla(WorkloadRef workload, ViolationType violation) {
        return workload.keyPrefix() + "SLA/" + violation.getCode();
    }
}
