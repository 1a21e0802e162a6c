package com.company.guardian.alerting;

import com.company.guardian.analysis.ViolationType;
import com.company.guardian.domain.WorkloadRef;
import com.company.guardian.domain.enums.AlertType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AlertKeysTest {

    private static final WorkloadRef REF = WorkloadRef.of("batch", "nightly-report");

    @Test
    void keysStartWithWorkloadPrefix() {
        assertThat(AlertKeys.of(REF, AlertType.DEAD_MAN_TRIGGERED)).isEqualTo("batch/nightly-report/DeadManTriggered");
        assertThat(AlertKeys.sla(REF, ViolationType.MAX_DURATION)).isEqualTo("batch/nightly-report/SLA/MaxDuration");
        assertThat(AlertKeys.of(REF, AlertType.STUCK_JOB)).startsWith(REF.keyPrefix());
    }
}
