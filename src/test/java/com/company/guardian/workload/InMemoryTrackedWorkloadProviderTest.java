package com.company.guardian.workload;

import com.company.guardian.domain.TrackedWorkload;
import com.company.guardian.domain.WorkloadRef;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryTrackedWorkloadProviderTest {

    private static final WorkloadRef REF = WorkloadRef.of("batch", "nightly-report");
    private static final Instant CREATED = Instant.parse("2025-01-01T00:00:00Z");

    private final InMemoryTrackedWorkloadProvider provider = new InMemoryTrackedWorkloadProvider();

    private static TrackedWorkload workload(WorkloadRef ref, String schedule) {
        return TrackedWorkload.builder().ref(ref).schedule(schedule).build();
    }

    @Test
    void reRegistrationKeepsStatusFields() {
        TrackedWorkload first = workload(REF, "@daily");
        first.setCreatedAt(CREATED);
        provider.register(first);
        provider.recordSuccess(REF, Instant.parse("2025-01-05T02:10:00Z"));

        TrackedWorkload updated = provider.register(workload(REF, "0 3 * * *"));

        assertThat(updated.getSchedule()).isEqualTo("0 3 * * *");
        assertThat(updated.getCreatedAt()).isEqualTo(CREATED);
        assertThat(updated.getLastSuccessfulTime()).isEqualTo(Instant.parse("2025-01-05T02:10:00Z"));
        assertThat(provider.size()).isEqualTo(1);
    }

    @Test
    void lastSuccessNeverMovesBackwards() {
        provider.register(workload(REF, "@daily"));
        provider.recordSuccess(REF, Instant.parse("2025-01-05T02:10:00Z"));
        provider.recordSuccess(REF, Instant.parse("2025-01-04T02:10:00Z"));

        assertThat(provider.find(REF).orElseThrow().getLastSuccessfulTime())
                .isEqualTo(Instant.parse("2025-01-05T02:10:00Z"));
    }

    @Test
    void listIsOrderedAndDetached() {
        provider.register(workload(WorkloadRef.of("etl", "sync"), "@hourly"));
        provider.register(workload(REF, "@daily"));

        assertThat(provider.list()).extracting(w -> w.getRef().toString())
                .containsExactly("batch/nightly-report", "etl/sync");

        provider.list().get(0).setSchedule("changed");
        assertThat(provider.find(REF).orElseThrow().getSchedule()).isEqualTo("@daily");
    }

    @Test
    void removeAndMissingRef() {
        provider.register(workload(REF, "@daily"));

        assertThat(provider.remove(REF)).isTrue();
        assertThat(provider.remove(REF)).isFalse();
        assertThat(provider.find(REF)).isEmpty();
        assertThatThrownBy(() -> provider.register(workload(null, "@daily")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
