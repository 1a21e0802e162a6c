package com.company.guardian.scheduled;

import com.company.guardian.domain.WorkloadRef;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SuspensionTrackerTest {

    private static final WorkloadRef REF = WorkloadRef.of("batch", "nightly-report");
    private static final Duration THRESHOLD = Duration.ofHours(24);
    private static final Instant T0 = Instant.parse("2025-01-10T00:00:00Z");

    private final SuspensionTracker tracker = new SuspensionTracker();

    @Test
    void tracksFromFirstSuspendedObservation() {
        assertThat(tracker.observe(REF, true, THRESHOLD, T0)).isEqualTo(SuspensionObservation.STARTED_TRACKING);
        assertThat(tracker.observe(REF, true, THRESHOLD, T0.plus(Duration.ofHours(23))))
                .isEqualTo(SuspensionObservation.SUSPENDED);
        assertThat(tracker.observe(REF, true, THRESHOLD, T0.plus(THRESHOLD)))
                .isEqualTo(SuspensionObservation.SUSPENDED_TOO_LONG);
        assertThat(tracker.suspendedSince(REF)).contains(T0);
    }

    @Test
    void resumingClearsTracking() {
        tracker.observe(REF, true, THRESHOLD, T0);

        assertThat(tracker.observe(REF, false, THRESHOLD, T0.plusSeconds(60))).isEqualTo(SuspensionObservation.RESUMED);
        assertThat(tracker.observe(REF, false, THRESHOLD, T0.plusSeconds(120))).isEqualTo(SuspensionObservation.NOT_SUSPENDED);
        assertThat(tracker.suspendedSince(REF)).isEmpty();

        // Suspending again starts a fresh clock
        Instant again = T0.plus(Duration.ofHours(30));
        assertThat(tracker.observe(REF, true, THRESHOLD, again)).isEqualTo(SuspensionObservation.STARTED_TRACKING);
        assertThat(tracker.suspendedSince(REF)).contains(again);
    }

    @Test
    void retainOnlyDropsUnlistedWorkloads() {
        WorkloadRef other = WorkloadRef.of("batch", "cleanup");
        tracker.observe(REF, true, THRESHOLD, T0);
        tracker.observe(other, true, THRESHOLD, T0);

        assertThat(tracker.retainOnly(List.of(REF))).isEqualTo(1);
        assertThat(tracker.size()).isEqualTo(1);
        assertThat(tracker.suspendedSince(other)).isEmpty();
    }
}
