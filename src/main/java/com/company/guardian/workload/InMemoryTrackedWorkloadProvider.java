package com.company.guardian.workload;

import com.company.guardian.domain.ActiveAlert;
import com.company.guardian.domain.TrackedWorkload;
import com.company.guardian.domain.WorkloadRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Registry of workloads fed through the workload REST endpoint and execution ingestion.
 * Listing order is namespace then name.
 */
@Component
@Slf4j
public class InMemoryTrackedWorkloadProvider implements TrackedWorkloadProvider {

    private final ConcurrentNavigableMap<String, TrackedWorkload> workloads = new ConcurrentSkipListMap<>();

    @Override
    public List<TrackedWorkload> list() {
        List<TrackedWorkload> snapshot = new ArrayList<>(workloads.size());
        workloads.values().forEach(w -> snapshot.add(copy(w)));
        return snapshot;
    }

    /**
     * Inserts or replaces a workload. Status fields the caller left empty are carried over from
     * the existing registration.
     */
    public TrackedWorkload register(TrackedWorkload workload) {
        if (workload == null || workload.getRef() == null) {
            throw new IllegalArgumentException("workload reference is required");
        }
        TrackedWorkload merged = workloads.compute(key(workload.getRef()), (k, existing) -> {
            TrackedWorkload next = copy(workload);
            if (existing != null) {
                if (next.getCreatedAt() == null) {
                    next.setCreatedAt(existing.getCreatedAt());
                }
                if (next.getLastSuccessfulTime() == null) {
                    next.setLastSuccessfulTime(existing.getLastSuccessfulTime());
                }
            }
            return next;
        });
        log.info("Registered workload {} (schedule: {}, suspended: {})",
                merged.getRef(), merged.getSchedule(), merged.isSuspended());
        return copy(merged);
    }

    public boolean remove(WorkloadRef ref) {
        boolean removed = workloads.remove(key(ref)) != null;
        if (removed) {
            log.info("Removed workload {}", ref);
        }
        return removed;
    }

    public Optional<TrackedWorkload> find(WorkloadRef ref) {
        return Optional.ofNullable(workloads.get(key(ref))).map(InMemoryTrackedWorkloadProvider::copy);
    }

    /**
     * Advances the last successful time; never moves it backwards.
     */
    public void recordSuccess(WorkloadRef ref, Instant completedAt) {
        workloads.computeIfPresent(key(ref), (k, existing) -> {
            Instant current = existing.getLastSuccessfulTime();
            if (current == null || completedAt.isAfter(current)) {
                TrackedWorkload next = copy(existing);
                next.setLastSuccessfulTime(completedAt);
                return next;
            }
            return existing;
        });
    }

    public int size() {
        return workloads.size();
    }

    private static String key(WorkloadRef ref) {
        return ref.getNamespace() + "/" + ref.getName();
    }

    private static TrackedWorkload copy(TrackedWorkload workload) {
        List<ActiveAlert> alerts = workload.getActiveAlerts() != null
                ? new ArrayList<>(workload.getActiveAlerts())
                : new ArrayList<>();
        return workload.toBuilder().activeAlerts(alerts).build();
    }
}
