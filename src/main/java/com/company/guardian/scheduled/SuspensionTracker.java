package com.company.guardian.scheduled;

import com.company.guardian.domain.WorkloadRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Remembers when each workload was first seen suspended. Process-local; a restart begins
 * tracking again from the next observation.
 */
@Component
@Slf4j
public class SuspensionTracker {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<WorkloadRef, Instant> suspendedSince = new HashMap<>();

    public SuspensionObservation observe(WorkloadRef workload, boolean suspended, Duration threshold, Instant now) {
        lock.lock();
        try {
            if (!suspended) {
                if (suspendedSince.remove(workload) != null) {
                    log.debug("Workload {} resumed, cleared suspension tracking", workload);
                    return SuspensionObservation.RESUMED;
                }
                return SuspensionObservation.NOT_SUSPENDED;
            }

            Instant since = suspendedSince.putIfAbsent(workload, now);
            if (since == null) {
                log.debug("Workload {} suspended, tracking from {}", workload, now);
                return SuspensionObservation.STARTED_TRACKING;
            }
            if (threshold != null && Duration.between(since, now).compareTo(threshold) >= 0) {
                return SuspensionObservation.SUSPENDED_TOO_LONG;
            }
            return SuspensionObservation.SUSPENDED;
        } finally {
            lock.unlock();
        }
    }

    public Optional<Instant> suspendedSince(WorkloadRef workload) {
        lock.lock();
        try {
            return Optional.ofNullable(suspendedSince.get(workload));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops tracking for workloads no longer listed.
     */
    public int retainOnly(Collection<WorkloadRef> current) {
        lock.lock();
        try {
            int before = suspendedSince.size();
            suspendedSince.keySet().retainAll(new HashSet<>(current));
            return before - suspendedSince.size();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return suspendedSince.size();
        } finally {
            lock.unlock();
        }
    }
}
