package com.company.guardian.workload;

import com.company.guardian.domain.TrackedWorkload;

import java.util.List;

/**
 * Source of the workloads the coordinators evaluate on each tick.
 */
public interface TrackedWorkloadProvider {

    /**
     * Current snapshot, in a stable order. Callers must not mutate the returned workloads.
     */
    List<TrackedWorkload> list();
}
