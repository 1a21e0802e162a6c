package com.company.guardian.domain;

import lombok.Value;

/**
 * Identity of a tracked workload.
 */
@Value(staticConstructor = "of")
public class WorkloadRef {
    String namespace;
    String name;

    /**
     * Prefix shared by every dedup key of this workload, e.g. {@code "batch/nightly-report/"}.
     */
    public String keyPrefix() {
        return namespace + "/" + name + "/";
    }

    @Override
    public String toString() {
        return namespace + "/" + name;
    }
}
