package com.company.guardian.exception;

import com.company.guardian.domain.WorkloadRef;

public class WorkloadNotFoundException extends GuardianException {
    public WorkloadNotFoundException(WorkloadRef ref) {
        super("Workload not tracked: " + ref);
    }
}
