package com.company.guardian.exception;

import com.company.guardian.domain.WorkloadRef;
import lombok.Getter;

/**
 * Not enough execution history to judge a workload. Callers treat this as "no signal yet".
 */
@Getter
public class InsufficientHistoryException extends GuardianException {

    private final WorkloadRef workload;

    public InsufficientHistoryException(WorkloadRef workload, String detail) {
        super("Insufficient history for " + workload + ": " + detail);
        this.workload = workload;
    }
}
