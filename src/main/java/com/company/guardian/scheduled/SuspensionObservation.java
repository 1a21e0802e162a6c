package com.company.guardian.scheduled;

public enum SuspensionObservation {
    NOT_SUSPENDED,
    // First suspended observation, tracking starts now
    STARTED_TRACKING,
    SUSPENDED,
    SUSPENDED_TOO_LONG,
    // Was tracked, now running again
    RESUMED
}
