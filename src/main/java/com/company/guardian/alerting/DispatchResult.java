package com.company.guardian.alerting;

public enum DispatchResult {
    /** Delivered to at least one channel; the key is now active. */
    SENT,
    /** Same key sent within the suppression window, or currently being delivered. */
    SUPPRESSED,
    /** Delay timer armed, or already armed for this key. */
    PENDING,
    RATE_LIMITED,
    NO_CHANNELS,
    DISABLED,
    /** Every eligible channel failed. */
    FAILED,
    /** Dispatcher is shutting down. */
    DROPPED
}
