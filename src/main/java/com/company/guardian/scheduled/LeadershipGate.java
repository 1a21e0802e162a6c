package com.company.guardian.scheduled;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Leadership signal for work that must run on a single replica. Without leader election the
 * gate is open from the start; otherwise it opens when {@link #grant()} is called.
 */
@Slf4j
public class LeadershipGate {

    private final AtomicBoolean leader;

    public LeadershipGate(boolean initiallyGranted) {
        this.leader = new AtomicBoolean(initiallyGranted);
    }

    public boolean isLeader() {
        return leader.get();
    }

    public void grant() {
        if (leader.compareAndSet(false, true)) {
            log.info("Leadership acquired");
        }
    }

    public void revoke() {
        if (leader.compareAndSet(true, false)) {
            log.info("Leadership lost");
        }
    }
}
