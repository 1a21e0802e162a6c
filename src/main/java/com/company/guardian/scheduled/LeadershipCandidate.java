package com.company.guardian.scheduled;

import lombok.extern.slf4j.Slf4j;
import org.springframework.integration.leader.AbstractCandidate;
import org.springframework.integration.leader.Context;

/**
 * Opens the {@link LeadershipGate} while this replica holds the leader lock.
 */
@Slf4j
public class LeadershipCandidate extends AbstractCandidate {

    public static final String ROLE = "guardian-leader";

    private final LeadershipGate gate;

    public LeadershipCandidate(LeadershipGate gate) {
        super(null, ROLE);
        this.gate = gate;
    }

    @Override
    public void onGranted(Context ctx) {
        log.debug("Granted role {} as {}", ctx.getRole(), getId());
        gate.grant();
    }

    @Override
    public void onRevoked(Context ctx) {
        log.debug("Revoked role {} from {}", ctx.getRole(), getId());
        gate.revoke();
    }
}
