package com.company.guardian.alerting;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Delivery health of one channel. The consecutive failure count only grows until a
 * successful send resets it to zero.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChannelStats {
    private String name;
    private String type;
    private long alertsSentTotal;
    private long alertsFailedTotal;
    private Instant lastAlertTime;
    private Instant lastFailedTime;
    private String lastFailedError;
    private int consecutiveFailures;

    void recordSuccess(Instant at) {
        alertsSentTotal++;
        lastAlertTime = at;
        consecutiveFailures = 0;
    }

    void recordFailure(Instant at, String error) {
        alertsFailedTotal++;
        lastFailedTime = at;
        lastFailedError = error;
        consecutiveFailures++;
    }
}
