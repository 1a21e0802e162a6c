package com.company.guardian.alerting;

import com.company.guardian.alerting.channel.AlertChannel;
import com.company.guardian.alerting.channel.ChannelDefinition;
import com.company.guardian.domain.monitor.AlertingConfig;

import java.util.List;
import java.util.Optional;

/**
 * Turns detections into deduplicated, rate-limited, optionally delayed notifications.
 *
 * <p>Per dedup key the state moves Absent, Pending (delay armed), Active (sent, suppression
 * armed) and back to Absent on {@link #clearAlert} or when a pending delay is cancelled.
 */
public interface AlertDispatcher {

    /**
     * @throws IllegalArgumentException when the alert or its key is missing
     */
    DispatchResult dispatch(Alert alert, AlertingConfig config);

    /**
     * Cancels an armed delay before it fires. Idempotent.
     *
     * @return whether a pending alert was actually cancelled
     */
    boolean cancelPendingAlert(String key);

    /**
     * Cancels every pending alert of the workload.
     *
     * @return number of pending alerts cancelled
     */
    int cancelPendingAlertsForWorkload(String namespace, String name);

    /**
     * Active to Absent: the next occurrence of the key is treated as new.
     *
     * @return whether the key was active
     */
    boolean clearAlert(String key);

    int clearAlertsForWorkload(String namespace, String name);

    /**
     * Read-only view of whether a dispatch of this alert would currently be suppressed.
     */
    SuppressionCheck isSuppressed(Alert alert, AlertingConfig config);

    void registerChannel(AlertChannel channel, ChannelDefinition.RateLimiting rateLimiting);

    boolean removeChannel(String name);

    /**
     * Sends straight to one channel, bypassing suppression and rate limits. Used for test sends.
     *
     * @throws com.company.guardian.exception.ChannelNotFoundException for an unknown channel
     */
    void sendToChannel(String channelName, Alert alert);

    Optional<ChannelStats> getChannelStats(String channelName);

    List<ChannelStats> getAllChannelStats();

    int getAlertCount24h();

    int getPendingCount();

    int getActiveCount();
}
