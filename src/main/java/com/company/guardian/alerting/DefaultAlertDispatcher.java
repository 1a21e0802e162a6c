package com.company.guardian.alerting;

import com.company.guardian.alerting.channel.AlertChannel;
import com.company.guardian.alerting.channel.ChannelDefinition;
import com.company.guardian.config.GuardianProperties;
import com.company.guardian.domain.AlertHistory;
import com.company.guardian.domain.AlertHistoryQuery;
import com.company.guardian.domain.monitor.AlertingConfig;
import com.company.guardian.domain.monitor.ChannelRef;
import com.company.guardian.exception.ChannelNotFoundException;
import com.company.guardian.repository.ExecutionStore;
import com.company.guardian.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory dispatcher. All suppression, pending, limiter and health state sits behind one
 * lock that is never held across a channel send.
 */
@Slf4j
public class DefaultAlertDispatcher implements AlertDispatcher, SmartLifecycle {

    static final Duration SUPPRESSION_RESTORE_WINDOW = Duration.ofHours(1);
    static final Duration ENTRY_RETENTION = Duration.ofHours(24);
    static final Duration CLEANUP_INTERVAL = Duration.ofHours(1);

    // Starts before and stops after the coordinators
    public static final int PHASE = 0;

    private final ExecutionStore store;
    private final TaskScheduler taskScheduler;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final GuardianProperties.RateLimits rateLimits;
    private final TokenBucketRateLimiter globalLimiter;

    private final ReentrantLock stateLock = new ReentrantLock();
    private final Map<String, AlertChannel> channels = new HashMap<>();
    private final Map<String, TokenBucketRateLimiter> channelLimiters = new HashMap<>();
    private final Map<String, ChannelStats> channelStats = new HashMap<>();
    // Stored health for channels not registered yet
    private final Map<String, ChannelStats> restoredStats = new HashMap<>();
    private final Map<String, Instant> sentAlerts = new HashMap<>();
    private final Map<String, PendingAlert> pendingAlerts = new HashMap<>();
    private final Set<String> inFlight = new HashSet<>();
    private final Deque<Instant> recentSends = new ArrayDeque<>();

    private boolean running;
    private boolean shutdown;
    private ScheduledFuture<?> cleanupTask;

    public DefaultAlertDispatcher(ExecutionStore store,
                                  TaskScheduler taskScheduler,
                                  MeterRegistry meterRegistry,
                                  Clock clock,
                                  GuardianProperties.RateLimits rateLimits) {
        this.store = store;
        this.taskScheduler = taskScheduler;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.rateLimits = rateLimits;
        this.globalLimiter = TokenBucketRateLimiter.perMinute(
                rateLimits.getGlobalBurst(), rateLimits.getMaxAlertsPerMinute(), clock);
    }

    @Override
    public DispatchResult dispatch(Alert alert, AlertingConfig config) {
        validate(alert);
        String key = alert.getKey();

        if (config == null || !config.isEnabled()) {
            log.debug("Alerting disabled, not dispatching {}", key);
            return DispatchResult.DISABLED;
        }

        Instant now = clock.instant();
        stateLock.lock();
        try {
            if (shutdown) {
                log.debug("Dispatcher shut down, dropping {}", key);
                return DispatchResult.DROPPED;
            }

            String suppressedBy = suppressionReason(key, config, now);
            if (suppressedBy != null) {
                log.debug("Alert {} suppressed: {}", key, suppressedBy);
                meterRegistry.counter("guardian.alerts.suppressed", "type", typeTag(alert)).increment();
                return DispatchResult.SUPPRESSED;
            }

            if (config.hasDelay()) {
                if (pendingAlerts.containsKey(key)) {
                    return DispatchResult.PENDING;
                }
                armDelay(alert, config);
                return DispatchResult.PENDING;
            }

            inFlight.add(key);
        } finally {
            stateLock.unlock();
        }

        return deliver(alert, config);
    }

    @Override
    public boolean cancelPendingAlert(String key) {
        PendingAlert pending;
        stateLock.lock();
        try {
            pending = pendingAlerts.remove(key);
        } finally {
            stateLock.unlock();
        }
        if (pending == null) {
            return false;
        }
        pending.cancel();
        meterRegistry.counter("guardian.alerts.cancelled").increment();
        log.info("Cancelled pending alert {}", key);
        return true;
    }

    @Override
    public int cancelPendingAlertsForWorkload(String namespace, String name) {
        String prefix = namespace + "/" + name + "/";
        List<PendingAlert> cancelled = new ArrayList<>();
        stateLock.lock();
        try {
            Iterator<Map.Entry<String, PendingAlert>> it = pendingAlerts.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, PendingAlert> entry = it.next();
                if (entry.getKey().startsWith(prefix)) {
                    cancelled.add(entry.getValue());
                    it.remove();
                }
            }
        } finally {
            stateLock.unlock();
        }

        cancelled.forEach(PendingAlert::cancel);
        if (!cancelled.isEmpty()) {
            meterRegistry.counter("guardian.alerts.cancelled").increment(cancelled.size());
            log.info("Cancelled {} pending alerts for {}/{}", cancelled.size(), namespace, name);
        }
        return cancelled.size();
    }

    @Override
    public boolean clearAlert(String key) {
        stateLock.lock();
        try {
            boolean wasActive = sentAlerts.remove(key) != null;
            if (wasActive) {
                log.info("Cleared alert {}", key);
            }
            return wasActive;
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public int clearAlertsForWorkload(String namespace, String name) {
        String prefix = namespace + "/" + name + "/";
        stateLock.lock();
        try {
            int before = sentAlerts.size();
            sentAlerts.keySet().removeIf(k -> k.startsWith(prefix));
            int cleared = before - sentAlerts.size();
            if (cleared > 0) {
                log.info("Cleared {} alerts for {}/{}", cleared, namespace, name);
            }
            return cleared;
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public SuppressionCheck isSuppressed(Alert alert, AlertingConfig config) {
        validate(alert);
        if (config == null || !config.isEnabled()) {
            return SuppressionCheck.suppressed("alerting disabled");
        }
        stateLock.lock();
        try {
            String reason = suppressionReason(alert.getKey(), config, clock.instant());
            if (reason != null) {
                return SuppressionCheck.suppressed(reason);
            }
            if (pendingAlerts.containsKey(alert.getKey())) {
                return SuppressionCheck.suppressed("delayed send already pending");
            }
            return SuppressionCheck.notSuppressed();
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public void registerChannel(AlertChannel channel, ChannelDefinition.RateLimiting rateLimiting) {
        int burst = rateLimits.getDefaultChannelBurst();
        int maxPerHour = rateLimits.getDefaultChannelMaxPerHour();
        if (rateLimiting != null) {
            if (rateLimiting.getBurst() != null) {
                burst = rateLimiting.getBurst();
            }
            if (rateLimiting.getMaxPerHour() != null) {
                maxPerHour = rateLimiting.getMaxPerHour();
            }
        }

        stateLock.lock();
        try {
            channels.put(channel.getName(), channel);
            channelLimiters.put(channel.getName(), TokenBucketRateLimiter.perHour(burst, maxPerHour, clock));
            ChannelStats restored = restoredStats.remove(channel.getName());
            if (restored != null && !channelStats.containsKey(channel.getName())) {
                channelStats.put(channel.getName(), restored);
            }
            channelStats.computeIfAbsent(channel.getName(), n -> ChannelStats.builder().name(n).build())
                    .setType(channel.getType());
        } finally {
            stateLock.unlock();
        }
        log.info("Registered {} channel {} (burst={}, maxPerHour={})", channel.getType(), channel.getName(), burst, maxPerHour);
    }

    @Override
    public boolean removeChannel(String name) {
        stateLock.lock();
        try {
            channelLimiters.remove(name);
            channelStats.remove(name);
            boolean removed = channels.remove(name) != null;
            if (removed) {
                log.info("Removed channel {}", name);
            }
            return removed;
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public void sendToChannel(String channelName, Alert alert) {
        AlertChannel channel;
        stateLock.lock();
        try {
            channel = channels.get(channelName);
        } finally {
            stateLock.unlock();
        }
        if (channel == null) {
            throw new ChannelNotFoundException(channelName);
        }
        try {
            channel.send(alert);
            recordOutcome(channel, null);
        } catch (RuntimeException e) {
            recordOutcome(channel, e);
            throw e;
        }
    }

    @Override
    public Optional<ChannelStats> getChannelStats(String channelName) {
        stateLock.lock();
        try {
            ChannelStats stats = channelStats.get(channelName);
            return stats == null ? Optional.empty() : Optional.of(stats.toBuilder().build());
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public List<ChannelStats> getAllChannelStats() {
        stateLock.lock();
        try {
            List<ChannelStats> result = new ArrayList<>();
            channelStats.values().forEach(s -> result.add(s.toBuilder().build()));
            return result;
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public int getAlertCount24h() {
        Instant cutoff = clock.instant().minus(ENTRY_RETENTION);
        stateLock.lock();
        try {
            return (int) recentSends.stream().filter(t -> t.isAfter(cutoff)).count();
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public int getPendingCount() {
        stateLock.lock();
        try {
            return pendingAlerts.size();
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public int getActiveCount() {
        stateLock.lock();
        try {
            return sentAlerts.size();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Re-arms suppression for alerts sent in the last hour that are still unresolved, so a
     * restart does not page again for the same condition.
     */
    public int loadRecentAlerts() {
        if (store == null) {
            return 0;
        }
        Instant now = clock.instant();
        List<AlertHistory> recent;
        try {
            recent = store.listAlertHistory(AlertHistoryQuery.builder()
                    .since(now.minus(SUPPRESSION_RESTORE_WINDOW))
                    .unresolvedOnly(true)
                    .limit(1000)
                    .build());
        } catch (RuntimeException e) {
            log.error("Failed to restore suppression state from alert history", e);
            return 0;
        }

        int restored = 0;
        stateLock.lock();
        try {
            for (AlertHistory history : recent) {
                String key = history.getAlertKey();
                if (key == null || key.isBlank() || history.getOccurredAt() == null) {
                    continue;
                }
                Instant existing = sentAlerts.get(key);
                if (existing == null || history.getOccurredAt().isAfter(existing)) {
                    sentAlerts.put(key, history.getOccurredAt());
                    restored++;
                }
            }
        } finally {
            stateLock.unlock();
        }
        log.info("Restored suppression state for {} recent alerts", restored);
        return restored;
    }

    /**
     * Restores channel health saved by a previous run. Stats of registered channels that have
     * not sent anything yet are replaced; the rest are kept until their channel registers.
     */
    public int loadChannelStats() {
        if (store == null) {
            return 0;
        }
        List<ChannelStats> stored;
        try {
            stored = store.getAllChannelStats();
        } catch (RuntimeException e) {
            log.error("Failed to restore channel health", e);
            return 0;
        }

        int restored = 0;
        stateLock.lock();
        try {
            for (ChannelStats stats : stored) {
                String name = stats.getName();
                if (name == null || name.isBlank()) {
                    continue;
                }
                AlertChannel channel = channels.get(name);
                if (channel == null) {
                    restoredStats.put(name, stats);
                    continue;
                }
                ChannelStats live = channelStats.get(name);
                if (live == null || (live.getAlertsSentTotal() == 0 && live.getAlertsFailedTotal() == 0)) {
                    stats.setType(channel.getType());
                    channelStats.put(name, stats);
                    restored++;
                }
            }
        } finally {
            stateLock.unlock();
        }
        log.info("Restored health for {} channels", restored);
        return restored;
    }

    /**
     * Drops suppression entries and send timestamps older than 24 hours.
     */
    public void cleanupExpired() {
        Instant cutoff = clock.instant().minus(ENTRY_RETENTION);
        stateLock.lock();
        try {
            int before = sentAlerts.size();
            sentAlerts.values().removeIf(sentAt -> sentAt.isBefore(cutoff));
            while (!recentSends.isEmpty() && recentSends.peekFirst().isBefore(cutoff)) {
                recentSends.pollFirst();
            }
            int evicted = before - sentAlerts.size();
            if (evicted > 0) {
                log.debug("Evicted {} expired suppression entries", evicted);
            }
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Cancels and drops every pending alert; later dispatches return {@link DispatchResult#DROPPED}.
     */
    public void shutdown() {
        List<PendingAlert> dropped;
        stateLock.lock();
        try {
            shutdown = true;
            dropped = new ArrayList<>(pendingAlerts.values());
            pendingAlerts.clear();
        } finally {
            stateLock.unlock();
        }
        dropped.forEach(PendingAlert::cancel);
        if (!dropped.isEmpty()) {
            log.info("Dropped {} pending alerts on shutdown", dropped.size());
        }
    }

    @Override
    public void start() {
        stateLock.lock();
        try {
            if (running) {
                return;
            }
            running = true;
            shutdown = false;
        } finally {
            stateLock.unlock();
        }
        loadRecentAlerts();
        loadChannelStats();
        cleanupTask = taskScheduler.scheduleAtFixedRate(this::cleanupExpired,
                taskScheduler.getClock().instant().plus(CLEANUP_INTERVAL), CLEANUP_INTERVAL);
        log.info("Alert dispatcher started");
    }

    @Override
    public void stop() {
        stateLock.lock();
        try {
            if (!running) {
                return;
            }
            running = false;
        } finally {
            stateLock.unlock();
        }
        if (cleanupTask != null) {
            cleanupTask.cancel(false);
        }
        shutdown();
        log.info("Alert dispatcher stopped");
    }

    @Override
    public boolean isRunning() {
        stateLock.lock();
        try {
            return running;
        } finally {
            stateLock.unlock();
        }
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    // Caller holds stateLock
    private String suppressionReason(String key, AlertingConfig config, Instant now) {
        if (inFlight.contains(key)) {
            return "delivery in flight";
        }
        Instant lastSent = sentAlerts.get(key);
        if (lastSent != null) {
            Duration window = config.effectiveSuppressDuplicatesFor();
            if (now.isBefore(lastSent.plus(window))) {
                return "duplicate within " + TimeUtils.formatDuration(window);
            }
        }
        return null;
    }

    // Caller holds stateLock, so the entry is in place before the timer can observe it
    private void armDelay(Alert alert, AlertingConfig config) {
        String key = alert.getKey();
        PendingAlert pending = new PendingAlert(alert, config);
        Instant fireAt = taskScheduler.getClock().instant().plus(config.getAlertDelay());
        pending.future = taskScheduler.schedule(() -> firePending(key, pending), fireAt);
        pendingAlerts.put(key, pending);
        log.info("Alert {} delayed by {}", key, TimeUtils.formatDuration(config.getAlertDelay()));
    }

    private void firePending(String key, PendingAlert pending) {
        stateLock.lock();
        try {
            if (pendingAlerts.get(key) != pending) {
                return;
            }
            pendingAlerts.remove(key);
            if (shutdown) {
                return;
            }
            String suppressedBy = suppressionReason(key, pending.config, clock.instant());
            if (suppressedBy != null) {
                log.debug("Delayed alert {} suppressed at fire time: {}", key, suppressedBy);
                return;
            }
            inFlight.add(key);
        } finally {
            stateLock.unlock();
        }

        try {
            DispatchResult result = deliver(pending.alert, pending.config);
            log.info("Delayed alert {} fired: {}", key, result);
        } catch (RuntimeException e) {
            log.error("Delayed alert {} failed", key, e);
        }
    }

    private DispatchResult deliver(Alert alert, AlertingConfig config) {
        String key = alert.getKey();
        try {
            if (!globalLimiter.tryAcquire()) {
                log.warn("Global alert rate limit reached, dropping {}", key);
                meterRegistry.counter("guardian.alerts.rate_limited", "scope", "global").increment();
                return DispatchResult.RATE_LIMITED;
            }

            List<ChannelRef> refs = config.getChannelRefs() != null ? config.getChannelRefs() : List.of();
            List<AlertChannel> targets = new ArrayList<>();
            int rateLimited = 0;
            stateLock.lock();
            try {
                for (ChannelRef ref : refs) {
                    if (!ref.accepts(alert.getSeverity())) {
                        continue;
                    }
                    AlertChannel channel = channels.get(ref.getName());
                    if (channel == null) {
                        log.warn("Alert {} references unknown channel {}", key, ref.getName());
                        continue;
                    }
                    if (!channelLimiters.get(ref.getName()).tryAcquire()) {
                        log.warn("Channel {} rate limited, skipping alert {}", ref.getName(), key);
                        meterRegistry.counter("guardian.alerts.rate_limited", "scope", "channel",
                                "channel", ref.getName()).increment();
                        rateLimited++;
                        continue;
                    }
                    targets.add(channel);
                }
            } finally {
                stateLock.unlock();
            }

            if (targets.isEmpty()) {
                if (rateLimited > 0) {
                    return DispatchResult.RATE_LIMITED;
                }
                log.warn("No channels to deliver alert {} ({})", key, alert.getSeverity());
                return DispatchResult.NO_CHANNELS;
            }

            List<String> delivered = new ArrayList<>();
            for (AlertChannel channel : targets) {
                try {
                    channel.send(alert);
                    recordOutcome(channel, null);
                    delivered.add(channel.getName());
                } catch (RuntimeException e) {
                    recordOutcome(channel, e);
                    log.error("Failed to deliver alert {} via channel {}", key, channel.getName(), e);
                }
            }

            if (delivered.isEmpty()) {
                return DispatchResult.FAILED;
            }

            Instant sentAt = clock.instant();
            stateLock.lock();
            try {
                sentAlerts.put(key, sentAt);
                recentSends.addLast(sentAt);
            } finally {
                stateLock.unlock();
            }
            log.info("Alert {} sent to {}", key, delivered);
            persist(alert, delivered);
            return DispatchResult.SENT;

        } finally {
            stateLock.lock();
            try {
                inFlight.remove(key);
            } finally {
                stateLock.unlock();
            }
        }
    }

    private void recordOutcome(AlertChannel channel, Exception failure) {
        Instant at = clock.instant();
        ChannelStats snapshot;
        stateLock.lock();
        try {
            ChannelStats stats = channelStats.computeIfAbsent(channel.getName(),
                    n -> ChannelStats.builder().name(n).type(channel.getType()).build());
            if (failure == null) {
                stats.recordSuccess(at);
            } else {
                stats.recordFailure(at, failure.getMessage());
            }
            snapshot = stats.toBuilder().build();
        } finally {
            stateLock.unlock();
        }
        saveStats(snapshot);
        if (failure == null) {
            meterRegistry.counter("guardian.alerts.sent", "channel", channel.getName()).increment();
        } else {
            meterRegistry.counter("guardian.alerts.failed", "channel", channel.getName()).increment();
        }
    }

    private void saveStats(ChannelStats stats) {
        if (store == null) {
            return;
        }
        try {
            store.saveChannelStats(stats);
        } catch (RuntimeException e) {
            log.warn("Failed to save health of channel {}: {}", stats.getName(), e.getMessage());
        }
    }

    private void persist(Alert alert, List<String> delivered) {
        if (store == null) {
            return;
        }
        AlertContext context = alert.getContext() != null ? alert.getContext() : new AlertContext();
        AlertHistory history = AlertHistory.builder()
                .alertKey(alert.getKey())
                .type(alert.getType())
                .severity(alert.getSeverity())
                .title(alert.getTitle())
                .message(alert.getMessage())
                .namespace(alert.getWorkload() != null ? alert.getWorkload().getNamespace() : null)
                .name(alert.getWorkload() != null ? alert.getWorkload().getName() : null)
                .monitorName(alert.getMonitorName())
                .channelsNotified(delivered)
                .exitCode(context.getExitCode())
                .reason(context.getReason())
                .suggestedFix(context.getSuggestedFix())
                .occurredAt(alert.getTimestamp() != null ? alert.getTimestamp() : clock.instant())
                .build();
        try {
            store.storeAlert(history);
        } catch (RuntimeException e) {
            log.error("Failed to store alert history for {}", alert.getKey(), e);
        }
    }

    private static void validate(Alert alert) {
        if (alert == null) {
            throw new IllegalArgumentException("alert is required");
        }
        if (alert.getKey() == null || alert.getKey().isBlank()) {
            throw new IllegalArgumentException("alert dedup key must not be blank");
        }
    }

    private static String typeTag(Alert alert) {
        return alert.getType() != null ? alert.getType().getCode() : "unknown";
    }

    private static final class PendingAlert {
        private final Alert alert;
        private final AlertingConfig config;
        private ScheduledFuture<?> future;

        private PendingAlert(Alert alert, AlertingConfig config) {
            this.alert = alert;
            this.config = config;
        }

        private void cancel() {
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
