package com.company.guardian.alerting;

import com.company.guardian.alerting.channel.AlertChannel;
import com.company.guardian.alerting.channel.ChannelDefinition;
import com.company.guardian.config.GuardianProperties;
import com.company.guardian.domain.AlertHistory;
import com.company.guardian.domain.WorkloadRef;
import com.company.guardian.domain.enums.AlertType;
import com.company.guardian.domain.enums.Severity;
import com.company.guardian.domain.monitor.AlertingConfig;
import com.company.guardian.domain.monitor.ChannelRef;
import com.company.guardian.exception.AlertSendException;
import com.company.guardian.exception.ChannelNotFoundException;
import com.company.guardian.repository.ExecutionStore;
import com.company.guardian.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultAlertDispatcherTest {

    private static final WorkloadRef REF = WorkloadRef.of("batch", "nightly-report");

    private MutableClock clock;
    private ExecutionStore store;
    private ThreadPoolTaskScheduler scheduler;
    private SimpleMeterRegistry meterRegistry;
    private GuardianProperties.RateLimits rateLimits;
    private AlertChannel ops;
    private DefaultAlertDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-10T12:00:00Z"));
        store = mock(ExecutionStore.class);
        meterRegistry = new SimpleMeterRegistry();
        rateLimits = new GuardianProperties.RateLimits();

        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("dispatcher-test-");
        scheduler.initialize();

        ops = channel("ops");
        dispatcher = newDispatcher();
        dispatcher.registerChannel(ops, null);
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
        scheduler.shutdown();
    }

    private DefaultAlertDispatcher newDispatcher() {
        return new DefaultAlertDispatcher(store, scheduler, meterRegistry, clock, rateLimits);
    }

    private static AlertChannel channel(String name) {
        AlertChannel channel = mock(AlertChannel.class);
        when(channel.getName()).thenReturn(name);
        when(channel.getType()).thenReturn("webhook");
        return channel;
    }

    private static Alert alert(AlertType type) {
        return alert(REF, type, type.getDefaultSeverity());
    }

    private static Alert alert(WorkloadRef ref, AlertType type, Severity severity) {
        return Alert.builder()
                .key(AlertKeys.of(ref, type))
                .type(type)
                .severity(severity)
                .title(type.getCode() + ": " + ref)
                .message("something is wrong")
                .workload(ref)
                .monitorName("default")
                .build();
    }

    private static AlertingConfig routeTo(String... channelNames) {
        AlertingConfig config = AlertingConfig.builder().build();
        for (String name : channelNames) {
            config.getChannelRefs().add(ChannelRef.builder().name(name).build());
        }
        return config;
    }

    @Nested
    @DisplayName("suppression")
    class Suppression {

        @Test
        void duplicateWithinWindowIsSuppressed() {
            AlertingConfig config = routeTo("ops");

            assertThat(dispatcher.dispatch(alert(AlertType.DEAD_MAN_TRIGGERED), config)).isEqualTo(DispatchResult.SENT);
            assertThat(dispatcher.dispatch(alert(AlertType.DEAD_MAN_TRIGGERED), config)).isEqualTo(DispatchResult.SUPPRESSED);

            verify(ops, times(1)).send(any());
            assertThat(meterRegistry.counter("guardian.alerts.suppressed", "type", "DeadManTriggered").count()).isEqualTo(1.0);
        }

        @Test
        void duplicateAfterWindowIsSentAgain() {
            AlertingConfig config = routeTo("ops");
            config.setSuppressDuplicatesFor(Duration.ofMinutes(30));

            dispatcher.dispatch(alert(AlertType.STUCK_JOB), config);
            clock.advance(Duration.ofMinutes(29));
            assertThat(dispatcher.dispatch(alert(AlertType.STUCK_JOB), config)).isEqualTo(DispatchResult.SUPPRESSED);

            clock.advance(Duration.ofMinutes(1));
            assertThat(dispatcher.dispatch(alert(AlertType.STUCK_JOB), config)).isEqualTo(DispatchResult.SENT);
        }

        @Test
        void clearedAlertIsTreatedAsNew() {
            AlertingConfig config = routeTo("ops");
            Alert alert = alert(AlertType.JOB_FAILED);

            dispatcher.dispatch(alert, config);
            assertThat(dispatcher.clearAlert(alert.getKey())).isTrue();
            assertThat(dispatcher.clearAlert(alert.getKey())).isFalse();

            assertThat(dispatcher.dispatch(alert, config)).isEqualTo(DispatchResult.SENT);
        }

        @Test
        void clearAlertsForWorkloadDoesNotTouchSimilarNames() {
            AlertingConfig config = routeTo("ops");
            WorkloadRef sibling = WorkloadRef.of("batch", "nightly-report-v2");

            dispatcher.dispatch(alert(AlertType.JOB_FAILED), config);
            dispatcher.dispatch(alert(sibling, AlertType.JOB_FAILED, Severity.WARNING), config);

            assertThat(dispatcher.clearAlertsForWorkload("batch", "nightly-report")).isEqualTo(1);
            assertThat(dispatcher.getActiveCount()).isEqualTo(1);
        }

        @Test
        void isSuppressedDoesNotChangeState() {
            AlertingConfig config = routeTo("ops");
            Alert alert = alert(AlertType.SLA_BREACHED);

            assertThat(dispatcher.isSuppressed(alert, config).isSuppressed()).isFalse();
            assertThat(dispatcher.isSuppressed(alert, config).isSuppressed()).isFalse();
            assertThat(dispatcher.dispatch(alert, config)).isEqualTo(DispatchResult.SENT);

            SuppressionCheck check = dispatcher.isSuppressed(alert, config);
            assertThat(check.isSuppressed()).isTrue();
            assertThat(check.getReason()).contains("duplicate");
        }

        @Test
        void recentUnresolvedHistoryRestoresSuppression() {
            Alert alert = alert(AlertType.DEAD_MAN_TRIGGERED);
            when(store.listAlertHistory(any())).thenReturn(List.of(AlertHistory.builder()
                    .alertKey(alert.getKey())
                    .type(AlertType.DEAD_MAN_TRIGGERED)
                    .occurredAt(clock.instant().minus(Duration.ofMinutes(10)))
                    .build()));

            assertThat(dispatcher.loadRecentAlerts()).isEqualTo(1);
            assertThat(dispatcher.dispatch(alert, routeTo("ops"))).isEqualTo(DispatchResult.SUPPRESSED);
            verify(ops, never()).send(any());
        }
    }

    @Nested
    @DisplayName("delayed alerts")
    class Delayed {

        private AlertingConfig delayed(Duration delay) {
            AlertingConfig config = routeTo("ops");
            config.setAlertDelay(delay);
            return config;
        }

        @Test
        void cancelledBeforeFiringIsNeverSent() {
            AlertingConfig config = delayed(Duration.ofMillis(300));
            Alert alert = alert(AlertType.JOB_FAILED);

            assertThat(dispatcher.dispatch(alert, config)).isEqualTo(DispatchResult.PENDING);
            assertThat(dispatcher.dispatch(alert, config)).isEqualTo(DispatchResult.PENDING);
            assertThat(dispatcher.getPendingCount()).isEqualTo(1);

            assertThat(dispatcher.cancelPendingAlert(alert.getKey())).isTrue();
            assertThat(dispatcher.cancelPendingAlert(alert.getKey())).isFalse();

            verify(ops, after(700).never()).send(any());
            assertThat(dispatcher.getActiveCount()).isZero();
        }

        @Test
        void firesAfterDelay() {
            Alert alert = alert(AlertType.JOB_FAILED);

            dispatcher.dispatch(alert, delayed(Duration.ofMillis(100)));

            verify(ops, timeout(2000)).send(alert);
            verify(store, timeout(2000)).storeAlert(any());
            assertThat(dispatcher.getPendingCount()).isZero();
            assertThat(dispatcher.getActiveCount()).isEqualTo(1);

            assertThat(dispatcher.cancelPendingAlert(alert.getKey())).isFalse();
            assertThat(dispatcher.getActiveCount()).isEqualTo(1);
            verify(ops, after(200).times(1)).send(any());
        }

        @Test
        void cancelForWorkloadMatchesWholeNameSegment() {
            AlertingConfig config = delayed(Duration.ofMinutes(5));
            WorkloadRef sibling = WorkloadRef.of("batch", "nightly-report-v2");

            dispatcher.dispatch(alert(AlertType.JOB_FAILED), config);
            dispatcher.dispatch(alert(AlertType.STUCK_JOB), config);
            dispatcher.dispatch(alert(sibling, AlertType.JOB_FAILED, Severity.WARNING), config);

            assertThat(dispatcher.cancelPendingAlertsForWorkload("batch", "nightly-report")).isEqualTo(2);
            assertThat(dispatcher.getPendingCount()).isEqualTo(1);
        }

        @Test
        void shutdownDropsPendingAndLaterDispatches() {
            dispatcher.dispatch(alert(AlertType.JOB_FAILED), delayed(Duration.ofMillis(200)));

            dispatcher.shutdown();

            assertThat(dispatcher.getPendingCount()).isZero();
            assertThat(dispatcher.dispatch(alert(AlertType.STUCK_JOB), routeTo("ops"))).isEqualTo(DispatchResult.DROPPED);
            verify(ops, after(500).never()).send(any());
        }
    }

    @Nested
    @DisplayName("routing and rate limits")
    class Routing {

        @Test
        void severityFilterSelectsChannels() {
            AlertChannel pager = channel("pager");
            dispatcher.registerChannel(pager, null);

            AlertingConfig config = routeTo("ops");
            config.getChannelRefs().add(ChannelRef.builder().name("pager").severities(Set.of(Severity.CRITICAL)).build());

            dispatcher.dispatch(alert(REF, AlertType.JOB_FAILED, Severity.WARNING), config);
            dispatcher.dispatch(alert(REF, AlertType.DEAD_MAN_TRIGGERED, Severity.CRITICAL), config);

            verify(ops, times(2)).send(any());
            verify(pager, times(1)).send(any());
        }

        @Test
        void noMatchingChannel() {
            AlertingConfig config = AlertingConfig.builder().build();
            config.getChannelRefs().add(ChannelRef.builder().name("ops").severities(Set.of(Severity.CRITICAL)).build());

            assertThat(dispatcher.dispatch(alert(REF, AlertType.JOB_FAILED, Severity.WARNING), config))
                    .isEqualTo(DispatchResult.NO_CHANNELS);
            assertThat(dispatcher.dispatch(alert(AlertType.STUCK_JOB), routeTo("missing")))
                    .isEqualTo(DispatchResult.NO_CHANNELS);
        }

        @Test
        void channelBurstLimitsDistinctAlerts() {
            AlertChannel limited = channel("limited");
            dispatcher.registerChannel(limited, new ChannelDefinition.RateLimiting(1, 1));

            assertThat(dispatcher.dispatch(alert(AlertType.JOB_FAILED), routeTo("limited"))).isEqualTo(DispatchResult.SENT);
            assertThat(dispatcher.dispatch(alert(AlertType.STUCK_JOB), routeTo("limited"))).isEqualTo(DispatchResult.RATE_LIMITED);

            verify(limited, times(1)).send(any());
        }

        @Test
        void globalLimitAppliesAcrossChannels() {
            rateLimits.setGlobalBurst(1);
            rateLimits.setMaxAlertsPerMinute(1);
            DefaultAlertDispatcher limitedDispatcher = newDispatcher();
            limitedDispatcher.registerChannel(ops, null);

            assertThat(limitedDispatcher.dispatch(alert(AlertType.JOB_FAILED), routeTo("ops"))).isEqualTo(DispatchResult.SENT);
            assertThat(limitedDispatcher.dispatch(alert(AlertType.STUCK_JOB), routeTo("ops"))).isEqualTo(DispatchResult.RATE_LIMITED);

            clock.advance(Duration.ofMinutes(2));
            assertThat(limitedDispatcher.dispatch(alert(AlertType.STUCK_JOB), routeTo("ops"))).isEqualTo(DispatchResult.SENT);
        }

        @Test
        void disabledConfigIsNotDispatched() {
            AlertingConfig config = routeTo("ops");
            config.setEnabled(false);

            assertThat(dispatcher.dispatch(alert(AlertType.JOB_FAILED), config)).isEqualTo(DispatchResult.DISABLED);
            assertThat(dispatcher.dispatch(alert(AlertType.JOB_FAILED), null)).isEqualTo(DispatchResult.DISABLED);
            verify(ops, never()).send(any());
        }

        @Test
        void blankKeyIsRejected() {
            Alert alert = alert(AlertType.JOB_FAILED);
            alert.setKey(" ");

            assertThatThrownBy(() -> dispatcher.dispatch(alert, routeTo("ops")))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> dispatcher.dispatch(null, routeTo("ops")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("channel health")
    class Health {

        @Test
        void consecutiveFailuresResetOnSuccess() {
            doThrow(new AlertSendException("HTTP 500"))
                    .doThrow(new AlertSendException("HTTP 502"))
                    .doNothing()
                    .when(ops).send(any());
            AlertingConfig config = routeTo("ops");

            assertThat(dispatcher.dispatch(alert(AlertType.JOB_FAILED), config)).isEqualTo(DispatchResult.FAILED);
            assertThat(dispatcher.dispatch(alert(AlertType.JOB_FAILED), config)).isEqualTo(DispatchResult.FAILED);

            ChannelStats failing = dispatcher.getChannelStats("ops").orElseThrow();
            assertThat(failing.getConsecutiveFailures()).isEqualTo(2);
            assertThat(failing.getLastFailedError()).isEqualTo("HTTP 502");

            assertThat(dispatcher.dispatch(alert(AlertType.JOB_FAILED), config)).isEqualTo(DispatchResult.SENT);

            ChannelStats recovered = dispatcher.getChannelStats("ops").orElseThrow();
            assertThat(recovered.getConsecutiveFailures()).isZero();
            assertThat(recovered.getAlertsFailedTotal()).isEqualTo(2);
            assertThat(recovered.getAlertsSentTotal()).isEqualTo(1);
            assertThat(recovered.getLastAlertTime()).isEqualTo(clock.instant());
        }

        @Test
        void partialDeliveryCountsAsSent() {
            AlertChannel broken = channel("broken");
            doThrow(new AlertSendException("timeout")).when(broken).send(any());
            dispatcher.registerChannel(broken, null);

            assertThat(dispatcher.dispatch(alert(AlertType.JOB_FAILED), routeTo("broken", "ops")))
                    .isEqualTo(DispatchResult.SENT);

            ArgumentCaptor<AlertHistory> history = ArgumentCaptor.forClass(AlertHistory.class);
            verify(store).storeAlert(history.capture());
            assertThat(history.getValue().getChannelsNotified()).containsExactly("ops");
        }

        @Test
        void statsAreSnapshots() {
            ChannelStats before = dispatcher.getChannelStats("ops").orElseThrow();

            dispatcher.dispatch(alert(AlertType.JOB_FAILED), routeTo("ops"));

            assertThat(before.getAlertsSentTotal()).isZero();
            assertThat(dispatcher.getAllChannelStats()).singleElement()
                    .satisfies(s -> assertThat(s.getAlertsSentTotal()).isEqualTo(1));
        }

        @Test
        void healthIsSavedAfterEverySend() {
            doThrow(new AlertSendException("HTTP 503")).doNothing().when(ops).send(any());

            dispatcher.dispatch(alert(AlertType.JOB_FAILED), routeTo("ops"));
            dispatcher.dispatch(alert(AlertType.JOB_FAILED), routeTo("ops"));

            ArgumentCaptor<ChannelStats> saved = ArgumentCaptor.forClass(ChannelStats.class);
            verify(store, times(2)).saveChannelStats(saved.capture());
            assertThat(saved.getAllValues().get(0).getConsecutiveFailures()).isEqualTo(1);
            assertThat(saved.getAllValues().get(1).getAlertsSentTotal()).isEqualTo(1);
            assertThat(saved.getAllValues().get(1).getConsecutiveFailures()).isZero();
        }

        @Test
        void storedHealthIsRestoredOnStart() {
            Instant failedAt = clock.instant().minus(Duration.ofMinutes(5));
            when(store.getAllChannelStats()).thenReturn(List.of(
                    ChannelStats.builder().name("ops").type("webhook")
                            .alertsSentTotal(40).alertsFailedTotal(3).consecutiveFailures(3)
                            .lastFailedTime(failedAt).lastFailedError("HTTP 500").build(),
                    ChannelStats.builder().name("audit").type("webhook").alertsSentTotal(7).build()));

            dispatcher.start();
            try {
                ChannelStats restored = dispatcher.getChannelStats("ops").orElseThrow();
                assertThat(restored.getAlertsSentTotal()).isEqualTo(40);
                assertThat(restored.getConsecutiveFailures()).isEqualTo(3);
                assertThat(restored.getLastFailedTime()).isEqualTo(failedAt);
                assertThat(dispatcher.getChannelStats("audit")).isEmpty();

                dispatcher.registerChannel(channel("audit"), null);

                assertThat(dispatcher.getChannelStats("audit").orElseThrow().getAlertsSentTotal()).isEqualTo(7);
            } finally {
                dispatcher.stop();
            }
        }

        @Test
        void failingHealthStoreDoesNotFailDispatch() {
            doThrow(new IllegalStateException("db down")).when(store).saveChannelStats(any());

            assertThat(dispatcher.dispatch(alert(AlertType.JOB_FAILED), routeTo("ops"))).isEqualTo(DispatchResult.SENT);
            assertThat(dispatcher.getChannelStats("ops").orElseThrow().getAlertsSentTotal()).isEqualTo(1);
        }
    }

    @Test
    void sentAlertIsPersistedWithContext() {
        Alert alert = alert(AlertType.JOB_FAILED);
        alert.getContext().setExitCode(137);
        alert.getContext().setReason("OOMKilled");
        alert.getContext().setSuggestedFix("Increase the memory limit.");

        dispatcher.dispatch(alert, routeTo("ops"));

        ArgumentCaptor<AlertHistory> captor = ArgumentCaptor.forClass(AlertHistory.class);
        verify(store).storeAlert(captor.capture());
        AlertHistory history = captor.getValue();
        assertThat(history.getAlertKey()).isEqualTo("batch/nightly-report/JobFailed");
        assertThat(history.getNamespace()).isEqualTo("batch");
        assertThat(history.getName()).isEqualTo("nightly-report");
        assertThat(history.getExitCode()).isEqualTo(137);
        assertThat(history.getReason()).isEqualTo("OOMKilled");
        assertThat(history.getChannelsNotified()).containsExactly("ops");
        assertThat(history.getOccurredAt()).isEqualTo(clock.instant());
    }

    @Test
    void historyFailureDoesNotFailDispatch() {
        when(store.storeAlert(any())).thenThrow(new IllegalStateException("db down"));

        assertThat(dispatcher.dispatch(alert(AlertType.JOB_FAILED), routeTo("ops"))).isEqualTo(DispatchResult.SENT);
    }

    @Test
    void testSendToUnknownChannelFails() {
        assertThatThrownBy(() -> dispatcher.sendToChannel("nope", alert(AlertType.TEST)))
                .isInstanceOf(ChannelNotFoundException.class);
    }

    @Test
    void sendToChannelBypassesSuppression() {
        Alert alert = alert(AlertType.TEST);
        dispatcher.sendToChannel("ops", alert);
        dispatcher.sendToChannel("ops", alert);

        verify(ops, times(2)).send(alert);
        assertThat(dispatcher.getActiveCount()).isZero();
    }

    @Test
    void alertCountCoversLastDay() {
        AlertingConfig config = routeTo("ops");
        dispatcher.dispatch(alert(AlertType.JOB_FAILED), config);
        dispatcher.dispatch(alert(AlertType.STUCK_JOB), config);

        assertThat(dispatcher.getAlertCount24h()).isEqualTo(2);

        clock.advance(Duration.ofHours(25));
        dispatcher.cleanupExpired();

        assertThat(dispatcher.getAlertCount24h()).isZero();
        assertThat(dispatcher.getActiveCount()).isZero();
    }

    @Test
    void removedChannelIsNoLongerUsed() {
        assertThat(dispatcher.removeChannel("ops")).isTrue();

        assertThat(dispatcher.dispatch(alert(AlertType.JOB_FAILED), routeTo("ops"))).isEqualTo(DispatchResult.NO_CHANNELS);
        assertThat(dispatcher.getChannelStats("ops")).isEmpty();
    }
}
