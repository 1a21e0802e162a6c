package com.company.guardian.scheduled;

import com.company.guardian.alerting.DefaultAlertDispatcher;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PeriodicCoordinatorTest {

    private ThreadPoolTaskScheduler scheduler;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.initialize();
        meterRegistry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void failingTickIsCountedAndNextTickStillRuns() throws InterruptedException {
        CountDownLatch ticks = new CountDownLatch(3);
        CountingCoordinator coordinator = new CountingCoordinator(scheduler, meterRegistry, Duration.ofMillis(20), () -> {
            ticks.countDown();
            throw new IllegalStateException("boom");
        });

        coordinator.start();
        try {
            assertThat(ticks.await(2, TimeUnit.SECONDS)).isTrue();
        } finally {
            coordinator.stop();
        }

        assertThat(meterRegistry.counter("guardian.coordinator.failures", "coordinator", "counting").count())
                .isGreaterThanOrEqualTo(2.0);
        assertThat(meterRegistry.timer("guardian.coordinator.tick", "coordinator", "counting").count())
                .isGreaterThanOrEqualTo(2L);
    }

    @Test
    void startAndStopAreIdempotent() throws InterruptedException {
        CountingCoordinator coordinator = new CountingCoordinator(scheduler, meterRegistry, Duration.ofMillis(20), () -> { });

        coordinator.start();
        coordinator.start();
        assertThat(coordinator.isRunning()).isTrue();

        coordinator.stop();
        coordinator.stop();
        assertThat(coordinator.isRunning()).isFalse();

        int afterStop = coordinator.count.get();
        Thread.sleep(150);
        assertThat(coordinator.count.get()).isLessThanOrEqualTo(afterStop + 1);
    }

    @Test
    void firstTickWaitsForStartupGracePeriod() throws InterruptedException {
        CountDownLatch firstTick = new CountDownLatch(1);
        CountingCoordinator coordinator = new CountingCoordinator(scheduler, meterRegistry, Duration.ofMillis(20),
                Duration.ofMillis(800), firstTick::countDown);

        coordinator.start();
        try {
            Thread.sleep(300);
            assertThat(coordinator.count.get()).isZero();

            assertThat(firstTick.await(3, TimeUnit.SECONDS)).isTrue();
            assertThat(coordinator.count.get()).isPositive();
        } finally {
            coordinator.stop();
        }
    }

    @Test
    void nonPositiveIntervalIsRejected() {
        CountingCoordinator coordinator = new CountingCoordinator(scheduler, meterRegistry, Duration.ZERO, () -> { });

        assertThatThrownBy(coordinator::start).isInstanceOf(IllegalStateException.class);
        assertThat(coordinator.isRunning()).isFalse();
    }

    @Test
    void runsInPhaseAfterDispatcher() {
        CountingCoordinator coordinator = new CountingCoordinator(scheduler, meterRegistry, Duration.ofSeconds(1), () -> { });

        assertThat(coordinator.getPhase()).isGreaterThan(DefaultAlertDispatcher.PHASE);
    }

    private static class CountingCoordinator extends PeriodicCoordinator {
        private final Duration interval;
        private final Duration grace;
        private final Runnable body;
        private final AtomicInteger count = new AtomicInteger();

        CountingCoordinator(TaskScheduler taskScheduler, MeterRegistry meterRegistry, Duration interval, Runnable body) {
            this(taskScheduler, meterRegistry, interval, Duration.ZERO, body);
        }

        CountingCoordinator(TaskScheduler taskScheduler, MeterRegistry meterRegistry, Duration interval,
                            Duration grace, Runnable body) {
            super(taskScheduler, meterRegistry);
            this.interval = interval;
            this.grace = grace;
            this.body = body;
        }

        @Override
        protected String name() {
            return "counting";
        }

        @Override
        protected Duration interval() {
            return interval;
        }

        @Override
        protected Duration startupGracePeriod() {
            return grace;
        }

        @Override
        protected void tick() {
            count.incrementAndGet();
            body.run();
        }
    }
}
