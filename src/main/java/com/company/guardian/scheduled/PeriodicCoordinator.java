package com.company.guardian.scheduled;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Base for the background evaluators. Each instance owns one fixed-delay task on the shared
 * scheduler, so a slow tick delays only its own next run. Start and stop are idempotent.
 */
@Slf4j
public abstract class PeriodicCoordinator implements SmartLifecycle {

    // After the dispatcher, so it stops before the dispatcher drops pending alerts
    public static final int PHASE = 100;

    protected final TaskScheduler taskScheduler;
    protected final MeterRegistry meterRegistry;

    private final Object lifecycleMonitor = new Object();
    private ScheduledFuture<?> task;

    protected PeriodicCoordinator(TaskScheduler taskScheduler, MeterRegistry meterRegistry) {
        this.taskScheduler = taskScheduler;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Short identifier used in logs and as the metric tag.
     */
    protected abstract String name();

    protected abstract Duration interval();

    protected Duration startupGracePeriod() {
        return Duration.ZERO;
    }

    /**
     * One evaluation pass. Exceptions escaping here are logged and the next tick still runs.
     */
    protected abstract void tick();

    @Override
    public void start() {
        synchronized (lifecycleMonitor) {
            if (task != null) {
                return;
            }
            Duration interval = interval();
            if (interval == null || interval.isZero() || interval.isNegative()) {
                throw new IllegalStateException(name() + " interval must be positive");
            }
            Duration grace = startupGracePeriod() != null ? startupGracePeriod() : Duration.ZERO;
            Instant firstRun = taskScheduler.getClock().instant().plus(grace);
            task = taskScheduler.scheduleWithFixedDelay(this::runOnce, firstRun, interval);
            log.info("Started {} (interval: {}, grace: {})", name(), interval, grace);
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleMonitor) {
            if (task == null) {
                return;
            }
            task.cancel(false);
            task = null;
            log.info("Stopped {}", name());
        }
    }

    @Override
    public boolean isRunning() {
        synchronized (lifecycleMonitor) {
            return task != null;
        }
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    /**
     * Runs a single tick on the calling thread.
     */
    public void runOnce() {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            tick();
        } catch (Exception e) {
            log.error("{} tick failed", name(), e);
            meterRegistry.counter("guardian.coordinator.failures", "coordinator", name()).increment();
        } finally {
            sample.stop(meterRegistry.timer("guardian.coordinator.tick", "coordinator", name()));
        }
    }
}
