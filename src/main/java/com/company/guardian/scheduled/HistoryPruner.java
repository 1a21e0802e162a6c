package com.company.guardian.scheduled;

import com.company.guardian.config.GuardianProperties;
import com.company.guardian.repository.ExecutionStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Deletes completed executions older than the retention period.
 */
@Component
@Slf4j
public class HistoryPruner extends PeriodicCoordinator {

    private final ExecutionStore store;
    private final GuardianProperties properties;
    private final Clock clock;

    public HistoryPruner(ExecutionStore store,
                         GuardianProperties properties,
                         Clock clock,
                         TaskScheduler taskScheduler,
                         MeterRegistry meterRegistry) {
        super(taskScheduler, meterRegistry);
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    protected String name() {
        return "history-pruner";
    }

    @Override
    protected Duration interval() {
        return properties.getScheduler().getPruneInterval();
    }

    @Override
    protected void tick() {
        int retentionDays = properties.getHistoryRetention().getDefaultDays();
        Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));

        try {
            int deleted = store.prune(cutoff);
            if (deleted > 0) {
                log.info("Pruned {} executions older than {}", deleted, cutoff);
            }
            meterRegistry.counter("guardian.history.pruned").increment(deleted);
        } catch (Exception e) {
            log.error("Failed to prune execution history", e);
            meterRegistry.counter("guardian.history.prune.failures").increment();
        }
    }
}
