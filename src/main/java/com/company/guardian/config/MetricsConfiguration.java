package com.company.guardian.config;

import com.company.guardian.alerting.AlertDispatcher;
import com.company.guardian.scheduled.SuspensionTracker;
import com.company.guardian.workload.InMemoryTrackedWorkloadProvider;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Engine state gauges
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final AlertDispatcher alertDispatcher;
    private final InMemoryTrackedWorkloadProvider workloadProvider;
    private final SuspensionTracker suspensionTracker;

    @Bean
    public MeterBinder guardianMetrics() {
        return (reg) -> {
            Gauge.builder("guardian.alerts.pending", alertDispatcher, AlertDispatcher::getPendingCount)
                    .description("Delayed alerts waiting to fire")
                    .register(reg);

            Gauge.builder("guardian.alerts.active", alertDispatcher, AlertDispatcher::getActiveCount)
                    .description("Alerts sent and still within their suppression state")
                    .register(reg);

            Gauge.builder("guardian.workloads.tracked", workloadProvider, InMemoryTrackedWorkloadProvider::size)
                    .description("Workloads under monitoring")
                    .register(reg);

            Gauge.builder("guardian.workloads.suspended_tracked", suspensionTracker, SuspensionTracker::size)
                    .description("Workloads currently tracked as suspended")
                    .register(reg);

            log.info("Guardian metrics registered");
        };
    }
}
