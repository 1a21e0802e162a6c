package com.company.guardian.config;

import com.company.guardian.alerting.DefaultAlertDispatcher;
import com.company.guardian.alerting.channel.AlertChannel;
import com.company.guardian.alerting.channel.AlertChannelFactory;
import com.company.guardian.alerting.channel.ChannelDefinition;
import com.company.guardian.repository.ExecutionStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
@Slf4j
public class AlertingConfiguration {

    @Bean(name = "alertRestTemplate")
    public RestTemplate alertRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Channels from {@code guardian.channels} are registered before the dispatcher starts, so the
     * first coordinator tick already sees them. A definition that cannot be built is skipped.
     */
    @Bean
    public DefaultAlertDispatcher alertDispatcher(ExecutionStore store,
                                                  @Qualifier("guardianTaskScheduler") TaskScheduler taskScheduler,
                                                  MeterRegistry meterRegistry,
                                                  Clock clock,
                                                  GuardianProperties properties,
                                                  AlertChannelFactory channelFactory) {
        DefaultAlertDispatcher dispatcher = new DefaultAlertDispatcher(
                store, taskScheduler, meterRegistry, clock, properties.getRateLimits());

        for (ChannelDefinition definition : properties.getChannels()) {
            try {
                AlertChannel channel = channelFactory.create(definition);
                dispatcher.registerChannel(channel, definition.getRateLimiting());
            } catch (IllegalArgumentException e) {
                log.error("Skipping alert channel {}: {}", definition.getName(), e.getMessage());
            }
        }
        return dispatcher;
    }
}
