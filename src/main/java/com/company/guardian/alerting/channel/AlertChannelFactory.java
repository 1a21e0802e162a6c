package com.company.guardian.alerting.channel;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.opentelemetry.api.trace.Tracer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.Locale;

/**
 * Builds channel adapters from their definitions.
 */
@Component
@Slf4j
public class AlertChannelFactory {

    private final RestTemplate restTemplate;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final Tracer tracer;

    public AlertChannelFactory(@Qualifier("alertRestTemplate") RestTemplate restTemplate,
                               CircuitBreakerRegistry circuitBreakerRegistry,
                               Tracer tracer) {
        this.restTemplate = restTemplate;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.tracer = tracer;
    }

    public AlertChannel create(ChannelDefinition definition) {
        if (definition.getName() == null || definition.getName().isBlank()) {
            throw new IllegalArgumentException("Channel name is required");
        }
        String type = definition.getType() == null ? "" : definition.getType().trim().toLowerCase(Locale.ROOT);

        if (WebhookAlertChannel.TYPE.equals(type)) {
            requireUrl(definition);
            return new WebhookAlertChannel(definition, restTemplate, circuitBreaker(definition));
        }
        if (SlackAlertChannel.TYPE.equals(type)) {
            requireUrl(definition);
            return new SlackAlertChannel(definition, restTemplate, circuitBreaker(definition));
        }
        if (PagerDutyAlertChannel.TYPE.equals(type)) {
            if (definition.getRoutingKey() == null || definition.getRoutingKey().isBlank()) {
                throw new IllegalArgumentException("PagerDuty channel " + definition.getName() + " requires a routing key");
            }
            return new PagerDutyAlertChannel(definition, restTemplate, circuitBreaker(definition));
        }
        if (TelemetryAlertChannel.TYPE.equals(type)) {
            return new TelemetryAlertChannel(definition.getName(), tracer);
        }
        throw new IllegalArgumentException("Unsupported channel type '" + definition.getType()
                + "' for channel " + definition.getName());
    }

    private CircuitBreaker circuitBreaker(ChannelDefinition definition) {
        return circuitBreakerRegistry.circuitBreaker("alert-channel-" + definition.getName());
    }

    private static void requireUrl(ChannelDefinition definition) {
        if (definition.getUrl() == null || definition.getUrl().isBlank()) {
            throw new IllegalArgumentException(definition.getType() + " channel " + definition.getName() + " requires a url");
        }
    }
}
