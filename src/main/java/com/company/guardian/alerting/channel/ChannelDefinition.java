package com.company.guardian.alerting.channel;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configured destination, bound from {@code guardian.channels[]} or registered at runtime.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelDefinition {

    @NotBlank(message = "Channel name is required")
    private String name;

    @NotBlank(message = "Channel type is required (webhook, slack, pagerduty or telemetry)")
    private String type;

    private String url;

    // Webhook only, defaults to POST
    private String method;

    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();

    // Webhook body with {{field}} placeholders, replaces the default JSON payload
    private String payloadTemplate;

    // Slack channel override
    private String slackChannel;

    // Slack message text with {{field}} placeholders
    private String messageTemplate;

    // PagerDuty
    private String routingKey;
    private String pagerDutySeverity;

    @Valid
    private RateLimiting rateLimiting;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RateLimiting {
        private Integer burst;
        private Integer maxPerHour;
    }
}
