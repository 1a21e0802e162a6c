package com.company.guardian.alerting.channel;

import com.company.guardian.alerting.Alert;
import com.company.guardian.alerting.AlertContext;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * PagerDuty Events API v2. The alert key doubles as the PagerDuty dedup key.
 */
public class PagerDutyAlertChannel extends AbstractHttpAlertChannel {

    public static final String TYPE = "pagerduty";
    public static final String EVENTS_URL = "https://events.pagerduty.com/v2/enqueue";

    private final String eventsUrl;
    private final String routingKey;
    private final String fixedSeverity;

    public PagerDutyAlertChannel(ChannelDefinition definition, RestTemplate restTemplate, CircuitBreaker circuitBreaker) {
        super(definition.getName(), restTemplate, circuitBreaker);
        this.eventsUrl = definition.getUrl() != null && !definition.getUrl().isBlank() ? definition.getUrl() : EVENTS_URL;
        this.routingKey = definition.getRoutingKey();
        this.fixedSeverity = definition.getPagerDutySeverity();
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    protected String targetUrl() {
        return eventsUrl;
    }

    @Override
    protected boolean isAccepted(HttpStatusCode status) {
        return status.value() == HttpStatus.ACCEPTED.value();
    }

    @Override
    protected Map<String, Object> buildPayload(Alert alert) {
        AlertContext context = alert.getContext() != null ? alert.getContext() : new AlertContext();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", alert.getType() != null ? alert.getType().getCode() : null);
        details.put("message", alert.getMessage());
        details.put("suggested_fix", context.getSuggestedFix());
        details.put("success_rate", context.getSuccessRate());
        details.put("exit_code", context.getExitCode());
        details.put("reason", context.getReason());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("summary", alert.getTitle());
        body.put("source", alert.getWorkload() != null ? alert.getWorkload().toString() : "workload-guardian");
        body.put("severity", severity(alert));
        body.put("timestamp", alert.getTimestamp() != null ? alert.getTimestamp().toString() : null);
        body.put("custom_details", details);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("routing_key", routingKey);
        payload.put("event_action", "trigger");
        payload.put("dedup_key", alert.getKey());
        payload.put("payload", body);
        return payload;
    }

    private String severity(Alert alert) {
        if (fixedSeverity != null && !fixedSeverity.isBlank()) {
            return fixedSeverity;
        }
        return alert.getSeverity() != null ? alert.getSeverity().getCode() : "info";
    }
}
