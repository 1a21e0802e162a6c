package com.company.guardian.alerting.channel;

import com.company.guardian.alerting.Alert;
import com.company.guardian.alerting.AlertContext;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generic HTTP webhook. Sends a fixed JSON body unless the definition carries a payload
 * template, in which case text fields are JSON-escaped into it.
 */
public class WebhookAlertChannel extends AbstractHttpAlertChannel {

    public static final String TYPE = "webhook";

    private final String url;
    private final HttpMethod method;
    private final Map<String, String> headers;
    private final AlertTemplate payloadTemplate;

    public WebhookAlertChannel(ChannelDefinition definition, RestTemplate restTemplate, CircuitBreaker circuitBreaker) {
        super(definition.getName(), restTemplate, circuitBreaker);
        this.url = definition.getUrl();
        this.method = definition.getMethod() != null && !definition.getMethod().isBlank()
                ? HttpMethod.valueOf(definition.getMethod().toUpperCase())
                : HttpMethod.POST;
        this.headers = definition.getHeaders() != null ? Map.copyOf(definition.getHeaders()) : Map.of();
        this.payloadTemplate = definition.getPayloadTemplate() != null && !definition.getPayloadTemplate().isBlank()
                ? new AlertTemplate(definition.getPayloadTemplate(), WebhookAlertChannel::jsonEscape)
                : null;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    protected String targetUrl() {
        return url;
    }

    @Override
    protected HttpMethod method() {
        return method;
    }

    @Override
    protected void addHeaders(HttpHeaders httpHeaders) {
        headers.forEach(httpHeaders::set);
    }

    @Override
    protected Object buildPayload(Alert alert) {
        if (payloadTemplate != null) {
            return payloadTemplate.render(alert);
        }
        return defaultPayload(alert);
    }

    private static Map<String, Object> defaultPayload(Alert alert) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("key", alert.getKey());
        payload.put("type", alert.getType() != null ? alert.getType().getCode() : null);
        payload.put("severity", alert.getSeverity() != null ? alert.getSeverity().getCode() : null);
        payload.put("title", alert.getTitle());
        payload.put("message", alert.getMessage());
        if (alert.getWorkload() != null) {
            payload.put("workload", Map.of(
                    "namespace", alert.getWorkload().getNamespace(),
                    "name", alert.getWorkload().getName()));
        }
        payload.put("monitor", alert.getMonitorName());
        payload.put("timestamp", alert.getTimestamp() != null ? alert.getTimestamp().toString() : null);

        AlertContext context = alert.getContext() != null ? alert.getContext() : new AlertContext();
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("suggested_fix", context.getSuggestedFix());
        ctx.put("success_rate", context.getSuccessRate());
        ctx.put("exit_code", context.getExitCode());
        ctx.put("reason", context.getReason());
        if (context.getMetrics() != null && !context.getMetrics().isEmpty()) {
            ctx.put("metrics", context.getMetrics());
        }
        payload.put("context", ctx);
        return payload;
    }

    static String jsonEscape(String value) {
        return new String(JsonStringEncoder.getInstance().quoteAsString(value));
    }
}
