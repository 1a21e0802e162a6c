package com.company.guardian.alerting.channel;

import com.company.guardian.alerting.Alert;
import com.company.guardian.domain.enums.Severity;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

public class SlackAlertChannel extends AbstractHttpAlertChannel {

    public static final String TYPE = "slack";

    private final String webhookUrl;
    private final String channel;
    private final AlertTemplate messageTemplate;

    public SlackAlertChannel(ChannelDefinition definition, RestTemplate restTemplate, CircuitBreaker circuitBreaker) {
        super(definition.getName(), restTemplate, circuitBreaker);
        this.webhookUrl = definition.getUrl();
        this.channel = definition.getSlackChannel();
        this.messageTemplate = definition.getMessageTemplate() != null && !definition.getMessageTemplate().isBlank()
                ? new AlertTemplate(definition.getMessageTemplate(), UnaryOperator.identity())
                : null;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    protected String targetUrl() {
        return webhookUrl;
    }

    // Incoming webhooks answer 200 "ok"
    @Override
    protected boolean isAccepted(HttpStatusCode status) {
        return status.value() == HttpStatus.OK.value();
    }

    @Override
    protected Map<String, Object> buildPayload(Alert alert) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", messageTemplate != null ? messageTemplate.render(alert) : renderText(alert));
        if (channel != null && !channel.isBlank()) {
            payload.put("channel", channel);
        }
        return payload;
    }

    static String renderText(Alert alert) {
        StringBuilder text = new StringBuilder();
        text.append(':').append(emoji(alert.getSeverity())).append(": *").append(alert.getTitle()).append("*\n\n");
        if (alert.getWorkload() != null) {
            text.append("*Workload:* `").append(alert.getWorkload()).append("`\n");
        }
        text.append("*Type:* ").append(alert.getType() != null ? alert.getType().getCode() : "unknown").append('\n');
        text.append("*Severity:* ").append(alert.getSeverity() != null ? alert.getSeverity().getCode() : "unknown").append("\n\n");
        text.append(alert.getMessage()).append('\n');

        String fix = alert.getContext() != null ? alert.getContext().getSuggestedFix() : null;
        if (fix != null && !fix.isBlank()) {
            text.append("\n:bulb: *Suggested Fix:* ").append(fix).append('\n');
        }
        return text.toString();
    }

    private static String emoji(Severity severity) {
        if (severity == Severity.CRITICAL) {
            return "red_circle";
        }
        if (severity == Severity.WARNING) {
            return "warning";
        }
        return "large_blue_circle";
    }
}
