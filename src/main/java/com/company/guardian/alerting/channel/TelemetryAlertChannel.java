package com.company.guardian.alerting.channel;

import com.company.guardian.alerting.Alert;
import com.company.guardian.exception.AlertSendException;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;

/**
 * Records alerts as span events on the configured OpenTelemetry exporter.
 */
@Slf4j
public class TelemetryAlertChannel implements AlertChannel {

    public static final String TYPE = "telemetry";

    private final String name;
    private final Tracer tracer;

    public TelemetryAlertChannel(String name, Tracer tracer) {
        this.name = name;
        this.tracer = tracer;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public void send(Alert alert) {
        Span span = tracer.spanBuilder("guardian.alert")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("alert.key", alert.getKey());
            span.setAttribute("alert.type", alert.getType() != null ? alert.getType().getCode() : "unknown");
            span.setAttribute("severity", alert.getSeverity() != null ? alert.getSeverity().getCode() : "unknown");
            if (alert.getWorkload() != null) {
                span.setAttribute("workload.namespace", alert.getWorkload().getNamespace());
                span.setAttribute("workload.name", alert.getWorkload().getName());
            }
            if (alert.getMonitorName() != null) {
                span.setAttribute("monitor.name", alert.getMonitorName());
            }

            span.addEvent(alert.getTitle() != null ? alert.getTitle() : "Alert raised",
                    Attributes.of(
                            AttributeKey.stringKey("message"), alert.getMessage() != null ? alert.getMessage() : "",
                            AttributeKey.stringKey("timestamp"),
                            alert.getTimestamp() != null ? alert.getTimestamp().toString() : ""));

            log.info("Alert {} recorded to telemetry channel {}", alert.getKey(), name);

        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to record alert");
            throw new AlertSendException("Failed to record alert on telemetry channel " + name, e);
        } finally {
            span.end();
        }
    }
}
