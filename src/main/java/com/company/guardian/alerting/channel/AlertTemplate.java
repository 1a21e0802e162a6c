package com.company.guardian.alerting.channel;

import com.company.guardian.alerting.Alert;
import com.company.guardian.alerting.AlertContext;
import com.company.guardian.domain.WorkloadRef;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ParseException;
import org.springframework.expression.common.TemplateParserContext;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.function.UnaryOperator;

/**
 * User-supplied channel body with {@code {{field}}} placeholders, e.g.
 * {@code {"text": "{{title}}: {{message}}"}}.
 *
 * <p>Placeholders are read-only property lookups on {@link Fields}. Text values pass through
 * the channel's escaper; {@code exitCode} and {@code successRate} render as {@code null} when
 * absent. Templates referring to unknown fields are rejected when created.
 */
public class AlertTemplate {

    private static final SpelExpressionParser PARSER = new SpelExpressionParser();
    private static final TemplateParserContext PLACEHOLDERS = new TemplateParserContext("{{", "}}");

    private final Expression expression;
    private final UnaryOperator<String> escaper;
    private final EvaluationContext evaluationContext = SimpleEvaluationContext.forReadOnlyDataBinding().build();

    public AlertTemplate(String template, UnaryOperator<String> escaper) {
        this.escaper = escaper;
        try {
            this.expression = PARSER.parseExpression(template, PLACEHOLDERS);
            render(new Alert());
        } catch (ParseException | EvaluationException e) {
            throw new IllegalArgumentException("Invalid alert template: " + e.getMessage(), e);
        }
    }

    public String render(Alert alert) {
        return expression.getValue(evaluationContext, new Fields(alert, escaper), String.class);
    }

    /**
     * Values visible to a template.
     */
    public static class Fields {

        private final Alert alert;
        private final AlertContext context;
        private final WorkloadRef workload;
        private final UnaryOperator<String> escaper;

        Fields(Alert alert, UnaryOperator<String> escaper) {
            this.alert = alert;
            this.context = alert.getContext() != null ? alert.getContext() : new AlertContext();
            this.workload = alert.getWorkload();
            this.escaper = escaper;
        }

        public String getKey() {
            return text(alert.getKey());
        }

        public String getType() {
            return text(alert.getType() != null ? alert.getType().getCode() : null);
        }

        public String getSeverity() {
            return text(alert.getSeverity() != null ? alert.getSeverity().getCode() : null);
        }

        public String getTitle() {
            return text(alert.getTitle());
        }

        public String getMessage() {
            return text(alert.getMessage());
        }

        public String getNamespace() {
            return text(workload != null ? workload.getNamespace() : null);
        }

        public String getName() {
            return text(workload != null ? workload.getName() : null);
        }

        public String getWorkload() {
            return text(workload != null ? workload.toString() : null);
        }

        public String getMonitor() {
            return text(alert.getMonitorName());
        }

        public String getTimestamp() {
            return text(alert.getTimestamp() != null ? alert.getTimestamp().toString() : null);
        }

        public String getSuggestedFix() {
            return text(context.getSuggestedFix());
        }

        public String getReason() {
            return text(context.getReason());
        }

        public String getExitCode() {
            return context.getExitCode() != null ? context.getExitCode().toString() : "null";
        }

        public String getSuccessRate() {
            return context.getSuccessRate() != null ? context.getSuccessRate().toString() : "null";
        }

        private String text(String value) {
            return escaper.apply(value != null ? value : "");
        }
    }
}
