package com.company.guardian.alerting.channel;

import com.company.guardian.alerting.Alert;
import com.company.guardian.alerting.AlertContext;
import com.company.guardian.domain.WorkloadRef;
import com.company.guardian.domain.enums.AlertType;
import com.company.guardian.domain.enums.Severity;
import com.company.guardian.exception.AlertSendException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SlackAlertChannelTest {

    private static final String URL = "https://hooks.slack.example/services/T000/B000/XXX";

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private SlackAlertChannel channel;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        channel = new SlackAlertChannel(ChannelDefinition.builder()
                .name("slack-ops")
                .type("slack")
                .url(URL)
                .slackChannel("#batch-alerts")
                .build(), restTemplate, CircuitBreaker.ofDefaults("slack"));
    }

    private static Alert alert(Severity severity, String fix) {
        return Alert.builder()
                .key("batch/nightly-report/DeadManTriggered")
                .type(AlertType.DEAD_MAN_TRIGGERED)
                .severity(severity)
                .title("Dead-man's switch triggered: batch/nightly-report")
                .message("No successful run in 26h 0m (expected within 25h 0m)")
                .workload(WorkloadRef.of("batch", "nightly-report"))
                .context(AlertContext.builder().suggestedFix(fix).build())
                .build();
    }

    @Test
    void rendersTextWithSeverityAndFix() {
        String text = SlackAlertChannel.renderText(alert(Severity.CRITICAL, "Check the scheduler"));

        assertThat(text).startsWith(":red_circle: *Dead-man's switch triggered: batch/nightly-report*");
        assertThat(text).contains("*Workload:* `batch/nightly-report`");
        assertThat(text).contains("*Type:* DeadManTriggered");
        assertThat(text).contains(":bulb: *Suggested Fix:* Check the scheduler");
    }

    @Test
    void omitsFixWhenAbsent() {
        assertThat(SlackAlertChannel.renderText(alert(Severity.WARNING, null)))
                .startsWith(":warning:")
                .doesNotContain("Suggested Fix");
    }

    @Test
    void postsToWebhookWithChannelOverride() {
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.channel").value("#batch-alerts"))
                .andExpect(jsonPath("$.text").exists())
                .andRespond(withSuccess("ok", MediaType.TEXT_PLAIN));

        channel.send(alert(Severity.CRITICAL, null));

        server.verify();
    }

    @Test
    void nonOkStatusIsFailure() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.NO_CONTENT));

        assertThatThrownBy(() -> channel.send(alert(Severity.CRITICAL, null)))
                .isInstanceOf(AlertSendException.class)
                .hasMessageContaining("204");
    }

    @Test
    void messageTemplateReplacesDefaultText() {
        SlackAlertChannel templated = new SlackAlertChannel(ChannelDefinition.builder()
                .name("slack-ops")
                .type("slack")
                .url(URL)
                .messageTemplate("[{{severity}}] {{workload}}: {{message}}")
                .build(), restTemplate, CircuitBreaker.ofDefaults("slack"));

        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.text")
                        .value("[critical] batch/nightly-report: No successful run in 26h 0m (expected within 25h 0m)"))
                .andExpect(jsonPath("$.channel").doesNotExist())
                .andRespond(withSuccess("ok", MediaType.TEXT_PLAIN));

        templated.send(alert(Severity.CRITICAL, null));

        server.verify();
    }
}
