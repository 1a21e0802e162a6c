package com.company.guardian.alerting.channel;

import com.company.guardian.alerting.Alert;
import com.company.guardian.exception.AlertSendException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * JSON-over-HTTP destination. Sends go through a per-channel circuit breaker so a dead
 * endpoint fails fast; there is no retry inside a send.
 */
@Slf4j
public abstract class AbstractHttpAlertChannel implements AlertChannel {

    private final String name;
    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;

    protected AbstractHttpAlertChannel(String name, RestTemplate restTemplate, CircuitBreaker circuitBreaker) {
        this.name = name;
        this.restTemplate = restTemplate;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void send(Alert alert) {
        try {
            circuitBreaker.executeRunnable(() -> post(alert));
        } catch (CallNotPermittedException e) {
            throw new AlertSendException("Circuit open for " + getType() + " channel " + name, e);
        } catch (AlertSendException e) {
            throw e;
        } catch (RestClientException e) {
            throw new AlertSendException("Failed to send alert via " + getType() + " channel " + name
                    + ": " + e.getMessage(), e);
        }
    }

    protected abstract String targetUrl();

    /**
     * Request body: a map serialized as JSON, or an already rendered JSON string.
     */
    protected abstract Object buildPayload(Alert alert);

    protected HttpMethod method() {
        return HttpMethod.POST;
    }

    protected void addHeaders(HttpHeaders headers) {
    }

    protected boolean isAccepted(HttpStatusCode status) {
        return status.is2xxSuccessful();
    }

    private void post(Alert alert) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        addHeaders(headers);
        HttpEntity<Object> request = new HttpEntity<>(buildPayload(alert), headers);

        ResponseEntity<String> response = restTemplate.exchange(targetUrl(), method(), request, String.class);
        if (!isAccepted(response.getStatusCode())) {
            throw new AlertSendException(getType() + " channel " + name + " returned status "
                    + response.getStatusCode().value());
        }
        log.debug("Alert {} delivered via {} channel {}", alert.getKey(), getType(), name);
    }
}
