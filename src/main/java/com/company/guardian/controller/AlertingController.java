package com.company.guardian.controller;

import com.company.guardian.alerting.Alert;
import com.company.guardian.alerting.AlertDispatcher;
import com.company.guardian.alerting.ChannelStats;
import com.company.guardian.domain.AlertHistory;
import com.company.guardian.domain.AlertHistoryQuery;
import com.company.guardian.domain.enums.AlertType;
import com.company.guardian.domain.enums.Severity;
import com.company.guardian.dto.response.ChannelStatusResponse;
import com.company.guardian.repository.ExecutionStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Alerting", description = "Channel health, test sends and alert history")
@RequiredArgsConstructor
@Slf4j
public class AlertingController {

    // Channels with this many failures in a row are reported unhealthy
    static final int UNHEALTHY_AFTER_FAILURES = 3;

    private final AlertDispatcher alertDispatcher;
    private final ExecutionStore store;
    private final Clock clock;

    @GetMapping("/channels")
    @Operation(summary = "Delivery health of every registered channel")
    public ResponseEntity<List<ChannelStatusResponse>> channels() {
        List<ChannelStatusResponse> response = alertDispatcher.getAllChannelStats().stream()
                .sorted(Comparator.comparing(ChannelStats::getName))
                .map(AlertingController::toResponse)
                .collect(Collectors.toList());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/channels/{name}/test")
    @Operation(summary = "Send a test alert", description = "Bypasses suppression and rate limits")
    public ResponseEntity<Map<String, Object>> testChannel(@PathVariable String name) {
        Instant now = clock.instant();
        Alert alert = Alert.builder()
                .key("test/" + name + "/" + now.toEpochMilli())
                .type(AlertType.TEST)
                .severity(Severity.INFO)
                .title("Test alert")
                .message("Test alert from workload-guardian to channel " + name)
                .timestamp(now)
                .build();

        log.info("Sending test alert to channel {}", name);
        alertDispatcher.sendToChannel(name, alert);

        Map<String, Object> response = new HashMap<>();
        response.put("channel", name);
        response.put("status", "SENT");
        response.put("timestamp", now);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/alerts/history")
    @Operation(summary = "Recorded alerts, most recent first")
    public ResponseEntity<List<AlertHistory>> history(
            @RequestParam(required = false) String namespace,
            @RequestParam(required = false) String name,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since,
            @RequestParam(defaultValue = "false") boolean unresolvedOnly,
            @RequestParam(defaultValue = "100") int limit) {

        AlertHistoryQuery query = AlertHistoryQuery.builder()
                .namespace(namespace)
                .name(name)
                .type(type != null ? AlertType.fromCode(type) : null)
                .since(since)
                .unresolvedOnly(unresolvedOnly)
                .limit(Math.min(Math.max(limit, 1), 1000))
                .build();

        return ResponseEntity.ok(store.listAlertHistory(query));
    }

    private static ChannelStatusResponse toResponse(ChannelStats stats) {
        return ChannelStatusResponse.builder()
                .name(stats.getName())
                .type(stats.getType())
                .healthy(stats.getConsecutiveFailures() < UNHEALTHY_AFTER_FAILURES)
                .alertsSentTotal(stats.getAlertsSentTotal())
                .alertsFailedTotal(stats.getAlertsFailedTotal())
                .consecutiveFailures(stats.getConsecutiveFailures())
                .lastAlertTime(stats.getLastAlertTime())
                .lastFailedTime(stats.getLastFailedTime())
                .lastFailedError(stats.getLastFailedError())
                .build();
    }
}
