package com.company.guardian.domain;

import com.company.guardian.domain.enums.AlertType;
import com.company.guardian.domain.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertHistory {
    private Long id;
    private String alertKey;
    private AlertType type;
    private Severity severity;
    private String title;
    private String message;
    private String namespace;
    private String name;
    private String monitorName;

    @Builder.Default
    private List<String> channelsNotified = new ArrayList<>();

    private Integer exitCode;
    private String reason;
    private String suggestedFix;

    private Instant occurredAt;
    private Instant resolvedAt;
}
