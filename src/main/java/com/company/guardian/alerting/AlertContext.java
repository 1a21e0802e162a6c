package com.company.guardian.alerting;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertContext {
    private Double successRate;
    private Integer exitCode;
    private String reason;
    private String logsExcerpt;
    private String suggestedFix;

    // Supporting metrics such as missed count or regression percentage
    @Builder.Default
    private Map<String, Object> metrics = new LinkedHashMap<>();
}
