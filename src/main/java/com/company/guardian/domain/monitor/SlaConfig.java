package com.company.guardian.domain.monitor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaConfig {

    public static final double DEFAULT_MIN_SUCCESS_RATE = 95.0;
    public static final int DEFAULT_WINDOW_DAYS = 7;
    public static final double DEFAULT_REGRESSION_THRESHOLD = 50.0;
    public static final int DEFAULT_BASELINE_WINDOW_DAYS = 14;

    private Boolean enabled;
    private Double minSuccessRate;
    private Integer windowDays;
    private Duration maxDuration;
    private Double durationRegressionThreshold;
    private Integer durationBaselineWindowDays;

    public boolean isEnabled() {
        return enabled == null || enabled;
    }

    public double effectiveMinSuccessRate() {
        return minSuccessRate != null ? minSuccessRate : DEFAULT_MIN_SUCCESS_RATE;
    }

    public int effectiveWindowDays() {
        return windowDays != null && windowDays > 0 ? windowDays : DEFAULT_WINDOW_DAYS;
    }

    public double effectiveRegressionThreshold() {
        return durationRegressionThreshold != null ? durationRegressionThreshold : DEFAULT_REGRESSION_THRESHOLD;
    }

    public int effectiveBaselineWindowDays() {
        return durationBaselineWindowDays != null && durationBaselineWindowDays > 0
                ? durationBaselineWindowDays
                : DEFAULT_BASELINE_WINDOW_DAYS;
    }
}
