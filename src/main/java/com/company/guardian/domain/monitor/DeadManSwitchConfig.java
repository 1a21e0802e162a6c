package com.company.guardian.domain.monitor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Either a fixed {@code maxTimeSinceLastSuccess} or an interval inferred from the schedule.
 * The fixed threshold wins when both are set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadManSwitchConfig {

    public static final Duration DEFAULT_BUFFER = Duration.ofHours(1);
    public static final int DEFAULT_MISSED_THRESHOLD = 1;

    private Boolean enabled;
    private Duration maxTimeSinceLastSuccess;
    private AutoFromSchedule autoFromSchedule;

    public boolean isEnabled() {
        return enabled == null || enabled;
    }

    public boolean isAutoMode() {
        return maxTimeSinceLastSuccess == null && autoFromSchedule != null && autoFromSchedule.isEnabled();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AutoFromSchedule {
        private boolean enabled;
        private Duration buffer;
        private Integer missedScheduleThreshold;

        public Duration effectiveBuffer() {
            return buffer != null ? buffer : DEFAULT_BUFFER;
        }

        public int effectiveMissedThreshold() {
            return missedScheduleThreshold != null && missedScheduleThreshold > 0
                    ? missedScheduleThreshold
                    : DEFAULT_MISSED_THRESHOLD;
        }
    }
}
