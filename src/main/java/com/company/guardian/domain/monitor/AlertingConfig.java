package com.company.guardian.domain.monitor;

import com.company.guardian.domain.enums.AlertType;
import com.company.guardian.domain.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routing and suppression policy applied by the dispatcher.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertingConfig {

    public static final Duration DEFAULT_SUPPRESS_DUPLICATES_FOR = Duration.ofHours(1);

    private Boolean enabled;

    @Builder.Default
    private List<ChannelRef> channelRefs = new ArrayList<>();

    private Duration suppressDuplicatesFor;

    // Wait this long before sending; the alert is dropped if cancelled meanwhile
    private Duration alertDelay;

    @Builder.Default
    private Map<AlertType, Severity> severityOverrides = new EnumMap<>(AlertType.class);

    public boolean isEnabled() {
        return enabled == null || enabled;
    }

    public Duration effectiveSuppressDuplicatesFor() {
        return suppressDuplicatesFor != null ? suppressDuplicatesFor : DEFAULT_SUPPRESS_DUPLICATES_FOR;
    }

    public boolean hasDelay() {
        return alertDelay != null && !alertDelay.isZero() && !alertDelay.isNegative();
    }

    public Severity severityFor(AlertType type) {
        if (severityOverrides != null && severityOverrides.containsKey(type)) {
            return severityOverrides.get(type);
        }
        return type.getDefaultSeverity();
    }
}
