package com.company.guardian.schedule;

import com.company.guardian.domain.monitor.MaintenanceWindow;
import com.company.guardian.exception.InvalidScheduleException;
import com.company.guardian.util.TimeUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether an instant falls inside a maintenance window.
 *
 * <p>For each window the most recent start at or before the instant is found by walking back at
 * most one schedule period; the instant is inside when {@code start <= instant < start + duration}.
 * Zones resolve window first, then workload, then UTC. Windows with a bad schedule are skipped.
 */
@Component
@Slf4j
public class MaintenanceWindowEvaluator {

    private static final int PERIOD_SAMPLES = 8;

    public boolean isInMaintenanceWindow(List<MaintenanceWindow> windows, Instant instant, String workloadTimezone) {
        return activeWindow(windows, instant, workloadTimezone).isPresent();
    }

    public Optional<MaintenanceWindow> activeWindow(List<MaintenanceWindow> windows, Instant instant, String workloadTimezone) {
        if (windows == null || windows.isEmpty()) {
            return Optional.empty();
        }

        for (MaintenanceWindow window : windows) {
            if (!window.isSuppressAlerts()) {
                continue;
            }
            try {
                if (contains(window, instant, workloadTimezone)) {
                    return Optional.of(window);
                }
            } catch (InvalidScheduleException e) {
                log.warn("Skipping maintenance window '{}': {}", window.getName(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    boolean contains(MaintenanceWindow window, Instant instant, String workloadTimezone) {
        Duration duration = window.getDuration();
        if (duration == null || duration.isZero() || duration.isNegative()) {
            log.debug("Maintenance window '{}' has no duration", window.getName());
            return false;
        }

        CronSchedule schedule = CronSchedule.parse(window.getSchedule());
        ZoneId zone = schedule.zoneOr(TimeUtils.resolveZone(window.getTimezone(), workloadTimezone));
        ZonedDateTime at = instant.atZone(zone);

        Duration period = schedule.maxInterval(at, PERIOD_SAMPLES);
        Optional<ZonedDateTime> start = schedule.latestAtOrBefore(at, period);
        if (start.isEmpty()) {
            return false;
        }

        Instant windowStart = start.get().toInstant();
        Instant windowEnd = windowStart.plus(duration);
        return !instant.isBefore(windowStart) && instant.isBefore(windowEnd);
    }
}
