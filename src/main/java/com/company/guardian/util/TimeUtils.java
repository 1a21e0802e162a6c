package com.company.guardian.util;

import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;

@Slf4j
public class TimeUtils {

    public static final ZoneId UTC = ZoneOffset.UTC;

    private TimeUtils() {
    }

    /**
     * Resolve the first usable zone id from the candidates, in order.
     * Blank and unknown ids are skipped; UTC when none resolves.
     */
    public static ZoneId resolveZone(String... candidates) {
        if (candidates == null) {
            return UTC;
        }
        for (String candidate : candidates) {
            if (candidate == null || candidate.isBlank()) {
                continue;
            }
            try {
                return ZoneId.of(candidate.trim());
            } catch (DateTimeException e) {
                log.warn("Unknown timezone '{}', falling back", candidate);
            }
        }
        return UTC;
    }

    public static String formatDuration(Duration duration) {
        if (duration == null) return null;
        return formatDuration(duration.toMillis());
    }

    public static String formatDuration(Long durationMs) {
        if (durationMs == null) return null;

        long hours = durationMs / 3600000;
        long minutes = (durationMs % 3600000) / 60000;
        long seconds = (durationMs % 60000) / 1000;

        if (hours > 0) {
            return String.format("%dh %dm", hours, minutes);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, seconds);
        } else {
            return String.format("%ds", seconds);
        }
    }

    public static Duration maxOf(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
