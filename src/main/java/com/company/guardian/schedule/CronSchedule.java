package com.company.guardian.schedule;

import com.company.guardian.exception.InvalidScheduleException;
import com.company.guardian.util.TimeUtils;
import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * A parsed recurring schedule. Accepts standard 5-field cron, Spring's 6-field form, the
 * {@code @daily}-style macros, and an optional {@code CRON_TZ=}/{@code TZ=} prefix.
 */
public final class CronSchedule {

    private static final String[] ZONE_PREFIXES = {"CRON_TZ=", "TZ="};

    private final String expression;
    private final CronExpression cron;
    private final ZoneId embeddedZone;

    private CronSchedule(String expression, CronExpression cron, ZoneId embeddedZone) {
        this.expression = expression;
        this.cron = cron;
        this.embeddedZone = embeddedZone;
    }

    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException(expression, "schedule is empty");
        }

        String body = expression.trim();
        ZoneId zone = null;
        for (String prefix : ZONE_PREFIXES) {
            if (body.startsWith(prefix)) {
                int space = body.indexOf(' ');
                if (space < 0) {
                    throw new InvalidScheduleException(expression, "timezone prefix without schedule");
                }
                String zoneId = body.substring(prefix.length(), space);
                try {
                    zone = ZoneId.of(zoneId);
                } catch (DateTimeException e) {
                    throw new InvalidScheduleException(expression, e);
                }
                body = body.substring(space + 1).trim();
                break;
            }
        }

        if (!body.startsWith("@") && body.split("\\s+").length == 5) {
            body = "0 " + body;
        }

        try {
            return new CronSchedule(expression, CronExpression.parse(body), zone);
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException(expression, e);
        }
    }

    public String getExpression() {
        return expression;
    }

    /**
     * The zone the schedule should be evaluated in: an embedded {@code CRON_TZ=} wins over
     * the supplied fallback.
     */
    public ZoneId zoneOr(ZoneId fallback) {
        if (embeddedZone != null) {
            return embeddedZone;
        }
        return fallback != null ? fallback : TimeUtils.UTC;
    }

    /**
     * Next occurrence strictly after {@code after}.
     */
    public ZonedDateTime next(ZonedDateTime after) {
        ZonedDateTime next = cron.next(after);
        if (next == null) {
            throw new InvalidScheduleException(expression, "schedule has no future occurrence");
        }
        return next;
    }

    /**
     * Largest gap between {@code samples} consecutive occurrences following {@code reference}.
     * Taking the maximum keeps irregular schedules (weekdays only, month ends) from firing early.
     */
    public Duration maxInterval(ZonedDateTime reference, int samples) {
        if (samples < 1) {
            throw new IllegalArgumentException("samples must be positive");
        }
        ZonedDateTime previous = next(reference);
        Duration max = Duration.ZERO;
        for (int i = 0; i < samples; i++) {
            ZonedDateTime current = next(previous);
            max = TimeUtils.maxOf(max, Duration.between(previous, current));
            previous = current;
        }
        return max;
    }

    /**
     * Most recent occurrence at or before {@code instant}, looking back at most {@code lookback}.
     */
    public Optional<ZonedDateTime> latestAtOrBefore(ZonedDateTime instant, Duration lookback) {
        ZonedDateTime cursor = instant.minus(lookback);
        ZonedDateTime latest = null;
        ZonedDateTime candidate = next(cursor);
        while (!candidate.isAfter(instant)) {
            latest = candidate;
            candidate = next(candidate);
        }
        return Optional.ofNullable(latest);
    }

    @Override
    public String toString() {
        return expression;
    }
}
