package com.company.guardian.schedule;

import com.company.guardian.exception.InvalidScheduleException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * Expected cadence of a recurring schedule and the missed-run deadline derived from it.
 *
 * <p>Occurrence {@code k} (k &ge; 1) after the last success is due at
 * {@code lastSuccess + k * interval}; the buffer extends every occurrence's deadline
 * individually, so the missed count is the number of extended deadlines strictly in the past.
 * A workload triggers once that count reaches the threshold, i.e. when
 * {@code now > lastSuccess + threshold * interval + buffer}.
 */
@Component
public class IntervalModel {

    static final int INTERVAL_SAMPLES = 6;

    /**
     * @throws InvalidScheduleException when the schedule cannot be parsed
     */
    public Duration expectedInterval(String schedule, ZoneId zone, Instant reference) {
        CronSchedule cron = CronSchedule.parse(schedule);
        ZoneId effective = cron.zoneOr(zone);
        Duration interval = cron.maxInterval(reference.atZone(effective), INTERVAL_SAMPLES);
        if (interval.isZero() || interval.isNegative()) {
            throw new InvalidScheduleException(schedule, "could not infer a positive interval");
        }
        return interval;
    }

    public int missedOccurrences(Instant lastSuccess, Duration interval, Duration buffer, Instant now) {
        requirePositive(interval);
        Duration elapsed = Duration.between(lastSuccess, now).minus(buffer);
        if (elapsed.isZero() || elapsed.isNegative()) {
            return 0;
        }
        long missed = elapsed.minusNanos(1).toNanos() / interval.toNanos();
        return (int) Math.min(missed, Integer.MAX_VALUE);
    }

    public Instant deadline(Instant lastSuccess, Duration interval, Duration buffer, int missedThreshold) {
        requirePositive(interval);
        return lastSuccess.plus(interval.multipliedBy(Math.max(1, missedThreshold))).plus(buffer);
    }

    public boolean isOverdue(Instant lastSuccess, Duration interval, Duration buffer, int missedThreshold, Instant now) {
        return missedOccurrences(lastSuccess, interval, buffer, now) >= Math.max(1, missedThreshold);
    }

    /**
     * Fixed mode: the time since the last success strictly exceeds the limit.
     */
    public boolean exceedsFixedLimit(Instant lastSuccess, Duration maxTimeSinceLastSuccess, Instant now) {
        return Duration.between(lastSuccess, now).compareTo(maxTimeSinceLastSuccess) > 0;
    }

    private static void requirePositive(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
    }
}
