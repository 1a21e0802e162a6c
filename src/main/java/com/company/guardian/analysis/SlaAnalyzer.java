package com.company.guardian.analysis;

import com.company.guardian.domain.ExecutionMetrics;
import com.company.guardian.domain.ExecutionRecord;
import com.company.guardian.domain.TrackedWorkload;
import com.company.guardian.domain.WorkloadRef;
import com.company.guardian.domain.monitor.DeadManSwitchConfig;
import com.company.guardian.domain.monitor.SlaConfig;
import com.company.guardian.exception.InsufficientHistoryException;
import com.company.guardian.repository.ExecutionStore;
import com.company.guardian.schedule.IntervalModel;
import com.company.guardian.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Success-rate, duration and dead-man evaluation over execution history.
 *
 * <p>Every operation is a pure function of the store contents, the policy and the clock.
 * When there is nothing to judge an {@link InsufficientHistoryException} is thrown; callers
 * treat it as "no signal yet" rather than as a pass or a violation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SlaAnalyzer {

    static final double REGRESSION_PERCENTILE = 95.0;
    static final int RECENT_WINDOW_DAYS = 1;

    private final ExecutionStore store;
    private final IntervalModel intervalModel;
    private final Clock clock;

    public ExecutionMetrics getMetrics(WorkloadRef workload, int windowDays) {
        ExecutionMetrics metrics = store.getMetrics(workload, windowDays);
        if (metrics == null || metrics.getTotalRuns() == 0) {
            throw new InsufficientHistoryException(workload, "no completed runs in the last " + windowDays + " days");
        }
        return metrics;
    }

    public SlaResult checkSla(WorkloadRef workload, SlaConfig config) {
        if (config == null) {
            return SlaResult.passing();
        }

        int windowDays = config.effectiveWindowDays();
        double minSuccessRate = config.effectiveMinSuccessRate();

        double successRate = store.getSuccessRate(workload, windowDays)
                .orElseThrow(() -> new InsufficientHistoryException(workload,
                        "no completed runs in the last " + windowDays + " days"));

        SlaResult.SlaResultBuilder result = SlaResult.builder()
                .passed(true)
                .successRate(successRate)
                .minRequired(minSuccessRate);

        if (successRate < minSuccessRate) {
            result.passed(false);
            result.violation(SlaViolation.builder()
                    .type(ViolationType.SUCCESS_RATE)
                    .message(String.format("Success rate %.1f%% is below %.1f%% threshold", successRate, minSuccessRate))
                    .current(successRate)
                    .threshold(minSuccessRate)
                    .build());
        }

        if (config.getMaxDuration() != null) {
            Optional<ExecutionRecord> last = store.getLastExecution(workload);
            Duration lastDuration = last.map(ExecutionRecord::getDuration).orElse(null);
            if (lastDuration != null && lastDuration.compareTo(config.getMaxDuration()) > 0) {
                result.passed(false);
                result.violation(SlaViolation.builder()
                        .type(ViolationType.MAX_DURATION)
                        .message(String.format("Last duration %s exceeded max %s",
                                TimeUtils.formatDuration(lastDuration),
                                TimeUtils.formatDuration(config.getMaxDuration())))
                        .current(lastDuration.toMillis() / 1000.0)
                        .threshold(config.getMaxDuration().toMillis() / 1000.0)
                        .build());
            }
        }

        return result.build();
    }

    /**
     * Dead-man evaluation. A workload that never succeeded is measured from its creation time.
     *
     * @throws com.company.guardian.exception.InvalidScheduleException in auto mode with a bad schedule
     */
    public DeadManResult checkDeadManSwitch(TrackedWorkload workload, DeadManSwitchConfig config) {
        if (config == null || !config.isEnabled()) {
            return DeadManResult.notTriggered();
        }
        if (config.getMaxTimeSinceLastSuccess() == null && !config.isAutoMode()) {
            return DeadManResult.notTriggered();
        }

        Instant now = clock.instant();
        Instant lastSuccess = resolveLastSuccess(workload);
        Instant anchor = lastSuccess != null ? lastSuccess : workload.getCreatedAt();
        if (anchor == null) {
            throw new InsufficientHistoryException(workload.getRef(), "no successful run and no creation time");
        }
        Duration timeSince = Duration.between(anchor, now);

        DeadManResult.DeadManResultBuilder result = DeadManResult.builder()
                .lastSuccess(lastSuccess)
                .timeSinceSuccess(timeSince);

        Duration expectedWithin;
        boolean triggered;
        if (config.getMaxTimeSinceLastSuccess() != null) {
            Duration limit = config.getMaxTimeSinceLastSuccess();
            triggered = intervalModel.exceedsFixedLimit(anchor, limit, now);
            expectedWithin = limit;
            result.expectedInterval(limit)
                    .deadline(anchor.plus(limit))
                    .missedCount(triggered ? 1 : 0);
        } else {
            DeadManSwitchConfig.AutoFromSchedule auto = config.getAutoFromSchedule();
            Duration interval = intervalModel.expectedInterval(workload.getSchedule(),
                    TimeUtils.resolveZone(workload.getTimezone()), now);
            Duration buffer = auto.effectiveBuffer();
            int threshold = auto.effectiveMissedThreshold();
            int missed = intervalModel.missedOccurrences(anchor, interval, buffer, now);

            triggered = missed >= threshold;
            expectedWithin = interval.multipliedBy(threshold).plus(buffer);
            result.expectedInterval(interval)
                    .deadline(intervalModel.deadline(anchor, interval, buffer, threshold))
                    .missedCount(missed);
        }

        result.triggered(triggered);
        if (triggered) {
            if (lastSuccess == null) {
                result.message(String.format("No successful runs since creation (expected within %s)",
                        TimeUtils.formatDuration(expectedWithin)));
            } else {
                result.message(String.format("No successful run in %s (expected within %s)",
                        TimeUtils.formatDuration(timeSince), TimeUtils.formatDuration(expectedWithin)));
            }
        }
        return result.build();
    }

    /**
     * Compares P95 over the baseline window with P95 over the last day. Detected when the
     * increase is at least the threshold percentage.
     */
    public RegressionResult checkDurationRegression(WorkloadRef workload, SlaConfig config) {
        if (config == null) {
            return RegressionResult.builder().detected(false).build();
        }

        double threshold = config.effectiveRegressionThreshold();
        int baselineDays = config.effectiveBaselineWindowDays();

        Duration baseline = store.getDurationPercentile(workload, REGRESSION_PERCENTILE, baselineDays)
                .orElseThrow(() -> new InsufficientHistoryException(workload,
                        "no completed runs in the " + baselineDays + "-day baseline"));
        Duration current = store.getDurationPercentile(workload, REGRESSION_PERCENTILE, RECENT_WINDOW_DAYS)
                .orElseThrow(() -> new InsufficientHistoryException(workload, "no completed runs in the last day"));

        RegressionResult.RegressionResultBuilder result = RegressionResult.builder()
                .baselineP95(baseline)
                .currentP95(current)
                .threshold(threshold);

        if (baseline.isZero() || current.compareTo(baseline) <= 0) {
            return result.detected(false).build();
        }

        double increase = (double) (current.toNanos() - baseline.toNanos()) / baseline.toNanos() * 100.0;
        result.percentageIncrease(increase);

        if (increase >= threshold) {
            result.detected(true)
                    .message(String.format("P95 duration increased %.0f%% (from %s to %s)",
                            increase, TimeUtils.formatDuration(baseline), TimeUtils.formatDuration(current)));
        }
        return result.build();
    }

    private Instant resolveLastSuccess(TrackedWorkload workload) {
        Instant fromStore = store.getLastSuccessfulExecution(workload.getRef())
                .map(ExecutionRecord::getCompletionTime)
                .orElse(null);
        Instant fromStatus = workload.getLastSuccessfulTime();
        if (fromStore == null) {
            return fromStatus;
        }
        if (fromStatus == null) {
            return fromStore;
        }
        return fromStore.isAfter(fromStatus) ? fromStore : fromStatus;
    }
}
