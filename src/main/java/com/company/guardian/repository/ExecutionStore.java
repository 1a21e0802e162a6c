package com.company.guardian.repository;

import com.company.guardian.alerting.ChannelStats;
import com.company.guardian.domain.AlertHistory;
import com.company.guardian.domain.AlertHistoryQuery;
import com.company.guardian.domain.ExecutionMetrics;
import com.company.guardian.domain.ExecutionRecord;
import com.company.guardian.domain.WorkloadRef;
import com.company.guardian.domain.enums.AlertType;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Execution history, alert history and channel delivery health. Implementations must be safe for concurrent use by
 * several coordinators. Failures surface as Spring {@code DataAccessException}s.
 */
public interface ExecutionStore {

    ExecutionRecord startExecution(ExecutionRecord execution);

    /**
     * Sets completion fields on a running execution. Returns empty when the execution does
     * not exist; an already-completed execution is returned unchanged.
     */
    Optional<ExecutionRecord> completeExecution(long executionId, Instant completionTime,
                                                boolean succeeded, Integer exitCode, String reason);

    Optional<ExecutionRecord> findExecution(long executionId);

    /**
     * Executions started at or after {@code since}, most recent first.
     */
    List<ExecutionRecord> getExecutions(WorkloadRef workload, Instant since);

    List<ExecutionRecord> getRunningExecutions(WorkloadRef workload);

    /**
     * Most recently completed execution.
     */
    Optional<ExecutionRecord> getLastExecution(WorkloadRef workload);

    Optional<ExecutionRecord> getLastSuccessfulExecution(WorkloadRef workload);

    ExecutionMetrics getMetrics(WorkloadRef workload, int windowDays);

    /**
     * Nearest-rank percentile of completed-run durations in the window; empty when no
     * completed runs fall inside it.
     */
    Optional<Duration> getDurationPercentile(WorkloadRef workload, double percentile, int windowDays);

    /**
     * Success percentage of completed runs in the window; empty when there are none.
     */
    Optional<Double> getSuccessRate(WorkloadRef workload, int windowDays);

    AlertHistory storeAlert(AlertHistory alert);

    /**
     * Marks unresolved history rows of this type for the workload as resolved.
     *
     * @return number of rows resolved
     */
    int resolveAlert(AlertType type, String namespace, String name);

    List<AlertHistory> listAlertHistory(AlertHistoryQuery query);

    /**
     * Deletes executions that completed before {@code olderThan}.
     *
     * @return number of deleted rows
     */
    int prune(Instant olderThan);

    /**
     * Inserts or replaces the stored health of one channel, keyed by channel name.
     */
    void saveChannelStats(ChannelStats stats);

    List<ChannelStats> getAllChannelStats();
}
