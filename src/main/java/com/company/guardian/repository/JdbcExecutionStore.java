package com.company.guardian.repository;

import com.company.guardian.alerting.ChannelStats;
import com.company.guardian.analysis.DurationStatistics;
import com.company.guardian.domain.AlertHistory;
import com.company.guardian.domain.AlertHistoryQuery;
import com.company.guardian.domain.ExecutionMetrics;
import com.company.guardian.domain.ExecutionRecord;
import com.company.guardian.domain.WorkloadRef;
import com.company.guardian.domain.enums.AlertType;
import com.company.guardian.domain.enums.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Relational store over {@code executions}, {@code alert_history} and {@code channel_stats}. Percentiles are computed
 * in Java with nearest rank so every database gives the same answer.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcExecutionStore implements ExecutionStore {

    private static final String EXECUTION_COLUMNS = """
            id, namespace, name, run_name, start_time, completion_time, succeeded, exit_code, reason
            """;

    private static final String ALERT_COLUMNS = """
            id, alert_key, alert_type, severity, title, message, namespace, name, monitor_name,
            channels_notified, exit_code, reason, suggested_fix, occurred_at, resolved_at
            """;

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    @Override
    public ExecutionRecord startExecution(ExecutionRecord execution) {
        String sql = """
            INSERT INTO executions (
                namespace, name, run_name, start_time, completion_time,
                succeeded, exit_code, reason, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
            ps.setString(1, execution.getWorkload().getNamespace());
            ps.setString(2, execution.getWorkload().getName());
            ps.setString(3, execution.getRunName());
            ps.setTimestamp(4, Timestamp.from(execution.getStartTime()));
            ps.setTimestamp(5, toTimestamp(execution.getCompletionTime()));
            if (execution.getSucceeded() != null) {
                ps.setBoolean(6, execution.getSucceeded());
            } else {
                ps.setNull(6, Types.BOOLEAN);
            }
            ps.setObject(7, execution.getExitCode(), Types.INTEGER);
            ps.setString(8, execution.getReason());
            ps.setTimestamp(9, Timestamp.from(clock.instant()));
            return ps;
        }, keyHolder);

        long id = keyHolder.getKey().longValue();
        return findExecution(id).orElseThrow();
    }

    @Override
    public Optional<ExecutionRecord> completeExecution(long executionId, Instant completionTime,
                                                       boolean succeeded, Integer exitCode, String reason) {
        // Only running rows are updated, completed records never change
        String sql = """
            UPDATE executions
            SET completion_time = ?,
                succeeded = ?,
                exit_code = ?,
                reason = ?
            WHERE id = ?
            AND completion_time IS NULL
            """;

        int updated = jdbcTemplate.update(sql,
                Timestamp.from(completionTime),
                succeeded,
                exitCode,
                reason,
                executionId
        );

        if (updated == 0) {
            log.debug("Execution {} not updated (missing or already completed)", executionId);
        }
        return findExecution(executionId);
    }

    @Override
    public Optional<ExecutionRecord> findExecution(long executionId) {
        String sql = "SELECT " + EXECUTION_COLUMNS + " FROM executions WHERE id = ?";
        List<ExecutionRecord> results = jdbcTemplate.query(sql, new ExecutionRowMapper(), executionId);
        return results.stream().findFirst();
    }

    @Override
    public List<ExecutionRecord> getExecutions(WorkloadRef workload, Instant since) {
        String sql = "SELECT " + EXECUTION_COLUMNS + """
            FROM executions
            WHERE namespace = ? AND name = ?
            AND start_time >= ?
            ORDER BY start_time DESC, id DESC
            """;

        return jdbcTemplate.query(sql, new ExecutionRowMapper(),
                workload.getNamespace(), workload.getName(), Timestamp.from(since));
    }

    @Override
    public List<ExecutionRecord> getRunningExecutions(WorkloadRef workload) {
        String sql = "SELECT " + EXECUTION_COLUMNS + """
            FROM executions
            WHERE namespace = ? AND name = ?
            AND completion_time IS NULL
            ORDER BY start_time ASC, id ASC
            """;

        return jdbcTemplate.query(sql, new ExecutionRowMapper(), workload.getNamespace(), workload.getName());
    }

    @Override
    public Optional<ExecutionRecord> getLastExecution(WorkloadRef workload) {
        String sql = "SELECT " + EXECUTION_COLUMNS + """
            FROM executions
            WHERE namespace = ? AND name = ?
            AND completion_time IS NOT NULL
            ORDER BY completion_time DESC, id DESC
            LIMIT 1
            """;

        return jdbcTemplate.query(sql, new ExecutionRowMapper(), workload.getNamespace(), workload.getName())
                .stream().findFirst();
    }

    @Override
    public Optional<ExecutionRecord> getLastSuccessfulExecution(WorkloadRef workload) {
        String sql = "SELECT " + EXECUTION_COLUMNS + """
            FROM executions
            WHERE namespace = ? AND name = ?
            AND completion_time IS NOT NULL
            AND succeeded = TRUE
            ORDER BY completion_time DESC, id DESC
            LIMIT 1
            """;

        return jdbcTemplate.query(sql, new ExecutionRowMapper(), workload.getNamespace(), workload.getName())
                .stream().findFirst();
    }

    @Override
    public ExecutionMetrics getMetrics(WorkloadRef workload, int windowDays) {
        List<ExecutionRecord> completed = completedInWindow(workload, windowDays);

        int total = completed.size();
        int successful = (int) completed.stream().filter(ExecutionRecord::isSuccessful).count();
        List<Duration> durations = durations(completed);

        ExecutionMetrics.ExecutionMetricsBuilder metrics = ExecutionMetrics.builder()
                .windowDays(windowDays)
                .totalRuns(total)
                .successfulRuns(successful)
                .failedRuns(total - successful)
                .successRate(total > 0 ? successful * 100.0 / total : 0.0)
                .avgDuration(DurationStatistics.average(durations));

        if (!durations.isEmpty()) {
            metrics.p50Duration(DurationStatistics.percentile(durations, 50))
                    .p95Duration(DurationStatistics.percentile(durations, 95))
                    .p99Duration(DurationStatistics.percentile(durations, 99));
        }
        return metrics.build();
    }

    @Override
    public Optional<Duration> getDurationPercentile(WorkloadRef workload, double percentile, int windowDays) {
        List<Duration> durations = durations(completedInWindow(workload, windowDays));
        if (durations.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(DurationStatistics.percentile(durations, percentile));
    }

    @Override
    public Optional<Double> getSuccessRate(WorkloadRef workload, int windowDays) {
        String sql = """
            SELECT COUNT(*) AS total,
                   COALESCE(SUM(CASE WHEN succeeded = TRUE THEN 1 ELSE 0 END), 0) AS successful
            FROM executions
            WHERE namespace = ? AND name = ?
            AND start_time >= ?
            AND completion_time IS NOT NULL
            """;

        Map<String, Object> row = jdbcTemplate.queryForMap(sql,
                workload.getNamespace(), workload.getName(), windowStart(windowDays));

        long total = ((Number) row.get("total")).longValue();
        long successful = ((Number) row.get("successful")).longValue();
        if (total == 0) {
            return Optional.empty();
        }
        return Optional.of(successful * 100.0 / total);
    }

    @Override
    public AlertHistory storeAlert(AlertHistory alert) {
        if (alert.getOccurredAt() == null) {
            alert.setOccurredAt(clock.instant());
        }

        String sql = """
            INSERT INTO alert_history (
                alert_key, alert_type, severity, title, message, namespace, name, monitor_name,
                channels_notified, exit_code, reason, suggested_fix, occurred_at, resolved_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"id"});
            ps.setString(1, alert.getAlertKey());
            ps.setString(2, alert.getType().getCode());
            ps.setString(3, alert.getSeverity() != null ? alert.getSeverity().getCode() : Severity.WARNING.getCode());
            ps.setString(4, alert.getTitle());
            ps.setString(5, alert.getMessage());
            ps.setString(6, alert.getNamespace());
            ps.setString(7, alert.getName());
            ps.setString(8, alert.getMonitorName());
            ps.setString(9, alert.getChannelsNotified() != null ? String.join(",", alert.getChannelsNotified()) : null);
            ps.setObject(10, alert.getExitCode(), Types.INTEGER);
            ps.setString(11, alert.getReason());
            ps.setString(12, alert.getSuggestedFix());
            ps.setTimestamp(13, Timestamp.from(alert.getOccurredAt()));
            ps.setTimestamp(14, toTimestamp(alert.getResolvedAt()));
            return ps;
        }, keyHolder);

        alert.setId(keyHolder.getKey().longValue());
        return alert;
    }

    @Override
    public int resolveAlert(AlertType type, String namespace, String name) {
        String sql = """
            UPDATE alert_history
            SET resolved_at = ?
            WHERE alert_type = ?
            AND namespace = ? AND name = ?
            AND resolved_at IS NULL
            """;

        int resolved = jdbcTemplate.update(sql, Timestamp.from(clock.instant()), type.getCode(), namespace, name);
        if (resolved > 0) {
            log.info("Resolved {} {} alert(s) for {}/{}", resolved, type.getCode(), namespace, name);
        }
        return resolved;
    }

    @Override
    public List<AlertHistory> listAlertHistory(AlertHistoryQuery query) {
        StringBuilder sql = new StringBuilder("SELECT ").append(ALERT_COLUMNS).append(" FROM alert_history WHERE 1 = 1");
        List<Object> params = new ArrayList<>();

        if (query.getNamespace() != null) {
            sql.append(" AND namespace = ?");
            params.add(query.getNamespace());
        }
        if (query.getName() != null) {
            sql.append(" AND name = ?");
            params.add(query.getName());
        }
        if (query.getType() != null) {
            sql.append(" AND alert_type = ?");
            params.add(query.getType().getCode());
        }
        if (query.getSince() != null) {
            sql.append(" AND occurred_at >= ?");
            params.add(Timestamp.from(query.getSince()));
        }
        if (query.isUnresolvedOnly()) {
            sql.append(" AND resolved_at IS NULL");
        }
        sql.append(" ORDER BY occurred_at DESC, id DESC LIMIT ?");
        params.add(query.getLimit() > 0 ? query.getLimit() : 100);

        return jdbcTemplate.query(sql.toString(), new AlertHistoryRowMapper(), params.toArray());
    }

    @Override
    public int prune(Instant olderThan) {
        String sql = """
            DELETE FROM executions
            WHERE start_time < ?
            AND completion_time IS NOT NULL
            """;
        return jdbcTemplate.update(sql, Timestamp.from(olderThan));
    }

    @Override
    public void saveChannelStats(ChannelStats stats) {
        String update = """
            UPDATE channel_stats
            SET channel_type = ?,
                alerts_sent_total = ?,
                alerts_failed_total = ?,
                last_alert_time = ?,
                last_failed_time = ?,
                last_failed_error = ?,
                consecutive_failures = ?,
                updated_at = ?
            WHERE channel_name = ?
            """;

        Timestamp now = Timestamp.from(clock.instant());
        int updated = jdbcTemplate.update(update,
                stats.getType(),
                stats.getAlertsSentTotal(),
                stats.getAlertsFailedTotal(),
                toTimestamp(stats.getLastAlertTime()),
                toTimestamp(stats.getLastFailedTime()),
                truncate(stats.getLastFailedError(), 1024),
                stats.getConsecutiveFailures(),
                now,
                stats.getName()
        );
        if (updated > 0) {
            return;
        }

        String insert = """
            INSERT INTO channel_stats (
                channel_name, channel_type, alerts_sent_total, alerts_failed_total, last_alert_time,
                last_failed_time, last_failed_error, consecutive_failures, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(insert,
                stats.getName(),
                stats.getType(),
                stats.getAlertsSentTotal(),
                stats.getAlertsFailedTotal(),
                toTimestamp(stats.getLastAlertTime()),
                toTimestamp(stats.getLastFailedTime()),
                truncate(stats.getLastFailedError(), 1024),
                stats.getConsecutiveFailures(),
                now
        );
    }

    @Override
    public List<ChannelStats> getAllChannelStats() {
        String sql = """
            SELECT channel_name, channel_type, alerts_sent_total, alerts_failed_total, last_alert_time,
                   last_failed_time, last_failed_error, consecutive_failures
            FROM channel_stats
            ORDER BY channel_name
            """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> ChannelStats.builder()
                .name(rs.getString("channel_name"))
                .type(rs.getString("channel_type"))
                .alertsSentTotal(rs.getLong("alerts_sent_total"))
                .alertsFailedTotal(rs.getLong("alerts_failed_total"))
                .lastAlertTime(toInstant(rs.getTimestamp("last_alert_time")))
                .lastFailedTime(toInstant(rs.getTimestamp("last_failed_time")))
                .lastFailedError(rs.getString("last_failed_error"))
                .consecutiveFailures(rs.getInt("consecutive_failures"))
                .build());
    }

    private List<ExecutionRecord> completedInWindow(WorkloadRef workload, int windowDays) {
        String sql = "SELECT " + EXECUTION_COLUMNS + """
            FROM executions
            WHERE namespace = ? AND name = ?
            AND start_time >= ?
            AND completion_time IS NOT NULL
            ORDER BY start_time DESC, id DESC
            """;

        return jdbcTemplate.query(sql, new ExecutionRowMapper(),
                workload.getNamespace(), workload.getName(), windowStart(windowDays));
    }

    private Timestamp windowStart(int windowDays) {
        return Timestamp.from(clock.instant().minus(Duration.ofDays(windowDays)));
    }

    private static List<Duration> durations(List<ExecutionRecord> executions) {
        return executions.stream()
                .map(ExecutionRecord::getDuration)
                .filter(d -> d != null && !d.isNegative())
                .collect(Collectors.toList());
    }

    private static String truncate(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static class ExecutionRowMapper implements RowMapper<ExecutionRecord> {
        @Override
        public ExecutionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ExecutionRecord.builder()
                    .id(rs.getLong("id"))
                    .workload(WorkloadRef.of(rs.getString("namespace"), rs.getString("name")))
                    .runName(rs.getString("run_name"))
                    .startTime(rs.getTimestamp("start_time").toInstant())
                    .completionTime(toInstant(rs.getTimestamp("completion_time")))
                    .succeeded(rs.getObject("succeeded", Boolean.class))
                    .exitCode(rs.getObject("exit_code", Integer.class))
                    .reason(rs.getString("reason"))
                    .build();
        }
    }

    private static class AlertHistoryRowMapper implements RowMapper<AlertHistory> {
        @Override
        public AlertHistory mapRow(ResultSet rs, int rowNum) throws SQLException {
            String channels = rs.getString("channels_notified");
            return AlertHistory.builder()
                    .id(rs.getLong("id"))
                    .alertKey(rs.getString("alert_key"))
                    .type(AlertType.fromCode(rs.getString("alert_type")))
                    .severity(Severity.fromStoredValue(rs.getString("severity")))
                    .title(rs.getString("title"))
                    .message(rs.getString("message"))
                    .namespace(rs.getString("namespace"))
                    .name(rs.getString("name"))
                    .monitorName(rs.getString("monitor_name"))
                    .channelsNotified(channels == null || channels.isBlank()
                            ? new ArrayList<>()
                            : new ArrayList<>(Arrays.asList(channels.split(","))))
                    .exitCode(rs.getObject("exit_code", Integer.class))
                    .reason(rs.getString("reason"))
                    .suggestedFix(rs.getString("suggested_fix"))
                    .occurredAt(rs.getTimestamp("occurred_at").toInstant())
                    .resolvedAt(toInstant(rs.getTimestamp("resolved_at")))
                    .build();
        }
    }
}
