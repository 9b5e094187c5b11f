package io.cronbot.core.store;

import java.io.IOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public final class JdbcExecutionLog implements ExecutionLog {
    private static final int MAX_LIMIT = 1_000;
    private static final String INSERT = """
        INSERT INTO execution_logs (job_id, executed_at, status, duration_ms, output_json, error_message)
        VALUES (?, ?, ?, ?, ?, ?)
        """;

    private final SqlExecutor executor;

    public JdbcExecutionLog(SqlExecutor executor) throws IOException {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        JobSchema.apply(executor);
    }

    @Override
    public ExecutionLogEntry append(long jobId, ExecutionOutcome outcome) throws IOException {
        return insert(executor, jobId, outcome);
    }

    @Override
    public List<ExecutionLogEntry> query(Long jobId, int limit) throws IOException {
        if (limit <= 0) {
            return List.of();
        }
        int safe = Math.min(MAX_LIMIT, limit);
        StringBuilder sql = new StringBuilder("""
            SELECT id, job_id, executed_at, status, duration_ms, output_json, error_message
            FROM execution_logs
            """);
        List<Object> params = new ArrayList<>();
        if (jobId != null) {
            sql.append(" WHERE job_id = ?");
            params.add(jobId);
        }
        sql.append(" ORDER BY executed_at DESC, id DESC LIMIT ?");
        params.add(safe);
        return executor.query(sql.toString(), params, JdbcExecutionLog::map);
    }

    @Override
    public long countSince(Instant since, ExecutionStatus status) throws IOException {
        Objects.requireNonNull(since, "since must not be null");
        String sql = "SELECT COUNT(*) FROM execution_logs WHERE executed_at >= ?";
        List<Object> params = new ArrayList<>();
        params.add(since);
        if (status != null) {
            sql += " AND status = ?";
            params.add(status);
        }
        List<Long> counts = executor.query(sql, params, row -> row.getLong(1));
        return counts.isEmpty() ? 0 : counts.get(0);
    }

    static ExecutionLogEntry insert(SqlExecutor executor, long jobId, ExecutionOutcome outcome) throws IOException {
        Objects.requireNonNull(outcome, "outcome must not be null");
        long id = executor.insert(INSERT, Arrays.asList(
            jobId,
            outcome.executedAt(),
            outcome.status(),
            outcome.durationMs(),
            outcome.output(),
            outcome.errorMessage()
        ));
        return new ExecutionLogEntry(
            id,
            jobId,
            outcome.executedAt(),
            outcome.status(),
            outcome.durationMs(),
            outcome.output(),
            outcome.errorMessage()
        );
    }

    private static ExecutionLogEntry map(ResultSet row) throws SQLException {
        return new ExecutionLogEntry(
            row.getLong("id"),
            row.getLong("job_id"),
            Instant.ofEpochMilli(row.getLong("executed_at")),
            ExecutionStatus.valueOf(row.getString("status")),
            row.getLong("duration_ms"),
            row.getString("output_json"),
            row.getString("error_message")
        );
    }
}
