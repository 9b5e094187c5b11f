package io.cronbot.core.store;

import io.cronbot.core.job.Job;
import io.cronbot.core.job.JobKind;
import io.cronbot.core.job.JobParameters;
import io.cronbot.core.job.JobSchedule;
import io.cronbot.core.job.JobSpec;
import io.cronbot.core.job.JobTarget;
import java.io.IOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class JdbcJobStore implements JobStore {
    private static final Logger LOG = LoggerFactory.getLogger(JdbcJobStore.class);
    private static final String COLUMNS = """
        id, name, description, kind, schedule, target_collaborator, target_capability,
        parameters_json, parameters_version, enabled, last_run, next_run,
        run_count, error_count, last_error, created_at, updated_at
        """;

    private final SqlExecutor executor;
    private final Clock clock;

    public JdbcJobStore(SqlExecutor executor, Clock clock) throws IOException {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        JobSchema.apply(executor);
    }

    @Override
    public Job create(JobSpec spec, Instant nextRun) throws IOException {
        Objects.requireNonNull(spec, "spec must not be null");
        Instant now = clock.instant();
        try {
            return executor.inTransaction(tx -> {
                List<Long> existing = tx.query("SELECT id FROM jobs WHERE name = ?", List.of(spec.name()), row -> row.getLong(1));
                if (!existing.isEmpty()) {
                    throw new DuplicateJobNameException(spec.name());
                }
                long id = tx.insert("""
                    INSERT INTO jobs (
                        name, description, kind, schedule, target_collaborator, target_capability,
                        parameters_json, parameters_version, enabled, next_run, created_at, updated_at
                    ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """, Arrays.asList(
                    spec.name(),
                    spec.description(),
                    spec.kind(),
                    spec.schedule().expression(),
                    spec.target().collaborator(),
                    spec.target().capability(),
                    spec.parameters().toJson(),
                    spec.parameters().schemaVersion(),
                    spec.enabled(),
                    nextRun,
                    now,
                    now
                ));
                return new Job(
                    id,
                    spec.name(),
                    spec.description(),
                    spec.schedule(),
                    spec.target(),
                    spec.parameters(),
                    spec.enabled(),
                    null,
                    nextRun,
                    0,
                    0,
                    null,
                    now,
                    now
                );
            });
        } catch (IOException e) {
            if (isUniqueViolation(e)) {
                throw new DuplicateJobNameException(spec.name());
            }
            throw e;
        }
    }

    @Override
    public Optional<Job> get(long id) throws IOException {
        return first(select("WHERE id = ?", List.of(id)));
    }

    @Override
    public Optional<Job> findByName(String name) throws IOException {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return first(select("WHERE name = ?", List.of(name.trim())));
    }

    @Override
    public List<Job> listAll() throws IOException {
        return select("ORDER BY name", List.of());
    }

    @Override
    public List<Job> listEnabled() throws IOException {
        return select("WHERE enabled = 1 ORDER BY name", List.of());
    }

    @Override
    public boolean setEnabled(long id, boolean enabled) throws IOException {
        return executor.update(
            "UPDATE jobs SET enabled = ?, updated_at = ? WHERE id = ?",
            List.of(enabled, clock.instant(), id)
        ) > 0;
    }

    @Override
    public boolean delete(long id) throws IOException {
        return executor.update("DELETE FROM jobs WHERE id = ?", List.of(id)) > 0;
    }

    @Override
    public boolean updateNextRun(long id, Instant nextRun) throws IOException {
        return executor.update(
            "UPDATE jobs SET next_run = ?, updated_at = ? WHERE id = ?",
            Arrays.asList(nextRun, clock.instant(), id)
        ) > 0;
    }

    @Override
    public ExecutionLogEntry recordOutcome(long id, Instant nextRun, ExecutionOutcome outcome) throws IOException {
        Objects.requireNonNull(outcome, "outcome must not be null");
        Instant now = clock.instant();
        boolean failed = !outcome.successful();
        return executor.inTransaction(tx -> {
            int updated = tx.update("""
                UPDATE jobs
                SET last_run = ?,
                    next_run = CASE WHEN ? IS NULL THEN NULL ELSE MAX(COALESCE(next_run, ?), ?) END,
                    run_count = run_count + 1,
                    error_count = error_count + ?,
                    last_error = ?,
                    enabled = CASE WHEN kind = 'ONE_TIME' THEN 0 ELSE enabled END,
                    updated_at = ?
                WHERE id = ?
                """, Arrays.asList(
                now,
                nextRun,
                nextRun,
                nextRun,
                failed ? 1 : 0,
                failed ? outcome.errorMessage() : null,
                now,
                id
            ));
            if (updated == 0) {
                throw new IOException("Job " + id + " no longer exists; outcome not recorded");
            }
            return JdbcExecutionLog.insert(tx, id, outcome);
        });
    }

    @Override
    public int count() throws IOException {
        return countWhere("");
    }

    @Override
    public int countEnabled() throws IOException {
        return countWhere(" WHERE enabled = 1");
    }

    private int countWhere(String where) throws IOException {
        List<Integer> counts = executor.query("SELECT COUNT(*) FROM jobs" + where, List.of(), row -> row.getInt(1));
        return counts.isEmpty() ? 0 : counts.get(0);
    }

    private List<Job> select(String clause, List<?> params) throws IOException {
        return executor.query("SELECT " + COLUMNS + " FROM jobs " + clause, params, this::mapOrSkip)
            .stream()
            .filter(Objects::nonNull)
            .toList();
    }

    private Optional<Job> first(List<Job> jobs) {
        return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
    }

    private Job mapOrSkip(ResultSet row) throws SQLException {
        long id = row.getLong("id");
        try {
            return map(row);
        } catch (IllegalArgumentException e) {
            LOG.warn("Skipping unreadable job row {}: {}", id, e.getMessage());
            return null;
        }
    }

    private Job map(ResultSet row) throws SQLException {
        JobKind kind = JobKind.valueOf(row.getString("kind"));
        return new Job(
            row.getLong("id"),
            row.getString("name"),
            row.getString("description"),
            JobSchedule.parse(kind, row.getString("schedule")),
            new JobTarget(row.getString("target_collaborator"), row.getString("target_capability")),
            JobParameters.fromJson(row.getInt("parameters_version"), row.getString("parameters_json")),
            row.getInt("enabled") != 0,
            instant(row, "last_run"),
            instant(row, "next_run"),
            row.getLong("run_count"),
            row.getLong("error_count"),
            row.getString("last_error"),
            instant(row, "created_at"),
            instant(row, "updated_at")
        );
    }

    private static Instant instant(ResultSet row, String column) throws SQLException {
        long value = row.getLong(column);
        return row.wasNull() ? null : Instant.ofEpochMilli(value);
    }

    private static boolean isUniqueViolation(IOException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException sql && sql.getMessage() != null && sql.getMessage().contains("UNIQUE constraint failed")) {
                return true;
            }
        }
        return false;
    }
}
