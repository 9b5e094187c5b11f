package io.cronbot.core.store;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/**
 * Append-only record of invocation attempts. Entries are never updated.
 */
public interface ExecutionLog {

    ExecutionLogEntry append(long jobId, ExecutionOutcome outcome) throws IOException;

    /**
     * Newest first. A {@code null} job id queries across all jobs; a limit of zero or less returns nothing.
     */
    List<ExecutionLogEntry> query(Long jobId, int limit) throws IOException;

    /**
     * Entries executed at or after {@code since}; a {@code null} status counts every status.
     */
    long countSince(Instant since, ExecutionStatus status) throws IOException;
}
