package io.cronbot.core.store;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of one invocation attempt, before it is written to the execution log.
 */
public record ExecutionOutcome(
    Instant executedAt,
    ExecutionStatus status,
    long durationMs,
    String output,
    String errorMessage
) {

    public ExecutionOutcome {
        Objects.requireNonNull(executedAt, "executedAt must not be null");
        Objects.requireNonNull(status, "status must not be null");
        durationMs = Math.max(0, durationMs);
    }

    public static ExecutionOutcome success(Instant executedAt, long durationMs, String output) {
        return new ExecutionOutcome(executedAt, ExecutionStatus.SUCCESS, durationMs, output, null);
    }

    public static ExecutionOutcome error(Instant executedAt, long durationMs, String errorMessage) {
        return new ExecutionOutcome(executedAt, ExecutionStatus.ERROR, durationMs, null, errorMessage);
    }

    public static ExecutionOutcome timeout(Instant executedAt, long durationMs, String errorMessage) {
        return new ExecutionOutcome(executedAt, ExecutionStatus.TIMEOUT, durationMs, null, errorMessage);
    }

    public boolean successful() {
        return status == ExecutionStatus.SUCCESS;
    }
}
