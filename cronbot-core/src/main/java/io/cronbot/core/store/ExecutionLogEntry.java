package io.cronbot.core.store;

import java.time.Instant;

public record ExecutionLogEntry(
    long id,
    long jobId,
    Instant executedAt,
    ExecutionStatus status,
    long durationMs,
    String output,
    String errorMessage
) {
}
