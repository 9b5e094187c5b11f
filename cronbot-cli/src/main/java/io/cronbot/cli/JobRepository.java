package io.cronbot.cli;

import io.cronbot.core.store.ExecutionLog;
import io.cronbot.core.store.JobStore;

/**
 * Read access to the persisted jobs for commands that do not start the scheduler.
 */
public record JobRepository(JobStore jobs, ExecutionLog executionLog) {
}
