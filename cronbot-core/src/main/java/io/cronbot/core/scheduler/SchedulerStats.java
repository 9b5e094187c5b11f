package io.cronbot.core.scheduler;

import io.cronbot.core.store.ExecutionLog;
import io.cronbot.core.store.ExecutionStatus;
import io.cronbot.core.store.JobStore;
import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

public record SchedulerStats(
    int totalJobs,
    int enabledJobs,
    int armedTimers,
    long executionsToday,
    int successRateToday
) {

    /**
     * Reads job counts and today's executions, where today starts at local midnight in {@code zone}.
     * The success rate is a whole percentage, 0 when nothing ran.
     */
    public static SchedulerStats collect(
        JobStore store,
        ExecutionLog executionLog,
        ZoneId zone,
        Instant now,
        int armedTimers
    ) throws IOException {
        Instant startOfDay = LocalDate.ofInstant(now, zone).atStartOfDay(zone).toInstant();
        long today = executionLog.countSince(startOfDay, null);
        long succeeded = executionLog.countSince(startOfDay, ExecutionStatus.SUCCESS);
        int successRate = today == 0 ? 0 : (int) Math.round(succeeded * 100.0 / today);
        return new SchedulerStats(store.count(), store.countEnabled(), armedTimers, today, successRate);
    }
}
