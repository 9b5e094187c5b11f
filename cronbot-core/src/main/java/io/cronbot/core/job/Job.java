package io.cronbot.core.job;

import java.time.Instant;

public record Job(
    long id,
    String name,
    String description,
    JobSchedule schedule,
    JobTarget target,
    JobParameters parameters,
    boolean enabled,
    Instant lastRun,
    Instant nextRun,
    long runCount,
    long errorCount,
    String lastError,
    Instant createdAt,
    Instant updatedAt
) {

    public JobKind kind() {
        return schedule.kind();
    }

    public boolean recurring() {
        return kind() == JobKind.RECURRING;
    }

    /**
     * Target instant of a one-time job.
     */
    public Instant runAt() {
        if (schedule instanceof JobSchedule.At at) {
            return at.instant();
        }
        throw new IllegalStateException("Job '" + name + "' is recurring and has no fixed run instant");
    }

    public String cronExpression() {
        if (schedule instanceof JobSchedule.Cron cron) {
            return cron.expression();
        }
        throw new IllegalStateException("Job '" + name + "' is one-time and has no cron expression");
    }
}
