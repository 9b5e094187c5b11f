package io.cronbot.core.schedule;

import io.cronbot.core.job.JobValidationException;
import java.time.Instant;

public final class PastScheduleTimeException extends JobValidationException {
    private final Instant scheduledAt;
    private final Instant now;

    public PastScheduleTimeException(Instant scheduledAt, Instant now) {
        super("Scheduled time must be in the future. Now: " + now + ", scheduled: " + scheduledAt);
        this.scheduledAt = scheduledAt;
        this.now = now;
    }

    public Instant scheduledAt() {
        return scheduledAt;
    }

    public Instant now() {
        return now;
    }
}
