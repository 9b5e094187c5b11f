package io.cronbot.core.schedule;

import io.cronbot.core.job.JobValidationException;
import java.time.Instant;

public final class ScheduleOutOfRangeException extends JobValidationException {
    private final Instant scheduledAt;

    public ScheduleOutOfRangeException(Instant scheduledAt, Instant latest) {
        super("Scheduled time " + scheduledAt + " is beyond the supported range (latest: " + latest + ")");
        this.scheduledAt = scheduledAt;
    }

    public Instant scheduledAt() {
        return scheduledAt;
    }
}
