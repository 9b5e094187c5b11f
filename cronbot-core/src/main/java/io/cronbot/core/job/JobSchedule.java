package io.cronbot.core.job;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * When a job fires: a cron-like expression for recurring jobs or an absolute instant for one-time jobs.
 */
public sealed interface JobSchedule permits JobSchedule.Cron, JobSchedule.At {

    JobKind kind();

    /**
     * Stored form of the schedule, as written to the {@code schedule} column.
     */
    String expression();

    static JobSchedule cron(String expression) {
        return new Cron(expression);
    }

    static JobSchedule at(Instant instant) {
        return new At(instant);
    }

    static JobSchedule parse(JobKind kind, String stored) {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == JobKind.RECURRING) {
            return new Cron(stored);
        }
        try {
            return new At(Instant.parse(stored.trim()));
        } catch (DateTimeParseException | NullPointerException e) {
            throw new IllegalArgumentException("Stored one-time schedule is not an instant: " + stored, e);
        }
    }

    record Cron(String expression) implements JobSchedule {
        public Cron {
            if (expression == null || expression.isBlank()) {
                throw new IllegalArgumentException("cron expression must not be blank");
            }
            expression = expression.trim();
        }

        @Override
        public JobKind kind() {
            return JobKind.RECURRING;
        }
    }

    record At(Instant instant) implements JobSchedule {
        public At {
            Objects.requireNonNull(instant, "instant must not be null");
        }

        @Override
        public JobKind kind() {
            return JobKind.ONE_TIME;
        }

        @Override
        public String expression() {
            return instant.toString();
        }
    }
}
