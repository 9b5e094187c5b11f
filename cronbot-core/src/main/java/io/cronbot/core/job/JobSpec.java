package io.cronbot.core.job;

import java.time.Instant;
import java.util.Objects;

/**
 * Creation request for a job. Validation of the schedule against the clock happens in the scheduler.
 */
public record JobSpec(
    String name,
    String description,
    JobSchedule schedule,
    JobTarget target,
    JobParameters parameters,
    boolean enabled
) {

    public JobSpec {
        if (name == null || name.isBlank()) {
            throw new JobValidationException("job name is required");
        }
        name = name.trim();
        description = description == null ? "" : description;
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(target, "target must not be null");
        parameters = parameters == null ? JobParameters.empty() : parameters;
    }

    public static JobSpec recurring(String name, String cronExpression, JobTarget target) {
        return new JobSpec(name, "", JobSchedule.cron(cronExpression), target, JobParameters.empty(), true);
    }

    public static JobSpec oneTime(String name, Instant runAt, JobTarget target) {
        return new JobSpec(name, "", JobSchedule.at(runAt), target, JobParameters.empty(), true);
    }

    public JobSpec withDescription(String value) {
        return new JobSpec(name, value, schedule, target, parameters, enabled);
    }

    public JobSpec withParameters(JobParameters value) {
        return new JobSpec(name, description, schedule, target, value, enabled);
    }

    public JobSpec withEnabled(boolean value) {
        return new JobSpec(name, description, schedule, target, parameters, value);
    }

    public JobKind kind() {
        return schedule.kind();
    }
}
