package io.cronbot.core.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class JobSpecTest {

    @Test
    void shouldRequireName() {
        assertThatThrownBy(() -> JobSpec.recurring("  ", "* * * * *", JobTarget.of("tasks", "remind")))
            .isInstanceOf(JobValidationException.class);
    }

    @Test
    void shouldDefaultOptionalFields() {
        JobSpec spec = new JobSpec(" digest ", null, JobSchedule.cron("0 8 * * *"), JobTarget.of("digest", "send"), null, true);

        assertThat(spec.name()).isEqualTo("digest");
        assertThat(spec.description()).isEmpty();
        assertThat(spec.parameters().isEmpty()).isTrue();
        assertThat(spec.kind()).isEqualTo(JobKind.RECURRING);
    }

    @Test
    void shouldParseStoredSchedules() {
        Instant at = Instant.parse("2026-03-01T12:00:00Z");

        assertThat(JobSchedule.parse(JobKind.ONE_TIME, at.toString())).isEqualTo(JobSchedule.at(at));
        assertThat(JobSchedule.parse(JobKind.RECURRING, "*/5 * * * *").expression()).isEqualTo("*/5 * * * *");
        assertThatThrownBy(() -> JobSchedule.parse(JobKind.ONE_TIME, "tomorrow"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void jobShouldExposeScheduleByKind() {
        JobSpec spec = JobSpec.oneTime("once", Instant.parse("2026-03-01T12:00:00Z"), JobTarget.of("tasks", "remind"));
        Job job = new Job(1, spec.name(), "", spec.schedule(), spec.target(), spec.parameters(), true,
            null, null, 0, 0, null, Instant.EPOCH, Instant.EPOCH);

        assertThat(job.recurring()).isFalse();
        assertThat(job.runAt()).isEqualTo(Instant.parse("2026-03-01T12:00:00Z"));
        assertThatThrownBy(job::cronExpression).isInstanceOf(IllegalStateException.class);
        assertThat(JobTarget.of(" tasks ", "remind").toString()).isEqualTo("tasks.remind");
    }
}
