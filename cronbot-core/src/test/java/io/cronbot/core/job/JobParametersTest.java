package io.cronbot.core.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;

class JobParametersTest {

    record Reminder(String taskId, int minutesBefore) {
    }

    @Test
    void shouldBindStructuredPayloadToType() {
        JobParameters parameters = JobParameters.of(Map.of("taskId", "T-42", "minutesBefore", 15));

        Reminder reminder = parameters.as(Reminder.class);

        assertThat(reminder).isEqualTo(new Reminder("T-42", 15));
        assertThat(parameters.isPositional()).isFalse();
        assertThat(parameters.arguments()).hasSize(1);
    }

    @Test
    void shouldExposePositionalArguments() {
        JobParameters parameters = JobParameters.positional("T-42", 15, true);

        assertThat(parameters.isPositional()).isTrue();
        assertThat(parameters.arguments()).hasSize(3);
        assertThat(parameters.argument(0, String.class)).isEqualTo("T-42");
        assertThat(parameters.argument(1, Integer.class)).isEqualTo(15);
        assertThatThrownBy(() -> parameters.argument(3, String.class))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("index 3");
    }

    @Test
    void emptyParametersHaveNoStoredForm() {
        JobParameters empty = JobParameters.empty();

        assertThat(empty.isEmpty()).isTrue();
        assertThat(empty.toJson()).isNull();
        assertThat(empty.arguments()).isEmpty();
        assertThat(JobParameters.fromJson(1, null).isEmpty()).isTrue();
    }

    @Test
    void shouldKeepSchemaVersionOfStoredPayload() {
        JobParameters stored = JobParameters.fromJson(3, "{\"taskId\":\"T-1\",\"minutesBefore\":5}");

        assertThat(stored.schemaVersion()).isEqualTo(3);
        assertThat(stored.as(Reminder.class).taskId()).isEqualTo("T-1");
    }

    @Test
    void shouldRejectMalformedPayloads() {
        assertThatThrownBy(() -> JobParameters.fromJson(1, "{not json"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> JobParameters.of("just text").as(Reminder.class))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Reminder");
        assertThatThrownBy(() -> new JobParameters(0, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
