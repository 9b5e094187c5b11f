package io.cronbot.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.cronbot.core.scheduler.OverlapPolicy;
import io.cronbot.core.scheduler.SchedulerOptions;
import java.time.Duration;
import java.time.ZoneId;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(
    String timezone,
    int workerThreads,
    int executionTimeoutSeconds,
    OverlapPolicy overlapPolicy
) {

    public static SchedulerConfig defaults() {
        return new SchedulerConfig("UTC", 4, 300, OverlapPolicy.ALLOW);
    }

    public ZoneId zoneId() {
        return timezone == null || timezone.isBlank() ? ZoneId.of("UTC") : ZoneId.of(timezone.trim());
    }

    public SchedulerOptions toOptions() {
        return new SchedulerOptions(Duration.ofSeconds(Math.max(1, executionTimeoutSeconds)), overlapPolicy);
    }
}
