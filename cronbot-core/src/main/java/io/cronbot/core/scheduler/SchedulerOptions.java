package io.cronbot.core.scheduler;

import java.time.Duration;
import java.util.Objects;

public record SchedulerOptions(Duration executionTimeout, OverlapPolicy overlapPolicy) {

    public SchedulerOptions {
        Objects.requireNonNull(executionTimeout, "executionTimeout must not be null");
        if (executionTimeout.isZero() || executionTimeout.isNegative()) {
            throw new IllegalArgumentException("executionTimeout must be > 0");
        }
        overlapPolicy = overlapPolicy == null ? OverlapPolicy.ALLOW : overlapPolicy;
    }

    public static SchedulerOptions defaults() {
        return new SchedulerOptions(Duration.ofMinutes(5), OverlapPolicy.ALLOW);
    }
}
