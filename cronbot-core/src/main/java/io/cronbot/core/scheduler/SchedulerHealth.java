package io.cronbot.core.scheduler;

import java.time.Instant;
import java.util.List;

public record SchedulerHealth(boolean healthy, List<String> issues, int armedTimers, Instant timestamp) {
}
