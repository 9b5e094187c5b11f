package io.cronbot.core.scheduler;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a startup recovery pass, by job name.
 */
public record RecoveryReport(
    List<String> recurring,
    List<String> oneTime,
    List<String> expired,
    Map<String, String> failures
) {

    public int rearmed() {
        return recurring.size() + oneTime.size();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
