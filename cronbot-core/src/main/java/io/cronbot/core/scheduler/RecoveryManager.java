package io.cronbot.core.scheduler;

import io.cronbot.core.job.Job;
import io.cronbot.core.store.JobStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds live timers from the store at startup.
 *
 * <p>Recurring jobs resume from the current time; occurrences missed while the process was down are not
 * replayed. One-time jobs whose instant has already passed are disabled without running.
 */
public final class RecoveryManager {
    private static final Logger LOG = LoggerFactory.getLogger(RecoveryManager.class);

    private final JobStore store;
    private final JobScheduler scheduler;
    private final Clock clock;

    public RecoveryManager(JobStore store, JobScheduler scheduler, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * @throws IOException only when the enabled jobs cannot be listed; per-job failures land in the report
     */
    public RecoveryReport recover() throws IOException {
        List<Job> jobs = store.listEnabled();
        List<String> recurring = new ArrayList<>();
        List<String> oneTime = new ArrayList<>();
        List<String> expired = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();

        for (Job job : jobs) {
            try {
                if (job.recurring()) {
                    scheduler.scheduleRecurring(job);
                    recurring.add(job.name());
                    continue;
                }
                Instant runAt = job.runAt();
                if (!runAt.isAfter(clock.instant())) {
                    store.disable(job.id());
                    expired.add(job.name());
                    LOG.warn("One-time job '{}' was due at {} and has been disabled without running", job.name(), runAt);
                } else {
                    scheduler.scheduleOneTime(job);
                    oneTime.add(job.name());
                }
            } catch (IOException | RuntimeException e) {
                String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                failures.put(job.name(), message);
                LOG.warn("Failed to recover job '{}': {}", job.name(), message, e);
            }
        }

        scheduler.markRecovered();
        LOG.info("Recovery finished: {} recurring, {} one-time, {} expired, {} failed",
            recurring.size(), oneTime.size(), expired.size(), failures.size());
        return new RecoveryReport(List.copyOf(recurring), List.copyOf(oneTime), List.copyOf(expired), Collections.unmodifiableMap(failures));
    }
}
