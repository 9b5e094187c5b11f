package io.cronbot.app;

import io.cronbot.core.dispatch.Capability;
import io.cronbot.core.dispatch.JobCollaborator;
import io.cronbot.core.scheduler.JobScheduler;
import io.cronbot.core.scheduler.SchedulerHealth;
import io.cronbot.core.scheduler.SchedulerStats;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Built-in collaborator exposing the scheduler's own health to scheduled jobs.
 */
final class SchedulerCollaborator implements JobCollaborator {
    static final String NAME = "scheduler";
    static final String HEARTBEAT = "heartbeat";

    private static final Logger LOG = LoggerFactory.getLogger(SchedulerCollaborator.class);

    private final JobScheduler scheduler;

    SchedulerCollaborator(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Capability> capabilities() {
        return Map.of(HEARTBEAT, Capability.noArgs(this::heartbeat));
    }

    private Map<String, Object> heartbeat() throws Exception {
        SchedulerStats stats = scheduler.stats();
        SchedulerHealth health = scheduler.health();
        if (health.healthy()) {
            LOG.info("Heartbeat: {} armed, {} executions today ({}% ok)",
                stats.armedTimers(), stats.executionsToday(), stats.successRateToday());
        } else {
            LOG.warn("Heartbeat: scheduler unhealthy: {}", health.issues());
        }
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("healthy", health.healthy());
        report.put("issues", health.issues());
        report.put("stats", stats);
        return report;
    }
}
