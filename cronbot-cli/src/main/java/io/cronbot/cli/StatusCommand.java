package io.cronbot.cli;

import io.cronbot.core.config.ConfigPaths;
import io.cronbot.core.config.model.CronbotConfig;
import io.cronbot.core.scheduler.SchedulerStats;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and job statistics")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            CronbotConfig config = context.loadConfig();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Database: " + ConfigPaths.resolveDatabase(config.store().path()));
            System.out.println("Timezone: " + config.scheduler().zoneId());
            System.out.println("Worker threads: " + config.scheduler().workerThreads());
            System.out.println("Execution timeout: " + config.scheduler().executionTimeoutSeconds() + "s");
            System.out.println("Overlap policy: " + config.scheduler().overlapPolicy());

            JobRepository repository = context.openRepository(config);
            // timers live only inside a running scheduler process
            SchedulerStats stats = SchedulerStats.collect(
                repository.jobs(),
                repository.executionLog(),
                config.scheduler().zoneId(),
                context.clock().instant(),
                0
            );
            System.out.println("Total jobs: " + stats.totalJobs());
            System.out.println("Enabled jobs: " + stats.enabledJobs());
            System.out.println("Executions today: " + stats.executionsToday());
            System.out.println("Success rate today: " + stats.successRateToday() + "%");
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
