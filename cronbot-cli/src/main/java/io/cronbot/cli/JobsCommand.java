package io.cronbot.cli;

import io.cronbot.core.job.Job;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "jobs", description = "List persisted jobs")
public final class JobsCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--enabled", description = "Only list enabled jobs")
    boolean enabledOnly;

    public JobsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            JobRepository repository = context.openRepository(context.loadConfig());
            List<Job> jobs = enabledOnly ? repository.jobs().listEnabled() : repository.jobs().listAll();
            if (jobs.isEmpty()) {
                System.out.println("No jobs.");
                return 0;
            }
            for (Job job : jobs) {
                System.out.println(format(job));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Jobs command failed: " + e.getMessage());
            return 1;
        }
    }

    static String format(Job job) {
        StringBuilder line = new StringBuilder()
            .append('#').append(job.id())
            .append(' ').append(job.name())
            .append(" [").append(job.kind()).append(' ').append(job.schedule().expression()).append(']')
            .append(" -> ").append(job.target())
            .append(job.enabled() ? " enabled" : " disabled")
            .append(" runs=").append(job.runCount())
            .append(" errors=").append(job.errorCount());
        if (job.nextRun() != null) {
            line.append(" next=").append(job.nextRun());
        }
        if (job.lastError() != null) {
            line.append(" lastError=\"").append(job.lastError()).append('"');
        }
        return line.toString();
    }
}
