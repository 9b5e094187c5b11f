package io.cronbot.cli;

import io.cronbot.core.store.ExecutionLogEntry;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "logs", description = "Show execution history, newest first")
public final class LogsCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--job", description = "Only show entries of this job id")
    Long jobId;

    @Option(names = "--limit", description = "Maximum number of entries", defaultValue = "50")
    int limit;

    public LogsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            JobRepository repository = context.openRepository(context.loadConfig());
            List<ExecutionLogEntry> entries = repository.executionLog().query(jobId, limit);
            if (entries.isEmpty()) {
                System.out.println("No executions recorded.");
                return 0;
            }
            for (ExecutionLogEntry entry : entries) {
                StringBuilder line = new StringBuilder()
                    .append(entry.executedAt())
                    .append(" job=").append(entry.jobId())
                    .append(' ').append(entry.status())
                    .append(' ').append(entry.durationMs()).append("ms");
                if (entry.errorMessage() != null) {
                    line.append(" error=\"").append(entry.errorMessage()).append('"');
                } else if (entry.output() != null) {
                    line.append(" output=").append(entry.output());
                }
                System.out.println(line);
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Logs command failed: " + e.getMessage());
            return 1;
        }
    }
}
