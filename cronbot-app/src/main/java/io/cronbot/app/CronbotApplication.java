package io.cronbot.app;

import io.cronbot.cli.CliContext;
import io.cronbot.cli.CronbotCliCommand;
import io.cronbot.cli.JobsCommand;
import io.cronbot.cli.LogsCommand;
import io.cronbot.cli.OnboardCommand;
import io.cronbot.cli.RunCommand;
import io.cronbot.cli.StatusCommand;
import io.cronbot.core.config.ConfigPaths;
import io.cronbot.core.config.ConfigService;
import io.cronbot.core.config.model.CronbotConfig;
import io.cronbot.core.config.model.SchedulerConfig;
import io.cronbot.core.dispatch.Dispatcher;
import io.cronbot.core.dispatch.JobCollaborator;
import io.cronbot.core.dispatch.TargetRegistry;
import io.cronbot.core.job.JobSpec;
import io.cronbot.core.job.JobTarget;
import io.cronbot.core.schedule.TimeResolver;
import io.cronbot.core.scheduler.ExecutorTimerService;
import io.cronbot.core.scheduler.JobScheduler;
import io.cronbot.core.scheduler.RecoveryManager;
import io.cronbot.core.scheduler.RecoveryReport;
import io.cronbot.core.store.JdbcExecutionLog;
import io.cronbot.core.store.JdbcJobStore;
import io.cronbot.core.store.SqliteDatabase;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class CronbotApplication {
    private static final Logger LOG = LoggerFactory.getLogger(CronbotApplication.class);
    private static final String HEARTBEAT_JOB = "scheduler-heartbeat";

    private CronbotApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();

        CliContext context = new CliContext(
            configService,
            configPath,
            Clock.systemUTC(),
            () -> runScheduler(configService, configPath)
        );

        CommandLine commandLine = new CommandLine(new CronbotCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("jobs", new JobsCommand(context));
        commandLine.addSubcommand("logs", new LogsCommand(context));
        commandLine.addSubcommand("run", new RunCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    static int discoverCollaborators(TargetRegistry registry, ClassLoader classLoader) {
        int registered = 0;
        for (ServiceLoader.Provider<JobCollaborator> provider : ServiceLoader.load(JobCollaborator.class, classLoader)
            .stream()
            .toList()) {
            try {
                JobCollaborator collaborator = provider.get();
                registry.register(collaborator);
                registered++;
                LOG.info("Registered collaborator '{}' with capabilities {}",
                    collaborator.name(), collaborator.capabilities().keySet());
            } catch (ServiceConfigurationError | IllegalArgumentException e) {
                LOG.warn("Skipping collaborator {}: {}", provider.type().getName(), e.getMessage());
            }
        }
        return registered;
    }

    private static int runScheduler(ConfigService configService, Path configPath) throws Exception {
        CronbotConfig config = configService.load(configPath);
        SchedulerConfig schedulerConfig = config.scheduler();
        Path databasePath = ConfigPaths.resolveDatabase(config.store().path());
        Clock clock = Clock.systemUTC();

        SqliteDatabase database = new SqliteDatabase(databasePath);
        JdbcJobStore store = new JdbcJobStore(database, clock);
        JdbcExecutionLog executionLog = new JdbcExecutionLog(database);
        TargetRegistry registry = new TargetRegistry();
        int discovered = discoverCollaborators(registry, CronbotApplication.class.getClassLoader());

        CountDownLatch shutdown = new CountDownLatch(1);
        ExecutorService workers = Executors.newFixedThreadPool(schedulerConfig.workerThreads(), workerThreads());
        try (ExecutorTimerService timer = new ExecutorTimerService();
             JobScheduler scheduler = new JobScheduler(
                 store,
                 executionLog,
                 new Dispatcher(registry),
                 new TimeResolver(schedulerConfig.zoneId()),
                 timer,
                 workers,
                 clock,
                 schedulerConfig.toOptions()
             )) {
            registry.register(new SchedulerCollaborator(scheduler));

            RecoveryReport report = new RecoveryManager(store, scheduler, clock).recover();
            report.failures().forEach((name, reason) -> System.err.println("Could not recover job '" + name + "': " + reason));
            scheduler.ensureJob(JobSpec.recurring(
                HEARTBEAT_JOB,
                "0 * * * *",
                JobTarget.of(SchedulerCollaborator.NAME, SchedulerCollaborator.HEARTBEAT)
            ).withDescription("Hourly scheduler health check"));

            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            System.out.println("Scheduler started (database " + databasePath + ", timezone " + schedulerConfig.zoneId() + ")");
            System.out.println("Collaborators: " + (discovered + 1) + ", recovered jobs: " + report.rearmed()
                + ", expired one-time jobs: " + report.expired().size());
            shutdown.await();
        } finally {
            workers.shutdown();
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        }
        return 0;
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "cronbot-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
