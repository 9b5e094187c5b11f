package io.cronbot.core.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import io.cronbot.core.dispatch.Capability;
import io.cronbot.core.dispatch.Dispatcher;
import io.cronbot.core.dispatch.JobCollaborator;
import io.cronbot.core.dispatch.TargetRegistry;
import io.cronbot.core.job.Job;
import io.cronbot.core.job.JobSpec;
import io.cronbot.core.job.JobTarget;
import io.cronbot.core.schedule.TimeResolver;
import io.cronbot.core.store.ExecutionLogEntry;
import io.cronbot.core.store.ExecutionStatus;
import io.cronbot.core.store.JdbcExecutionLog;
import io.cronbot.core.store.JdbcJobStore;
import io.cronbot.core.store.SqliteDatabase;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobSchedulerEndToEndTest {

    @TempDir
    Path tempDir;

    private ExecutorTimerService timer;
    private ExecutorService workers;
    private JdbcJobStore store;
    private JdbcExecutionLog log;
    private JobScheduler scheduler;
    private AtomicInteger ticks;

    @BeforeEach
    void setUp() throws Exception {
        Clock clock = Clock.systemUTC();
        SqliteDatabase database = new SqliteDatabase(tempDir.resolve("cronbot.db"));
        store = new JdbcJobStore(database, clock);
        log = new JdbcExecutionLog(database);
        ticks = new AtomicInteger();
        TargetRegistry registry = new TargetRegistry();
        registry.register(JobCollaborator.of("clock", Map.of(
            "tick", Capability.noArgs(ticks::incrementAndGet),
            "boom", parameters -> {
                throw new IllegalStateException("boom");
            }
        )));
        timer = new ExecutorTimerService();
        workers = Executors.newFixedThreadPool(2);
        scheduler = new JobScheduler(store, log, new Dispatcher(registry), new TimeResolver(ZoneOffset.UTC), timer,
            workers, clock, SchedulerOptions.defaults());
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
        timer.close();
        workers.shutdownNow();
    }

    @Test
    void everySecondJobShouldFireRepeatedlyAndLogSuccess() throws Exception {
        Job job = scheduler.createJob(JobSpec.recurring("heartbeat", "* * * * * *", JobTarget.of("clock", "tick")));

        await().atMost(Duration.ofSeconds(6)).until(() -> store.get(job.id()).orElseThrow().runCount() >= 2);

        assertThat(ticks.get()).isGreaterThanOrEqualTo(2);
        assertThat(log.query(job.id(), 10)).extracting(ExecutionLogEntry::status).containsOnly(ExecutionStatus.SUCCESS);
        assertThat(store.get(job.id()).orElseThrow().nextRun()).isAfter(Instant.now().minusSeconds(2));
    }

    @Test
    void oneTimeJobShouldFireOnceAtItsInstant() throws Exception {
        Job job = scheduler.createJob(JobSpec.oneTime("soon", Instant.now().plusMillis(1500), JobTarget.of("clock", "tick")));

        assertThat(scheduler.isScheduled(job.id())).isTrue();
        await().atMost(Duration.ofSeconds(5)).until(() -> !store.get(job.id()).orElseThrow().enabled());

        assertThat(ticks.get()).isEqualTo(1);
        assertThat(log.query(job.id(), 10)).hasSize(1);
        assertThat(scheduler.isScheduled(job.id())).isFalse();
    }

    @Test
    void failingHandlerShouldNotStopFutureFires() throws Exception {
        Job job = scheduler.createJob(JobSpec.recurring("broken", "* * * * * *", JobTarget.of("clock", "boom")));

        await().atMost(Duration.ofSeconds(6)).until(() -> store.get(job.id()).orElseThrow().errorCount() >= 2);

        Job reloaded = store.get(job.id()).orElseThrow();
        assertThat(reloaded.enabled()).isTrue();
        assertThat(reloaded.lastError()).isEqualTo("boom");
        assertThat(scheduler.isScheduled(job.id())).isTrue();
    }
}
