package io.cronbot.core.scheduler;

import static org.assertj.core.api.Assertions.assertThat;

import io.cronbot.core.dispatch.Dispatcher;
import io.cronbot.core.dispatch.JobCollaborator;
import io.cronbot.core.dispatch.TargetRegistry;
import io.cronbot.core.job.Job;
import io.cronbot.core.job.JobSpec;
import io.cronbot.core.job.JobTarget;
import io.cronbot.core.schedule.TimeResolver;
import io.cronbot.core.store.JdbcExecutionLog;
import io.cronbot.core.store.JdbcJobStore;
import io.cronbot.core.store.SqliteDatabase;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RecoveryManagerTest {
    private static final Instant BEFORE_RESTART = Instant.parse("2026-01-01T00:00:00Z");
    private static final Instant AFTER_RESTART = Instant.parse("2026-01-01T06:07:30Z");
    private static final JobTarget PING = JobTarget.of("ops", "ping");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private ManualTimerService timer;
    private JdbcJobStore store;
    private JdbcExecutionLog log;
    private AtomicInteger pings;
    private JobScheduler scheduler;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(BEFORE_RESTART);
        timer = new ManualTimerService(clock);
        SqliteDatabase database = new SqliteDatabase(tempDir.resolve("cronbot.db"));
        store = new JdbcJobStore(database, clock);
        log = new JdbcExecutionLog(database);
        pings = new AtomicInteger();
        TargetRegistry registry = new TargetRegistry();
        registry.register(JobCollaborator.of("ops", Map.of("ping", parameters -> pings.incrementAndGet())));
        scheduler = new JobScheduler(store, log, new Dispatcher(registry), new TimeResolver(ZoneOffset.UTC), timer,
            Runnable::run, clock, SchedulerOptions.defaults());
    }

    @Test
    void shouldRearmRecurringJobsFromNowWithoutReplayingMissedTicks() throws Exception {
        Job hourly = store.create(JobSpec.recurring("hourly", "0 * * * *", PING), Instant.parse("2026-01-01T01:00:00Z"));
        clock.set(AFTER_RESTART);

        RecoveryReport report = new RecoveryManager(store, scheduler, clock).recover();

        assertThat(report.recurring()).containsExactly("hourly");
        assertThat(store.get(hourly.id()).orElseThrow().nextRun()).isEqualTo(Instant.parse("2026-01-01T07:00:00Z"));
        assertThat(scheduler.handle(hourly.id()).orElseThrow().fireAt()).isEqualTo(Instant.parse("2026-01-01T07:00:00Z"));
        assertThat(pings).hasValue(0);
        assertThat(log.query(null, 10)).isEmpty();

        timer.advance(Duration.ofMinutes(53));
        assertThat(pings).hasValue(1);
    }

    @Test
    void shouldDisableLapsedOneTimeJobsWithoutRunningThem() throws Exception {
        Job lapsed = store.create(JobSpec.oneTime("lapsed", Instant.parse("2026-01-01T03:00:00Z"), PING),
            Instant.parse("2026-01-01T03:00:00Z"));
        Job upcoming = store.create(JobSpec.oneTime("upcoming", Instant.parse("2026-01-01T08:00:00Z"), PING),
            Instant.parse("2026-01-01T08:00:00Z"));
        clock.set(AFTER_RESTART);

        RecoveryReport report = new RecoveryManager(store, scheduler, clock).recover();

        assertThat(report.expired()).containsExactly("lapsed");
        assertThat(report.oneTime()).containsExactly("upcoming");
        assertThat(store.get(lapsed.id()).orElseThrow().enabled()).isFalse();
        assertThat(store.get(lapsed.id()).orElseThrow().runCount()).isZero();
        assertThat(log.query(lapsed.id(), 10)).isEmpty();
        assertThat(scheduler.isScheduled(lapsed.id())).isFalse();

        JobHandle handle = scheduler.handle(upcoming.id()).orElseThrow();
        assertThat(handle.fireAt()).isEqualTo(Instant.parse("2026-01-01T08:00:00Z"));
        timer.advance(Duration.between(AFTER_RESTART, Instant.parse("2026-01-01T08:00:00Z")));
        assertThat(pings).hasValue(1);
        assertThat(store.get(upcoming.id()).orElseThrow().enabled()).isFalse();
    }

    @Test
    void shouldIgnoreDisabledJobs() throws Exception {
        store.create(JobSpec.recurring("paused", "* * * * *", PING).withEnabled(false), BEFORE_RESTART.plusSeconds(60));
        clock.set(AFTER_RESTART);

        RecoveryReport report = new RecoveryManager(store, scheduler, clock).recover();

        assertThat(report.rearmed()).isZero();
        assertThat(scheduler.scheduledJobIds()).isEmpty();
    }

    @Test
    void shouldCollectPerJobFailuresAndContinue() throws Exception {
        store.create(JobSpec.recurring("corrupt", "99 99 * * *", PING), BEFORE_RESTART.plusSeconds(60));
        store.create(JobSpec.recurring("healthy", "*/15 * * * *", PING), BEFORE_RESTART.plusSeconds(900));
        clock.set(AFTER_RESTART);

        RecoveryReport report = new RecoveryManager(store, scheduler, clock).recover();

        assertThat(report.hasFailures()).isTrue();
        assertThat(report.failures()).containsOnlyKeys("corrupt");
        assertThat(report.recurring()).containsExactly("healthy");
        assertThat(scheduler.scheduledJobIds()).hasSize(1);
        assertThat(scheduler.health().healthy()).isTrue();
    }

    @Test
    void healthShouldReportRecoveredSchedulerWithoutJobs() throws Exception {
        new RecoveryManager(store, scheduler, clock).recover();

        assertThat(scheduler.health().healthy()).isFalse();
        assertThat(scheduler.health().issues()).containsExactly("No jobs are scheduled");
    }
}
