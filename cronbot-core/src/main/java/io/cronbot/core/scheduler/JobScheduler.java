package io.cronbot.core.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.cronbot.core.dispatch.CapabilityExecutionException;
import io.cronbot.core.dispatch.DispatchException;
import io.cronbot.core.dispatch.Dispatcher;
import io.cronbot.core.job.Job;
import io.cronbot.core.job.JobKind;
import io.cronbot.core.job.JobSchedule;
import io.cronbot.core.job.JobSpec;
import io.cronbot.core.schedule.TimeResolver;
import io.cronbot.core.store.DuplicateJobNameException;
import io.cronbot.core.store.ExecutionLog;
import io.cronbot.core.store.ExecutionOutcome;
import io.cronbot.core.store.JobStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the live timers of persisted jobs.
 *
 * <p>Timer callbacks run on the {@link TimerService} thread and only re-arm and hand off; capabilities run on
 * the worker executor. A recurring job is re-armed before its handler starts, so a slow or failing handler
 * never delays the following occurrence. Outcomes are written through {@link JobStore#recordOutcome}.
 */
public final class JobScheduler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(JobScheduler.class);

    private final JobStore store;
    private final ExecutionLog executionLog;
    private final Dispatcher dispatcher;
    private final TimeResolver timeResolver;
    private final TimerService timer;
    private final Executor workers;
    private final Clock clock;
    private final SchedulerOptions options;
    private final ObjectMapper mapper;
    private final Map<Long, JobHandle> handles = new ConcurrentHashMap<>();
    private final Map<Long, Integer> inFlight = new ConcurrentHashMap<>();
    private volatile boolean recovered;

    public JobScheduler(
        JobStore store,
        ExecutionLog executionLog,
        Dispatcher dispatcher,
        TimeResolver timeResolver,
        TimerService timer,
        Executor workers,
        Clock clock,
        SchedulerOptions options
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.executionLog = Objects.requireNonNull(executionLog, "executionLog must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.timeResolver = Objects.requireNonNull(timeResolver, "timeResolver must not be null");
        this.timer = Objects.requireNonNull(timer, "timer must not be null");
        this.workers = Objects.requireNonNull(workers, "workers must not be null");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.options = options == null ? SchedulerOptions.defaults() : options;
        this.mapper = new ObjectMapper().registerModule(new JavaTimeModule());
    }

    /**
     * Validates the schedule, persists the job and arms its timer when {@code spec} is enabled.
     *
     * @throws io.cronbot.core.schedule.InvalidScheduleExpressionException for an unusable cron expression
     * @throws io.cronbot.core.schedule.PastScheduleTimeException for a one-time instant not in the future
     * @throws io.cronbot.core.schedule.ScheduleOutOfRangeException for a one-time instant past the supported range
     * @throws DuplicateJobNameException when the name is taken
     */
    public Job createJob(JobSpec spec) throws IOException {
        Objects.requireNonNull(spec, "spec must not be null");
        Instant nextRun = firstRun(spec.schedule(), clock.instant());
        if (!dispatcher.supports(spec.target())) {
            LOG.warn("Job '{}' targets {}, which is not registered yet", spec.name(), spec.target());
        }
        Job job = store.create(spec, nextRun);
        LOG.info("Created {} job '{}' (id {}) for {}, next run {}",
            job.kind(), job.name(), job.id(), job.target(), nextRun);
        if (job.enabled()) {
            arm(job, nextRun);
        }
        return job;
    }

    /**
     * Returns the job named {@code spec.name()}, creating it first when it does not exist yet.
     */
    public Job ensureJob(JobSpec spec) throws IOException {
        Objects.requireNonNull(spec, "spec must not be null");
        Optional<Job> existing = store.findByName(spec.name());
        if (existing.isPresent()) {
            LOG.debug("Job '{}' already exists (id {})", spec.name(), existing.get().id());
            return existing.get();
        }
        try {
            return createJob(spec);
        } catch (DuplicateJobNameException e) {
            return store.findByName(spec.name()).orElseThrow(() -> e);
        }
    }

    /**
     * Recomputes the next occurrence from now, persists it and arms the timer.
     */
    public JobHandle scheduleRecurring(Job job) throws IOException {
        requireKind(job, JobKind.RECURRING);
        Instant nextRun = timeResolver.computeNextRun(job.cronExpression(), clock.instant());
        store.updateNextRun(job.id(), nextRun);
        return arm(job, nextRun);
    }

    /**
     * Arms a single-shot timer for the time left until the job's instant.
     *
     * @throws io.cronbot.core.schedule.PastScheduleTimeException if the instant is not in the future
     */
    public JobHandle scheduleOneTime(Job job) {
        requireKind(job, JobKind.ONE_TIME);
        Instant runAt = timeResolver.requireFuture(job.runAt(), clock.instant());
        return arm(job, runAt);
    }

    public synchronized boolean stop(long jobId) {
        JobHandle handle = handles.remove(jobId);
        if (handle == null) {
            return false;
        }
        handle.cancel();
        LOG.info("Stopped job '{}' (id {})", handle.jobName(), jobId);
        return true;
    }

    public synchronized void stopAll() {
        int stopped = handles.size();
        handles.values().forEach(JobHandle::cancel);
        handles.clear();
        if (stopped > 0) {
            LOG.info("Stopped {} scheduled jobs", stopped);
        }
    }

    /**
     * Re-enables a job and arms it. Empty when no job has this id.
     */
    public Optional<JobHandle> enable(long jobId) throws IOException {
        Optional<Job> found = store.get(jobId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Job job = found.get();
        JobHandle handle = job.recurring() ? scheduleRecurring(job) : scheduleOneTime(job);
        try {
            store.setEnabled(jobId, true);
        } catch (IOException e) {
            stop(jobId);
            throw e;
        }
        LOG.info("Enabled job '{}' (id {})", job.name(), jobId);
        return Optional.of(handle);
    }

    public boolean disable(long jobId) throws IOException {
        stop(jobId);
        boolean changed = store.disable(jobId);
        if (changed) {
            LOG.info("Disabled job {}", jobId);
        }
        return changed;
    }

    public boolean disableByName(String name) throws IOException {
        Optional<Job> job = store.findByName(name);
        if (job.isEmpty()) {
            LOG.debug("No job named '{}' to disable", name);
            return false;
        }
        return disable(job.get().id());
    }

    public boolean delete(long jobId) throws IOException {
        stop(jobId);
        boolean deleted = store.delete(jobId);
        if (deleted) {
            LOG.info("Deleted job {}", jobId);
        }
        return deleted;
    }

    public boolean isScheduled(long jobId) {
        JobHandle handle = handles.get(jobId);
        return handle != null && handle.isActive();
    }

    public Optional<JobHandle> handle(long jobId) {
        return Optional.ofNullable(handles.get(jobId));
    }

    public Set<Long> scheduledJobIds() {
        return Set.copyOf(handles.keySet());
    }

    public SchedulerStats stats() throws IOException {
        return SchedulerStats.collect(store, executionLog, timeResolver.zone(), clock.instant(), handles.size());
    }

    public SchedulerHealth health() {
        List<String> issues = new ArrayList<>();
        if (!recovered) {
            issues.add("Recovery has not run");
        }
        if (handles.isEmpty()) {
            issues.add("No jobs are scheduled");
        }
        return new SchedulerHealth(issues.isEmpty(), List.copyOf(issues), handles.size(), clock.instant());
    }

    @Override
    public void close() {
        stopAll();
    }

    void markRecovered() {
        recovered = true;
    }

    private Instant firstRun(JobSchedule schedule, Instant now) {
        if (schedule instanceof JobSchedule.Cron cron) {
            return timeResolver.computeNextRun(cron.expression(), now);
        }
        if (schedule instanceof JobSchedule.At at) {
            return timeResolver.requireFuture(at.instant(), now);
        }
        throw new IllegalStateException("Unsupported schedule: " + schedule);
    }

    private synchronized JobHandle arm(Job job, Instant fireAt) {
        JobHandle previous = handles.remove(job.id());
        if (previous != null) {
            previous.cancel();
        }
        JobHandle handle = new JobHandle(job.id(), job.name(), job.kind(), fireAt);
        handles.put(job.id(), handle);
        handle.attach(timer.schedule(() -> fire(job, handle), Duration.between(clock.instant(), fireAt)));
        LOG.debug("Armed job '{}' for {}", job.name(), fireAt);
        return handle;
    }

    private void fire(Job job, JobHandle handle) {
        Instant nextRun = null;
        synchronized (this) {
            if (handles.get(job.id()) != handle) {
                LOG.debug("Ignoring stale timer of job '{}'", job.name());
                return;
            }
            if (job.recurring()) {
                try {
                    Instant now = clock.instant();
                    Instant from = now.isAfter(handle.fireAt()) ? now : handle.fireAt();
                    nextRun = timeResolver.computeNextRun(job.cronExpression(), from);
                    arm(job, nextRun);
                } catch (RuntimeException e) {
                    handles.remove(job.id());
                    LOG.error("Job '{}' could not be re-armed", job.name(), e);
                }
            } else {
                handles.remove(job.id());
            }
        }
        if (nextRun != null) {
            persistNextRun(job, nextRun);
        }
        execute(job, nextRun);
    }

    private void persistNextRun(Job job, Instant nextRun) {
        try {
            store.updateNextRun(job.id(), nextRun);
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to persist next run {} of job '{}'", nextRun, job.name(), e);
        }
    }

    private void execute(Job job, Instant nextRun) {
        if (options.overlapPolicy() == OverlapPolicy.SKIP && inFlight.containsKey(job.id())) {
            LOG.warn("Skipping job '{}': previous run still in progress", job.name());
            return;
        }
        inFlight.merge(job.id(), 1, Integer::sum);
        Instant startedAt = clock.instant();
        long started = System.nanoTime();
        LOG.info("Executing job '{}' ({})", job.name(), job.target());

        CompletableFuture<Object> invocation;
        try {
            invocation = CompletableFuture.supplyAsync(() -> invoke(job), workers);
        } catch (RejectedExecutionException e) {
            invocation = CompletableFuture.failedFuture(e);
        }
        invocation
            .orTimeout(options.executionTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .whenCompleteAsync((output, error) -> {
                inFlight.computeIfPresent(job.id(), (id, count) -> count <= 1 ? null : count - 1);
                long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
                record(job, nextRun, outcomeOf(job, startedAt, durationMs, output, error));
            }, this::runOnWorkers);
    }

    // outcome recording stays on the worker pool; a saturated or shut down pool records inline
    private void runOnWorkers(Runnable task) {
        try {
            workers.execute(task);
        } catch (RejectedExecutionException e) {
            LOG.debug("Worker pool rejected outcome recording, recording inline");
            task.run();
        }
    }

    private Object invoke(Job job) {
        try {
            return dispatcher.invoke(job.target(), job.parameters());
        } catch (DispatchException | CapabilityExecutionException e) {
            throw new CompletionException(e);
        }
    }

    private ExecutionOutcome outcomeOf(Job job, Instant startedAt, long durationMs, Object output, Throwable error) {
        if (error == null) {
            LOG.info("Job '{}' completed in {} ms", job.name(), durationMs);
            return ExecutionOutcome.success(startedAt, durationMs, snapshot(output));
        }
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            String message = "Execution timed out after " + options.executionTimeout().toMillis() + " ms";
            LOG.warn("Job '{}': {}", job.name(), message);
            return ExecutionOutcome.timeout(startedAt, durationMs, message);
        }
        String message = messageOf(cause);
        LOG.warn("Job '{}' failed: {}", job.name(), message);
        LOG.debug("Job '{}' failure detail", job.name(), cause);
        return ExecutionOutcome.error(startedAt, durationMs, message);
    }

    private void record(Job job, Instant nextRun, ExecutionOutcome outcome) {
        try {
            store.recordOutcome(job.id(), nextRun, outcome);
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to record {} outcome of job '{}'", outcome.status(), job.name(), e);
        }
    }

    private String snapshot(Object output) {
        if (output == null) {
            return null;
        }
        try {
            return mapper.writeValueAsString(output);
        } catch (JsonProcessingException e) {
            LOG.debug("Output of type {} is not serializable, storing its string form", output.getClass().getName());
            return mapper.valueToTree(String.valueOf(output)).toString();
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String messageOf(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static void requireKind(Job job, JobKind expected) {
        Objects.requireNonNull(job, "job must not be null");
        if (job.kind() != expected) {
            throw new IllegalArgumentException("Job '" + job.name() + "' is " + job.kind() + ", expected " + expected);
        }
    }
}
