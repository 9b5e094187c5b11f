package io.cronbot.core.scheduler;

import io.cronbot.core.job.JobKind;
import java.time.Instant;

/**
 * Live timer of one job, as tracked by {@link JobScheduler}.
 */
public final class JobHandle {
    private final long jobId;
    private final String jobName;
    private final JobKind kind;
    private final Instant fireAt;
    private volatile TimerHandle timer;

    JobHandle(long jobId, String jobName, JobKind kind, Instant fireAt) {
        this.jobId = jobId;
        this.jobName = jobName;
        this.kind = kind;
        this.fireAt = fireAt;
    }

    public long jobId() {
        return jobId;
    }

    public String jobName() {
        return jobName;
    }

    public JobKind kind() {
        return kind;
    }

    public Instant fireAt() {
        return fireAt;
    }

    public boolean isActive() {
        TimerHandle current = timer;
        return current != null && current.isActive();
    }

    void attach(TimerHandle timer) {
        this.timer = timer;
    }

    boolean cancel() {
        TimerHandle current = timer;
        return current != null && current.cancel();
    }

    @Override
    public String toString() {
        return "JobHandle[" + jobName + "#" + jobId + " @ " + fireAt + "]";
    }
}
