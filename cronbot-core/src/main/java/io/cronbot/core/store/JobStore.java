package io.cronbot.core.store;

import io.cronbot.core.job.Job;
import io.cronbot.core.job.JobSpec;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of every job. All mutation of the jobs table goes through this interface.
 */
public interface JobStore {

    /**
     * Persists a new job.
     *
     * @throws DuplicateJobNameException if a job with the same name exists; nothing is written
     */
    Job create(JobSpec spec, Instant nextRun) throws IOException;

    Optional<Job> get(long id) throws IOException;

    Optional<Job> findByName(String name) throws IOException;

    List<Job> listAll() throws IOException;

    List<Job> listEnabled() throws IOException;

    boolean setEnabled(long id, boolean enabled) throws IOException;

    default boolean disable(long id) throws IOException {
        return setEnabled(id, false);
    }

    boolean delete(long id) throws IOException;

    boolean updateNextRun(long id, Instant nextRun) throws IOException;

    /**
     * Updates run statistics and appends the matching execution-log entry as one unit: both are
     * written or neither is. One-time jobs are disabled by the same update.
     *
     * <p>A recurring job's stored next run only moves forward, so an older outcome completing late leaves a
     * newer trigger in place.
     *
     * @param nextRun next trigger of a recurring job, {@code null} for a terminal one-time job
     */
    ExecutionLogEntry recordOutcome(long id, Instant nextRun, ExecutionOutcome outcome) throws IOException;

    int count() throws IOException;

    int countEnabled() throws IOException;
}
