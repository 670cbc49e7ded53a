package io.awake.core.store;

import io.awake.core.job.Job;
import io.awake.core.job.JobPatch;
import io.awake.core.job.RunLog;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable home of jobs and their run history. Implementations must be safe for concurrent use
 * across distinct job ids.
 */
public interface JobStore {
    Optional<Job> get(long id) throws IOException;

    /**
     * All jobs, newest id first.
     */
    List<Job> list() throws IOException;

    List<Job> listActive() throws IOException;

    /**
     * Persists {@code job} under a fresh id and returns the stored copy. The incoming id is ignored.
     */
    Job insert(Job job) throws IOException;

    /**
     * Writes only the schedule columns, leaving the definition and the active flag alone.
     *
     * @return whether a job with that id existed
     */
    boolean updateSchedule(long id, Instant lastRunAt, Instant nextRunAt) throws IOException;

    Optional<Job> updateFields(long id, JobPatch patch) throws IOException;

    /**
     * Removes the job together with its run logs.
     *
     * @return whether a job with that id existed
     */
    boolean delete(long id) throws IOException;

    Optional<Job> setActive(long id, boolean active) throws IOException;

    /**
     * Appends a run log under a fresh id. Nothing is written when the referenced job no longer exists.
     */
    Optional<RunLog> appendRunLog(RunLog runLog) throws IOException;

    /**
     * Most recent run logs of a job, newest first, at most {@code limit} entries.
     */
    List<RunLog> listRunLogs(long jobId, int limit) throws IOException;
}
