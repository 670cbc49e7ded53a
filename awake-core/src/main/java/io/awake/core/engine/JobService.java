package io.awake.core.engine;

import io.awake.core.job.Job;
import io.awake.core.job.JobNotFoundException;
import io.awake.core.job.JobPatch;
import io.awake.core.job.JobSpec;
import io.awake.core.job.JobValidator;
import io.awake.core.job.RunLog;
import io.awake.core.store.JobStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for whatever exposes jobs to users. Every mutation is written to the store first and
 * then mirrored onto the scheduler.
 */
public final class JobService {
    private static final Logger LOG = LoggerFactory.getLogger(JobService.class);
    public static final int DEFAULT_RUN_LOG_LIMIT = 200;

    private final JobStore store;
    private final JobScheduler scheduler;
    private final Clock clock;
    private final int runLogLimit;

    public JobService(JobStore store, JobScheduler scheduler, Clock clock) {
        this(store, scheduler, clock, DEFAULT_RUN_LOG_LIMIT);
    }

    public JobService(JobStore store, JobScheduler scheduler, Clock clock, int runLogLimit) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.runLogLimit = Math.max(1, runLogLimit);
    }

    public Job create(JobSpec spec) throws IOException {
        JobValidator.validate(spec);
        Instant createdAt = clock.instant();
        Job job = new Job(
            0L,
            spec.url(),
            spec.method(),
            spec.headers(),
            spec.body(),
            spec.interval(),
            spec.maxRetries(),
            spec.retryDelay(),
            createdAt,
            null,
            createdAt.plus(spec.interval()),
            true
        );
        Job stored = store.insert(job);
        scheduler.schedule(stored);
        LOG.info("Created job {} {} {} every {} ms", stored.id(), stored.method(), stored.url(), stored.interval().toMillis());
        return stored;
    }

    /**
     * Changes the definition of a job. The stored {@code nextRunAt} is kept, so a new interval takes
     * effect from the next completed run.
     */
    public Job update(long id, JobPatch patch) throws IOException {
        JobValidator.validate(patch);
        Job updated = store.updateFields(id, patch).orElseThrow(() -> new JobNotFoundException(id));
        scheduler.schedule(updated);
        LOG.info("Updated job {}", id);
        return updated;
    }

    public void disable(long id) throws IOException {
        Optional<Job> disabled = store.setActive(id, false);
        scheduler.cancel(id);
        if (disabled.isEmpty()) {
            throw new JobNotFoundException(id);
        }
        LOG.info("Disabled job {}", id);
    }

    /**
     * Re-activates a job from its stored {@code nextRunAt}; a time already in the past fires
     * immediately.
     */
    public Job enable(long id) throws IOException {
        Job enabled = store.setActive(id, true).orElseThrow(() -> new JobNotFoundException(id));
        scheduler.schedule(enabled);
        LOG.info("Enabled job {}, next run at {}", id, enabled.effectiveNextRunAt());
        return enabled;
    }

    /**
     * Removes the job and its run history. A run already in progress completes its call but records
     * nothing and is not re-armed.
     */
    public boolean delete(long id) throws IOException {
        scheduler.cancel(id);
        boolean removed = store.delete(id);
        scheduler.forget(id);
        if (removed) {
            LOG.info("Deleted job {}", id);
        }
        return removed;
    }

    public Optional<Job> get(long id) throws IOException {
        return store.get(id);
    }

    public List<Job> list() throws IOException {
        return store.list();
    }

    public List<RunLog> runLogs(long id) throws IOException {
        return runLogs(id, runLogLimit);
    }

    public List<RunLog> runLogs(long id, int limit) throws IOException {
        return store.listRunLogs(id, Math.max(1, limit));
    }

    public JobState state(long id) {
        return scheduler.state(id);
    }
}
