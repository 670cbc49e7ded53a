package io.awake.core.engine;

import io.awake.core.job.Job;
import io.awake.core.store.JobStore;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds the in-process wakes from persisted active jobs at startup, and later picks up jobs that
 * other processes created or re-enabled in the shared store.
 */
public final class Rehydrator {
    private static final Logger LOG = LoggerFactory.getLogger(Rehydrator.class);

    private final JobStore store;
    private final JobScheduler scheduler;

    public Rehydrator(JobStore store, JobScheduler scheduler) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    /**
     * @return number of jobs armed
     * @throws IllegalStateException when the active jobs cannot be enumerated
     */
    public int start() {
        List<Job> active;
        try {
            active = store.listActive();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load active jobs at startup", e);
        }
        for (Job job : active) {
            scheduler.schedule(job);
        }
        LOG.info("Rehydrated {} active job(s)", active.size());
        return active.size();
    }

    /**
     * Arms every active job that has neither a pending wake nor a run in progress. Jobs already known
     * to the scheduler keep their wake.
     *
     * @return number of jobs newly armed
     */
    public int rescan() throws IOException {
        int armed = 0;
        for (Job job : store.listActive()) {
            if (scheduler.state(job.id()) == JobState.DISABLED) {
                scheduler.schedule(job);
                armed++;
            }
        }
        if (armed > 0) {
            LOG.info("Rescan armed {} job(s) found in the store", armed);
        }
        return armed;
    }
}
