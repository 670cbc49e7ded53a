package io.awake.core.engine;

import io.awake.core.job.Job;
import io.awake.core.store.JobStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the in-process wakes, at most one per job id.
 *
 * <p>A wake carries only the job id. When it fires the job is read again from the store, so
 * updates, disables and deletes made after the wake was armed are honoured. Fired wakes are handed
 * to a worker pool; each run holds a per-job lock across re-fetch, execution, persistence and the
 * follow-up {@link #schedule(Job)}, which keeps one execution in flight per job. A wake that reaches
 * the lock before the stored {@code nextRunAt} is due, for instance one armed by an update while the
 * previous run was still going, is re-armed rather than run.
 */
public final class JobScheduler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(JobScheduler.class);

    private final JobStore store;
    private final JobExecutor executor;
    private final Clock clock;
    private final Duration shutdownGrace;
    private final ScheduledThreadPoolExecutor timer;
    private final ExecutorService workers;
    private final Map<Long, Wake> wakes = new ConcurrentHashMap<>();
    private final Map<Long, ReentrantLock> runLocks = new ConcurrentHashMap<>();
    private final Map<Long, Integer> inFlight = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public JobScheduler(JobStore store, JobExecutor executor, Clock clock) {
        this(store, executor, clock, 2, Duration.ofSeconds(10));
    }

    public JobScheduler(JobStore store, JobExecutor executor, Clock clock, int timerThreads, Duration shutdownGrace) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.shutdownGrace = shutdownGrace == null ? Duration.ZERO : shutdownGrace;
        this.timer = new ScheduledThreadPoolExecutor(Math.max(1, timerThreads), threadFactory("awake-wake-"));
        this.timer.setRemoveOnCancelPolicy(true);
        this.workers = Executors.newCachedThreadPool(threadFactory("awake-run-"));
    }

    /**
     * Arms a wake for an active job at {@code nextRunAt} (or {@code createdAt + interval} when it was
     * never computed), replacing any previous wake. Inactive jobs only lose their wake. A fire time
     * in the past yields an immediate wake.
     */
    public void schedule(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        if (!job.active()) {
            cancel(job.id());
            return;
        }
        if (closed.get()) {
            LOG.debug("Scheduler closed, not arming job {}", job.id());
            return;
        }

        Instant fireAt = job.effectiveNextRunAt();
        long delayNanos = Math.max(0L, Duration.between(clock.instant(), fireAt).toNanos());
        Wake wake = new Wake(job.id());
        try {
            wakes.compute(job.id(), (id, previous) -> {
                if (previous != null) {
                    previous.cancel();
                }
                wake.arm(timer.schedule(wake, delayNanos, TimeUnit.NANOSECONDS));
                return wake;
            });
        } catch (RejectedExecutionException e) {
            LOG.debug("Scheduler closed while arming job {}", job.id());
            return;
        }
        LOG.debug("Armed job {} to fire in {} ms at {}", job.id(), TimeUnit.NANOSECONDS.toMillis(delayNanos), fireAt);
    }

    /**
     * Drops the pending wake of a job, if any. A run already in progress is not affected.
     */
    public void cancel(long jobId) {
        Wake wake = wakes.remove(jobId);
        if (wake != null) {
            wake.cancel();
            LOG.debug("Cancelled wake of job {}", jobId);
        }
    }

    /**
     * Cancels the wake of a deleted job and drops its run lock unless a run still holds it.
     */
    public void forget(long jobId) {
        cancel(jobId);
        runLocks.computeIfPresent(jobId, (id, lock) -> lock.isLocked() || lock.hasQueuedThreads() ? lock : null);
    }

    public boolean isPending(long jobId) {
        return wakes.containsKey(jobId);
    }

    public int pendingCount() {
        return wakes.size();
    }

    int runLockCount() {
        return runLocks.size();
    }

    public JobState state(long jobId) {
        if (inFlight.containsKey(jobId)) {
            return JobState.RUNNING;
        }
        return wakes.containsKey(jobId) ? JobState.PENDING : JobState.DISABLED;
    }

    @Override
    public void close() {
        if (closed.getAndSet(true)) {
            return;
        }
        wakes.values().forEach(Wake::cancel);
        wakes.clear();
        timer.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Runs still in progress after {} ms, interrupting", shutdownGrace.toMillis());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void fire(Wake wake) {
        inFlight.merge(wake.jobId, 1, Integer::sum);
        // a wake replaced or cancelled after its timer elapsed must not run
        if (!wakes.remove(wake.jobId, wake)) {
            release(wake.jobId);
            LOG.debug("Skipping superseded wake of job {}", wake.jobId);
            return;
        }
        try {
            workers.execute(() -> runJob(wake.jobId));
        } catch (RejectedExecutionException e) {
            release(wake.jobId);
            LOG.debug("Scheduler closed, dropping wake of job {}", wake.jobId);
        }
    }

    private void runJob(long jobId) {
        ReentrantLock lock = runLocks.computeIfAbsent(jobId, id -> new ReentrantLock());
        boolean gone = false;
        lock.lock();
        try {
            Optional<Job> latest = store.get(jobId);
            if (latest.isEmpty()) {
                gone = true;
                LOG.debug("Job {} no longer exists, wake dropped", jobId);
                return;
            }
            Job job = latest.get();
            if (!job.active()) {
                LOG.debug("Job {} is disabled, wake dropped", jobId);
                return;
            }
            if (job.effectiveNextRunAt().isAfter(clock.instant())) {
                LOG.debug("Job {} not due until {}, re-arming", jobId, job.effectiveNextRunAt());
                schedule(job);
                return;
            }
            ExecutionResult execution = executor.run(job);
            if (execution.jobRemoved()) {
                gone = true;
                return;
            }
            schedule(execution.job());
        } catch (IOException e) {
            LOG.warn("Failed to load job {} at fire time, wake dropped", jobId, e);
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure running job {}", jobId, e);
        } finally {
            lock.unlock();
            if (gone) {
                runLocks.remove(jobId, lock);
            }
            release(jobId);
        }
    }

    private void release(long jobId) {
        inFlight.computeIfPresent(jobId, (id, count) -> count <= 1 ? null : count - 1);
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private final class Wake implements Runnable {
        private final long jobId;
        private volatile ScheduledFuture<?> future;

        private Wake(long jobId) {
            this.jobId = jobId;
        }

        private void arm(ScheduledFuture<?> scheduled) {
            this.future = scheduled;
        }

        private void cancel() {
            ScheduledFuture<?> scheduled = future;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }

        @Override
        public void run() {
            fire(this);
        }
    }
}
