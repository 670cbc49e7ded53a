package io.awake.core.engine;

import io.awake.core.http.OutboundCaller;
import io.awake.core.http.OutboundRequest;
import io.awake.core.http.TransportException;
import io.awake.core.job.Job;
import io.awake.core.job.JobBody;
import io.awake.core.job.RunResult;
import io.awake.core.store.JobStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one execution cycle of a job: up to {@code maxRetries + 1} attempts separated by the fixed
 * retry delay, then an unconditional reschedule to {@code finish + interval}.
 *
 * <p>Any status code counts as a completed call. Only transport failures are retried.
 */
public final class JobExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(JobExecutor.class);
    private static final String CONTENT_TYPE = "content-type";
    private static final String JSON_CONTENT_TYPE = "application/json";

    private final OutboundCaller caller;
    private final JobStore store;
    private final Clock clock;

    public JobExecutor(OutboundCaller caller, JobStore store, Clock clock) {
        this.caller = Objects.requireNonNull(caller, "caller must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ExecutionResult run(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        OutboundRequest request = buildRequest(job);
        int maxAttempts = Math.max(0, job.maxRetries()) + 1;
        Instant startedAt = clock.instant();

        int attempts = 0;
        Integer statusCode = null;
        String lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            attempts = attempt;
            try {
                statusCode = caller.perform(request);
                break;
            } catch (TransportException e) {
                lastError = describe(e);
                if (attempt == maxAttempts) {
                    LOG.warn("Job {} attempt {}/{} failed, giving up: {}", job.id(), attempt, maxAttempts, lastError);
                    break;
                }
                LOG.debug("Job {} attempt {}/{} failed, retrying: {}", job.id(), attempt, maxAttempts, lastError);
                if (!pause(job.retryDelay())) {
                    LOG.info("Job {} retries interrupted after {} attempt(s)", job.id(), attempt);
                    break;
                }
            }
        }

        Instant finishedAt = clock.instant();
        RunResult result = statusCode != null
            ? RunResult.succeeded(startedAt, finishedAt, statusCode, attempts)
            : RunResult.failed(startedAt, finishedAt, lastError, attempts);
        Instant nextRunAt = finishedAt.plus(job.interval());
        Job rescheduled = job.withSchedule(finishedAt, nextRunAt);

        if (!persist(job.id(), result, rescheduled)) {
            LOG.info("Job {} was deleted during its run, result discarded", job.id());
            return new ExecutionResult(result, rescheduled, true);
        }
        LOG.info(
            "Job {} {} {} after {} attempt(s) in {} ms, next run at {}",
            job.id(),
            job.method(),
            result.success() ? "completed with status " + result.statusCode() : "failed",
            result.attemptCount(),
            result.elapsed().toMillis(),
            nextRunAt
        );
        return new ExecutionResult(result, rescheduled);
    }

    OutboundRequest buildRequest(Job job) {
        Map<String, String> headers = new LinkedHashMap<>(job.headers());
        JobBody body = job.body();
        String payload = null;
        if (body != null) {
            payload = body.content();
            if (body.json() && headers.keySet().stream().noneMatch(CONTENT_TYPE::equalsIgnoreCase)) {
                headers.put(CONTENT_TYPE, JSON_CONTENT_TYPE);
            }
        }
        return new OutboundRequest(job.method(), job.url(), headers, payload);
    }

    // store failures must not stop the job from being rescheduled; false only when the job is gone
    private boolean persist(long jobId, RunResult result, Job rescheduled) {
        try {
            if (!store.updateSchedule(jobId, rescheduled.lastRunAt(), rescheduled.nextRunAt())) {
                return false;
            }
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to persist schedule of job {}", jobId, e);
        }
        try {
            return store.appendRunLog(result.toRunLog(jobId)).isPresent();
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to append run log for job {}", jobId, e);
            return true;
        }
    }

    private boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String describe(TransportException e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
