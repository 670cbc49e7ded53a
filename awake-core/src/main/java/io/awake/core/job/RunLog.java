package io.awake.core.job;

import java.time.Instant;

/**
 * Immutable record of one execution cycle. {@code statusCode} is set only when a call completed,
 * {@code errorMessage} only when the cycle failed.
 */
public record RunLog(
    long id,
    long jobId,
    Instant startedAt,
    Instant finishedAt,
    boolean success,
    Integer statusCode,
    String errorMessage,
    int attemptCount
) {
    public RunLog {
        startedAt = startedAt == null ? Instant.EPOCH : startedAt;
        finishedAt = finishedAt == null ? startedAt : finishedAt;
        attemptCount = Math.max(1, attemptCount);
    }

    public RunLog withId(long newId) {
        return new RunLog(newId, jobId, startedAt, finishedAt, success, statusCode, errorMessage, attemptCount);
    }
}
