package io.awake.core.job;

import java.time.Duration;
import java.time.Instant;

public record RunResult(
    Instant startedAt,
    Instant finishedAt,
    boolean success,
    Integer statusCode,
    String errorMessage,
    int attemptCount
) {

    public static RunResult succeeded(Instant startedAt, Instant finishedAt, int statusCode, int attemptCount) {
        return new RunResult(startedAt, finishedAt, true, statusCode, null, attemptCount);
    }

    public static RunResult failed(Instant startedAt, Instant finishedAt, String errorMessage, int attemptCount) {
        return new RunResult(startedAt, finishedAt, false, null, errorMessage, attemptCount);
    }

    public Duration elapsed() {
        return Duration.between(startedAt, finishedAt);
    }

    public RunLog toRunLog(long jobId) {
        return new RunLog(0L, jobId, startedAt, finishedAt, success, statusCode, errorMessage, attemptCount);
    }
}
