package io.awake.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@code timerThreads} sizes the pool that fires wakes; the calls themselves run on a separate pool
 * that grows with the number of jobs firing at once.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(
    int timerThreads,
    int runLogLimit,
    int shutdownGraceSeconds,
    int rescanSeconds
) {

    public SchedulerConfig {
        timerThreads = Math.max(1, timerThreads);
        runLogLimit = Math.max(1, runLogLimit);
        shutdownGraceSeconds = Math.max(0, shutdownGraceSeconds);
        rescanSeconds = Math.max(1, rescanSeconds);
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(4, 200, 10, 5);
    }
}
