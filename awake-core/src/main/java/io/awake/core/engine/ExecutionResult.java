package io.awake.core.engine;

import io.awake.core.job.Job;
import io.awake.core.job.RunResult;

/**
 * Outcome of one execution cycle together with the job snapshot carrying its new schedule.
 * {@code jobRemoved} is set when the job was deleted while the cycle ran; nothing was persisted then.
 */
public record ExecutionResult(RunResult result, Job job, boolean jobRemoved) {

    public ExecutionResult(RunResult result, Job job) {
        this(result, job, false);
    }
}
