package io.awake.core.job;

public final class JobNotFoundException extends RuntimeException {
    private final long jobId;

    public JobNotFoundException(long jobId) {
        super("job not found: " + jobId);
        this.jobId = jobId;
    }

    public long jobId() {
        return jobId;
    }
}
