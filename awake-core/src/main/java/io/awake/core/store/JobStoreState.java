package io.awake.core.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.awake.core.job.Job;
import io.awake.core.job.RunLog;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JobStoreState(
    List<Job> jobs,
    List<RunLog> runLogs,
    long lastJobId,
    long lastRunLogId
) {

    public JobStoreState {
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
        runLogs = runLogs == null ? List.of() : List.copyOf(runLogs);
        lastJobId = Math.max(0, lastJobId);
        lastRunLogId = Math.max(0, lastRunLogId);
    }

    public static JobStoreState empty() {
        return new JobStoreState(List.of(), List.of(), 0, 0);
    }
}
