package io.awake.cli;

import io.awake.core.job.Job;
import io.awake.core.job.JobPatch;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "update", description = "Change fields of a job; omitted options stay as they are")
public final class UpdateCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", description = "Job id")
    long id;

    @Option(names = "--url", description = "Target URL")
    String url;

    @Option(names = {"-X", "--method"}, description = "HTTP method")
    String method;

    @Option(names = {"-H", "--header"}, description = "Replacement headers as NAME=VALUE")
    Map<String, String> headers;

    @Option(names = "--body", description = "Raw request body, sent as-is")
    String body;

    @Option(names = "--json-body", description = "JSON request body")
    String jsonBody;

    @Option(names = "--interval-ms", description = "Milliseconds between the end of a run and the next one")
    Long intervalMs;

    @Option(names = "--max-retries", description = "Extra attempts after a transport failure")
    Integer maxRetries;

    @Option(names = "--retry-delay-ms", description = "Pause between attempts")
    Long retryDelayMs;

    public UpdateCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            JobPatch patch = new JobPatch(
                url,
                method,
                headers,
                RequestOptions.body(body, jsonBody),
                intervalMs == null ? null : Duration.ofMillis(intervalMs),
                maxRetries,
                retryDelayMs == null ? null : Duration.ofMillis(retryDelayMs)
            );
            if (patch.isEmpty()) {
                System.err.println("Nothing to update");
                return 1;
            }
            Job job = context.jobService().update(id, patch);
            System.out.println("Updated " + JobFormatter.summary(job));
            return 0;
        } catch (Exception e) {
            System.err.println("Update command failed: " + e.getMessage());
            return 1;
        }
    }
}
