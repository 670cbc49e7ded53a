package io.awake.cli;

import io.awake.core.job.Job;
import io.awake.core.job.JobSpec;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "add", description = "Create a recurring job")
public final class AddCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--url", required = true, description = "Target URL")
    String url;

    @Option(names = {"-X", "--method"}, description = "HTTP method", defaultValue = "GET")
    String method;

    @Option(names = {"-H", "--header"}, description = "Request header as NAME=VALUE")
    Map<String, String> headers = new LinkedHashMap<>();

    @Option(names = "--body", description = "Raw request body, sent as-is")
    String body;

    @Option(names = "--json-body", description = "JSON request body")
    String jsonBody;

    @Option(names = "--interval-ms", required = true, description = "Milliseconds between the end of a run and the next one")
    long intervalMs;

    @Option(names = "--max-retries", description = "Extra attempts after a transport failure", defaultValue = "0")
    int maxRetries;

    @Option(names = "--retry-delay-ms", description = "Pause between attempts", defaultValue = "0")
    long retryDelayMs;

    public AddCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            JobSpec spec = new JobSpec(
                url,
                method,
                headers,
                RequestOptions.body(body, jsonBody),
                Duration.ofMillis(intervalMs),
                maxRetries,
                Duration.ofMillis(retryDelayMs)
            );
            Job job = context.jobService().create(spec);
            System.out.println("Created " + JobFormatter.summary(job));
            return 0;
        } catch (Exception e) {
            System.err.println("Add command failed: " + e.getMessage());
            return 1;
        }
    }
}
