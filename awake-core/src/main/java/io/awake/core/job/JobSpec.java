package io.awake.core.job;

import java.time.Duration;
import java.util.Map;

/**
 * Input for creating a job. {@code method} defaults to GET, retries and retry delay default to zero.
 */
public record JobSpec(
    String url,
    String method,
    Map<String, String> headers,
    JobBody body,
    Duration interval,
    int maxRetries,
    Duration retryDelay
) {
    public JobSpec {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        retryDelay = retryDelay == null ? Duration.ZERO : retryDelay;
    }

    public static JobSpec get(String url, Duration interval) {
        return new JobSpec(url, Job.DEFAULT_METHOD, Map.of(), null, interval, 0, Duration.ZERO);
    }

    public JobSpec withRetries(int retries, Duration delay) {
        return new JobSpec(url, method, headers, body, interval, retries, delay);
    }

    public JobSpec withRequest(String newMethod, Map<String, String> newHeaders, JobBody newBody) {
        return new JobSpec(url, newMethod, newHeaders, newBody, interval, maxRetries, retryDelay);
    }
}
