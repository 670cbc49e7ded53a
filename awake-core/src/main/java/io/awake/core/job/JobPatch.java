package io.awake.core.job;

import java.time.Duration;
import java.util.Map;

/**
 * Partial update of a job definition. {@code null} fields are left unchanged.
 */
public record JobPatch(
    String url,
    String method,
    Map<String, String> headers,
    JobBody body,
    Duration interval,
    Integer maxRetries,
    Duration retryDelay
) {
    public JobPatch {
        headers = headers == null ? null : Map.copyOf(headers);
    }

    public static JobPatch empty() {
        return new JobPatch(null, null, null, null, null, null, null);
    }

    public JobPatch withInterval(Duration newInterval) {
        return new JobPatch(url, method, headers, body, newInterval, maxRetries, retryDelay);
    }

    public JobPatch withUrl(String newUrl) {
        return new JobPatch(newUrl, method, headers, body, interval, maxRetries, retryDelay);
    }

    public JobPatch withRetries(Integer retries, Duration delay) {
        return new JobPatch(url, method, headers, body, interval, retries, delay);
    }

    public boolean isEmpty() {
        return url == null
            && method == null
            && headers == null
            && body == null
            && interval == null
            && maxRetries == null
            && retryDelay == null;
    }
}
