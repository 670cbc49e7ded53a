package io.awake.core.job;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * Persisted definition of a recurring outbound call. Instances are immutable snapshots; the store
 * owns the durable copy.
 *
 * <p>{@code nextRunAt}, once set, is the authoritative fire time. Before the first computation the
 * fire time falls back to {@code createdAt + interval}.
 */
public record Job(
    long id,
    String url,
    String method,
    Map<String, String> headers,
    JobBody body,
    Duration interval,
    int maxRetries,
    Duration retryDelay,
    Instant createdAt,
    Instant lastRunAt,
    Instant nextRunAt,
    boolean active
) {
    public static final String DEFAULT_METHOD = "GET";

    public Job {
        url = url == null ? "" : url.trim();
        method = normalizeMethod(method);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        interval = interval == null ? Duration.ZERO : interval;
        retryDelay = retryDelay == null ? Duration.ZERO : retryDelay;
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
    }

    public static String normalizeMethod(String method) {
        if (method == null || method.isBlank()) {
            return DEFAULT_METHOD;
        }
        return method.trim().toUpperCase(Locale.ROOT);
    }

    public Instant effectiveNextRunAt() {
        return nextRunAt != null ? nextRunAt : createdAt.plus(interval);
    }

    public Job withId(long newId) {
        return new Job(newId, url, method, headers, body, interval, maxRetries, retryDelay, createdAt, lastRunAt, nextRunAt, active);
    }

    public Job withSchedule(Instant newLastRunAt, Instant newNextRunAt) {
        return new Job(id, url, method, headers, body, interval, maxRetries, retryDelay, createdAt, newLastRunAt, newNextRunAt, active);
    }

    public Job withActive(boolean newActive) {
        return new Job(id, url, method, headers, body, interval, maxRetries, retryDelay, createdAt, lastRunAt, nextRunAt, newActive);
    }

    /**
     * Applies the non-null fields of {@code patch}. Schedule fields and the active flag are never
     * touched by a patch.
     */
    public Job patchedWith(JobPatch patch) {
        if (patch == null) {
            return this;
        }
        return new Job(
            id,
            patch.url() != null ? patch.url() : url,
            patch.method() != null ? patch.method() : method,
            patch.headers() != null ? patch.headers() : headers,
            patch.body() != null ? patch.body() : body,
            patch.interval() != null ? patch.interval() : interval,
            patch.maxRetries() != null ? patch.maxRetries() : maxRetries,
            patch.retryDelay() != null ? patch.retryDelay() : retryDelay,
            createdAt,
            lastRunAt,
            nextRunAt,
            active
        );
    }
}
