package io.awake.core.job;

import java.time.Duration;
import okhttp3.HttpUrl;

/**
 * Rejects job definitions the engine cannot run: unusable urls, blank methods, non-positive
 * intervals and negative retry settings. Anything finer grained belongs to the caller.
 */
public final class JobValidator {

    private JobValidator() {
    }

    public static void validate(JobSpec spec) {
        if (spec == null) {
            throw new InvalidJobException("job spec is required");
        }
        requireUrl(spec.url());
        if (spec.method() != null) {
            requireMethod(spec.method());
        }
        requireInterval(spec.interval());
        requireRetries(spec.maxRetries());
        requireRetryDelay(spec.retryDelay());
    }

    public static void validate(JobPatch patch) {
        if (patch == null) {
            throw new InvalidJobException("job patch is required");
        }
        if (patch.url() != null) {
            requireUrl(patch.url());
        }
        if (patch.method() != null) {
            requireMethod(patch.method());
        }
        if (patch.interval() != null) {
            requireInterval(patch.interval());
        }
        if (patch.maxRetries() != null) {
            requireRetries(patch.maxRetries());
        }
        if (patch.retryDelay() != null) {
            requireRetryDelay(patch.retryDelay());
        }
    }

    private static void requireUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidJobException("url is required");
        }
        if (HttpUrl.parse(url.trim()) == null) {
            throw new InvalidJobException("url must be an absolute http(s) url: " + url);
        }
    }

    private static void requireMethod(String method) {
        if (method.isBlank()) {
            throw new InvalidJobException("method must not be blank");
        }
        if (!method.trim().chars().allMatch(c -> c > 0x20 && c < 0x7f)) {
            throw new InvalidJobException("method must be a single token: " + method);
        }
    }

    private static void requireInterval(Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new InvalidJobException("interval must be > 0");
        }
    }

    private static void requireRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new InvalidJobException("maxRetries must be >= 0");
        }
    }

    private static void requireRetryDelay(Duration retryDelay) {
        if (retryDelay != null && retryDelay.isNegative()) {
            throw new InvalidJobException("retryDelay must be >= 0");
        }
    }
}
