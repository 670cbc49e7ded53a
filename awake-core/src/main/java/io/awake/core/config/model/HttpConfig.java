package io.awake.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Outbound call limits in milliseconds; zero disables the limit.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HttpConfig(
    long connectTimeoutMs,
    long readTimeoutMs,
    long writeTimeoutMs,
    long callTimeoutMs,
    boolean followRedirects
) {

    public HttpConfig {
        connectTimeoutMs = Math.max(0, connectTimeoutMs);
        readTimeoutMs = Math.max(0, readTimeoutMs);
        writeTimeoutMs = Math.max(0, writeTimeoutMs);
        callTimeoutMs = Math.max(0, callTimeoutMs);
    }

    public static HttpConfig defaults() {
        return new HttpConfig(0, 0, 0, 0, true);
    }
}
