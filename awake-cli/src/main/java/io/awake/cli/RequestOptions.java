package io.awake.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.awake.core.job.JobBody;

/**
 * Turns the {@code --body} and {@code --json-body} options into a job body.
 */
final class RequestOptions {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private RequestOptions() {
    }

    static JobBody body(String rawBody, String jsonBody) {
        if (rawBody != null && jsonBody != null) {
            throw new IllegalArgumentException("--body and --json-body are mutually exclusive");
        }
        if (rawBody != null) {
            return JobBody.raw(rawBody);
        }
        if (jsonBody == null) {
            return null;
        }
        try {
            JsonNode parsed = MAPPER.readTree(jsonBody);
            return JobBody.of(parsed, MAPPER);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("--json-body is not valid JSON: " + e.getOriginalMessage());
        }
    }
}
