package io.awake.core.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Request payload of a job. {@code json} marks content that was serialized from structured data and
 * must be sent as JSON; otherwise {@code content} is raw text sent unchanged.
 */
public record JobBody(String content, boolean json) {

    public JobBody {
        content = content == null ? "" : content;
    }

    public static JobBody raw(String text) {
        return new JobBody(text, false);
    }

    public static JobBody json(String serialized) {
        return new JobBody(serialized, true);
    }

    /**
     * Strings become raw text, anything else is serialized with {@code mapper} and flagged as JSON.
     * Returns {@code null} for a {@code null} value so callers can keep "no body" distinct from "empty body".
     */
    public static JobBody of(Object value, ObjectMapper mapper) {
        if (value == null) {
            return null;
        }
        if (value instanceof JobBody body) {
            return body;
        }
        if (value instanceof String text) {
            return raw(text);
        }
        try {
            return json(mapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new InvalidJobException("body is not serializable as JSON: " + e.getOriginalMessage());
        }
    }
}
