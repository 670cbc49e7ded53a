package io.awake.core.http;

import java.util.Locale;
import java.util.Map;

/**
 * One outbound call. {@code body} is {@code null} when nothing is sent.
 */
public record OutboundRequest(
    String method,
    String url,
    Map<String, String> headers,
    String body
) {
    public OutboundRequest {
        method = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase(Locale.ROOT);
        url = url == null ? "" : url.trim();
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /**
     * Case-insensitive header lookup.
     */
    public String header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public boolean hasBody() {
        return body != null;
    }
}
