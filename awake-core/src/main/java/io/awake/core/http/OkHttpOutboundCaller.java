package io.awake.core.http;

import io.awake.core.config.model.HttpConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

public final class OkHttpOutboundCaller implements OutboundCaller {
    private static final Set<String> BODY_REQUIRED = Set.of("POST", "PUT", "PATCH");
    private static final byte[] EMPTY = new byte[0];

    private final OkHttpClient client;

    public OkHttpOutboundCaller(OkHttpClient client) {
        this.client = Objects.requireNonNull(client, "client must not be null");
    }

    /**
     * Zero timeouts mean "no timeout", which is also OkHttp's reading of zero.
     */
    public static OkHttpOutboundCaller fromConfig(HttpConfig config) {
        OkHttpClient client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofMillis(config.connectTimeoutMs()))
            .readTimeout(Duration.ofMillis(config.readTimeoutMs()))
            .writeTimeout(Duration.ofMillis(config.writeTimeoutMs()))
            .callTimeout(Duration.ofMillis(config.callTimeoutMs()))
            .followRedirects(config.followRedirects())
            .followSslRedirects(config.followRedirects())
            .build();
        return new OkHttpOutboundCaller(client);
    }

    @Override
    public int perform(OutboundRequest request) throws TransportException {
        Request httpRequest = buildRequest(request);
        try (Response response = client.newCall(httpRequest).execute()) {
            return response.code();
        } catch (IOException e) {
            throw new TransportException(describe(e), e);
        }
    }

    private Request buildRequest(OutboundRequest request) throws TransportException {
        try {
            Request.Builder builder = new Request.Builder().url(request.url());
            for (Map.Entry<String, String> header : request.headers().entrySet()) {
                builder.addHeader(header.getKey(), header.getValue());
            }
            return builder.method(request.method(), requestBody(request)).build();
        } catch (IllegalArgumentException e) {
            throw new TransportException(describe(e), e);
        }
    }

    private RequestBody requestBody(OutboundRequest request) {
        String contentType = request.header("Content-Type");
        MediaType mediaType = contentType == null ? null : MediaType.parse(contentType);
        if (request.hasBody()) {
            // bytes keep the caller's content type verbatim; the String overload appends a charset
            return RequestBody.create(request.body().getBytes(StandardCharsets.UTF_8), mediaType);
        }
        if (BODY_REQUIRED.contains(request.method())) {
            return RequestBody.create(EMPTY, mediaType);
        }
        return null;
    }

    private String describe(Exception e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return message;
    }
}
