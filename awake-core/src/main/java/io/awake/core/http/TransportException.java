package io.awake.core.http;

import java.io.IOException;

/**
 * The call never produced an HTTP status: connection refused, reset, timed out, or a request that
 * could not be built.
 */
public class TransportException extends IOException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
