package io.awake.core.http;

@FunctionalInterface
public interface OutboundCaller {

    /**
     * Performs the request and returns the response status, whatever its value.
     *
     * @throws TransportException when no response was received
     */
    int perform(OutboundRequest request) throws TransportException;
}
