package dev.citadel.gateway.transport;

import java.io.IOException;

/**
 * Outbound half of a stream connection. One call writes one complete frame.
 */
@FunctionalInterface
public interface FrameSink {

    void send(String frame) throws IOException;

    /**
     * Drop the underlying client connection. Called when the client stops reading or its
     * session ends without the connection closing.
     */
    default void close() {
    }
}
