package dev.citadel.gateway.backend;

import java.io.Closeable;
import java.io.IOException;

/**
 * Raw frame pipe to one backend. The gateway core never looks behind it.
 */
public interface BackendTransport extends Closeable {

    /**
     * Begin delivering inbound frames. Called exactly once, before the first {@link #send}.
     */
    void start(Listener listener);

    /**
     * Write one frame. Callers serialize writes.
     */
    void send(String frame) throws IOException;

    /**
     * Release the underlying resources. Must be idempotent and must not throw.
     */
    @Override
    void close();

    String describe();

    interface Listener {

        void onFrame(String frame);

        /**
         * The pipe ended; {@code cause} is {@code null} on a clean end of stream.
         */
        void onClosed(Throwable cause);
    }
}
