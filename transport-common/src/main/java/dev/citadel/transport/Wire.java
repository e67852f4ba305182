package dev.citadel.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple helper for logging framed traffic in a consistent format so that client-side and
 * backend-side logs of the gateway look identical.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

    private static final int MAX_LOGGED_CHARS = 200;

    private Wire() {
    }

    public static void rx(String connectionId, String frame) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("RX conn={} bytes={} json={}", connectionId, frame.length(), truncate(frame, MAX_LOGGED_CHARS));
        }
    }

    public static void tx(String connectionId, String frame) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("TX conn={} bytes={} json={}", connectionId, frame.length(), truncate(frame, MAX_LOGGED_CHARS));
        }
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
