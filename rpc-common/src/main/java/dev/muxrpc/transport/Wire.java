package dev.muxrpc.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs framed traffic in one format so that caller and responder logs line up.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

    private static final int MAX_LOGGED_CHARS = 200;

    private Wire() {
    }

    public static void rx(String connectionId, String frame) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("RX conn={} chars={} frame={}", connectionId, frame.length(), truncate(frame, MAX_LOGGED_CHARS));
        }
    }

    public static void tx(String connectionId, String frame) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("TX conn={} chars={} frame={}", connectionId, frame.length(), truncate(frame, MAX_LOGGED_CHARS));
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
