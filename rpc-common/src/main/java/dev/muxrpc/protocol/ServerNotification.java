package dev.muxrpc.protocol;

/**
 * Unsolicited request from the responder. The only method in use is {@link #RECONNECT}, telling
 * the caller to drain and let go of the current channel.
 */
public record ServerNotification(RequestId id, String jsonrpc, String method) implements ServerMessage {

    public static final String RECONNECT = "reconnect";

    public static ServerNotification reconnect() {
        return new ServerNotification(null, null, RECONNECT);
    }

    public boolean isReconnect() {
        return RECONNECT.equals(method);
    }
}
