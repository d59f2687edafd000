package dev.muxrpc.protocol;

/**
 * Asks the responder to stop the subscription started under {@code id}.
 */
public record StopMessage(RequestId id, String jsonrpc) implements ClientMessage {

    public static final String METHOD = "subscription.stop";

    public StopMessage(RequestId id) {
        this(id, null);
    }
}
