package dev.muxrpc.transport;

/**
 * Receives lifecycle and message events from a {@link Transport}. Events for one transport are
 * delivered from a single thread, in the order they happened.
 */
public interface TransportListener {

    default void onOpen() {
    }

    default void onMessage(String data) {
    }

    default void onClose() {
    }

    default void onError(Throwable error) {
    }
}
