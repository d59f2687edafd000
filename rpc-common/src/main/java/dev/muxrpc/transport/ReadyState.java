package dev.muxrpc.transport;

/**
 * Lifecycle of a {@link Transport}. A transport only moves forward: connecting, open, closed.
 */
public enum ReadyState {
    CONNECTING,
    OPEN,
    CLOSED
}
