package dev.muxrpc.server.demo;

import java.time.Instant;

/**
 * Per-connection context of the demo procedures.
 * @param connectionId id of the transport the caller is connected through
 * @param connectedAt when the connection opened
 */
public record DemoContext(String connectionId, Instant connectedAt) {
}
