package dev.muxrpc.protocol;

/**
 * Envelope sent by the caller: a new invocation or a request to stop a subscription.
 */
public interface ClientMessage {

    /**
     * @return the correlation id; {@code null} only for malformed input seen by a responder
     */
    RequestId id();

    /**
     * @return {@code "2.0"} or {@code null} when the peer omitted the field
     */
    String jsonrpc();
}
