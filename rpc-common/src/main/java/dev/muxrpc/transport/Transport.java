package dev.muxrpc.transport;

import java.io.IOException;

/**
 * Ordered, message-oriented duplex channel. Each message is one UTF-8 text frame holding either a
 * single JSON envelope or a JSON array of envelopes.
 */
public interface Transport extends AutoCloseable {

    /**
     * Identifier used in logs, unique per connection.
     */
    String id();

    ReadyState readyState();

    /**
     * Sends one frame to the peer.
     *
     * @throws IOException when the transport is not open or the frame cannot be written
     */
    void send(String frame) throws IOException;

    void addListener(TransportListener listener);

    /**
     * Closes the channel. The {@code close} event is delivered once, no matter which side
     * initiated the shutdown. Closing a closed transport does nothing.
     */
    @Override
    void close();
}
