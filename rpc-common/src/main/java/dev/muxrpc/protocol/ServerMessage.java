package dev.muxrpc.protocol;

/**
 * Envelope sent by the responder: a response to a request, or an unsolicited notice.
 */
public interface ServerMessage {

    RequestId id();

    String jsonrpc();
}
