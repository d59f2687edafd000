package dev.muxrpc.client;

import dev.muxrpc.protocol.ResponseMessage;

/**
 * Callbacks of a pending request. Invoked on the owning client's event loop.
 */
public interface ResponseObserver {

    /**
     * Every response routed to the request, including {@code started}, {@code stopped} and error
     * responses.
     */
    void next(ResponseMessage message);

    /**
     * The request failed locally, for instance because its channel closed.
     */
    void error(RpcClientException error);

    /**
     * The request ended: it was cancelled, the peer stopped it, or the client shut down.
     */
    void complete();
}
