package dev.muxrpc.client;

/**
 * The channel closed while the request was still waiting for its answer.
 */
public class ChannelClosedException extends RpcClientException {

    public ChannelClosedException(String message) {
        super(message);
    }
}
