package dev.muxrpc.client;

/**
 * The responder ended an operation that the caller never cancelled.
 */
public class SubscriptionEndedException extends RpcClientException {

    public SubscriptionEndedException(String message) {
        super(message);
    }
}
