package dev.muxrpc.client;

/**
 * Receives the events of one subscription. {@link #onComplete()} follows a cancel issued by the
 * caller; a subscription the responder ends on its own is reported through {@link #onError}.
 *
 * @param <T> event type
 */
public interface SubscriptionListener<T> {

    default void onStarted() {
    }

    void onData(T data);

    default void onError(RpcClientException error) {
    }

    default void onComplete() {
    }
}
