package dev.muxrpc.server;

/**
 * Resolves and runs operations for a {@link ResponderEngine}.
 *
 * @param <C> context type
 */
@FunctionalInterface
public interface OperationRegistry<C> {

    /**
     * Runs the operation named by {@code call}. Called on the engine's event loop.
     *
     * @return for queries and mutations a plain value or a {@code Mono}; for subscriptions a
     *     {@code org.reactivestreams.Publisher} of events
     * @throws RuntimeException reported to the caller as an error response; use
     *     {@link dev.muxrpc.protocol.RpcException} to pick the error code
     */
    Object invoke(OperationCall<C> call);
}
