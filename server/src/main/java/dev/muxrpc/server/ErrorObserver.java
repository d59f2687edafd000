package dev.muxrpc.server;

/**
 * Side-effect hook for failures seen by a {@link ResponderEngine}: failed operations, context
 * creation failures and transport errors.
 *
 * @param <C> context type
 */
@FunctionalInterface
public interface ErrorObserver<C> {

    void onError(ErrorEvent<C> event);
}
