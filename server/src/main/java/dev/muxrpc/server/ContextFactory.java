package dev.muxrpc.server;

import dev.muxrpc.transport.Transport;
import reactor.core.publisher.Mono;

/**
 * Creates the context shared by every operation on one connection. Invoked once, when the
 * connection opens. An empty result means no context; an error closes the connection.
 *
 * @param <C> context type
 */
@FunctionalInterface
public interface ContextFactory<C> {

    Mono<C> createContext(Transport transport);
}
