package dev.muxrpc.server;

/**
 * Body of one {@link Router} procedure.
 *
 * @param <C> context type
 */
@FunctionalInterface
public interface ProcedureHandler<C> {

    Object handle(OperationCall<C> call);
}
