package dev.muxrpc.server;

import dev.muxrpc.protocol.ErrorCode;
import dev.muxrpc.protocol.OperationKind;
import dev.muxrpc.protocol.RpcException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link OperationRegistry} that maps procedure paths to handlers. Each path is bound to exactly
 * one operation kind.
 *
 * @param <C> context type
 */
public final class Router<C> implements OperationRegistry<C> {

    private final Map<String, Procedure<C>> procedures;

    private Router(Map<String, Procedure<C>> procedures) {
        this.procedures = Collections.unmodifiableMap(new LinkedHashMap<>(procedures));
    }

    public static <C> Builder<C> builder() {
        return new Builder<>();
    }

    @Override
    public Object invoke(OperationCall<C> call) {
        Procedure<C> procedure = procedures.get(call.path());
        if (procedure == null || procedure.kind() != call.kind()) {
            throw new RpcException(ErrorCode.NOT_FOUND,
                "No \"" + call.kind().wireName() + "\"-procedure on path \"" + call.path() + "\"");
        }
        return procedure.handler().handle(call);
    }

    public Set<String> paths() {
        return procedures.keySet();
    }

    private record Procedure<C>(OperationKind kind, ProcedureHandler<C> handler) {
    }

    public static final class Builder<C> {

        private final Map<String, Procedure<C>> procedures = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder<C> query(String path, ProcedureHandler<C> handler) {
            return register(path, OperationKind.QUERY, handler);
        }

        public Builder<C> mutation(String path, ProcedureHandler<C> handler) {
            return register(path, OperationKind.MUTATION, handler);
        }

        public Builder<C> subscription(String path, ProcedureHandler<C> handler) {
            return register(path, OperationKind.SUBSCRIPTION, handler);
        }

        private Builder<C> register(String path, OperationKind kind, ProcedureHandler<C> handler) {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(handler, "handler");
            if (procedures.putIfAbsent(path, new Procedure<>(kind, handler)) != null) {
                throw new IllegalStateException("Procedure path registered twice: " + path);
            }
            return this;
        }

        public Router<C> build() {
            return new Router<>(procedures);
        }
    }
}
