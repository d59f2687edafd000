package dev.muxrpc.server;

import com.fasterxml.jackson.databind.JsonNode;
import dev.muxrpc.protocol.OperationKind;
import dev.muxrpc.protocol.RpcException;

/**
 * Failure reported to an {@link ErrorObserver}.
 *
 * @param error the failure as sent to the caller
 * @param kind operation kind, {@code null} when the failure is not tied to an operation
 * @param path procedure path, or {@code null}
 * @param input raw input, or {@code null}
 * @param context connection context, or {@code null}
 * @param <C> context type
 */
public record ErrorEvent<C>(RpcException error, OperationKind kind, String path, JsonNode input, C context) {

    public String kindName() {
        return kind == null ? "unknown" : kind.wireName();
    }
}
