package dev.muxrpc.server;

import com.fasterxml.jackson.databind.JsonNode;
import dev.muxrpc.protocol.DataTransformer;
import dev.muxrpc.protocol.ErrorCode;
import dev.muxrpc.protocol.OperationKind;
import dev.muxrpc.protocol.RpcException;

/**
 * One operation invocation handed to an {@link OperationRegistry}.
 *
 * @param path procedure path
 * @param kind operation kind named by the request
 * @param input raw input; a {@code MissingNode} when the request carried none
 * @param context per-connection context, {@code null} when no context factory is configured
 * @param transformer transformer used to bind the input
 * @param <C> context type
 */
public record OperationCall<C>(String path, OperationKind kind, JsonNode input, C context, DataTransformer transformer) {

    /**
     * Binds the input to {@code type}.
     *
     * @throws RpcException with {@link ErrorCode#BAD_REQUEST} when the input does not fit
     */
    public <T> T inputAs(Class<T> type) {
        try {
            return transformer.deserialize(input, type);
        } catch (IllegalArgumentException e) {
            throw new RpcException(ErrorCode.BAD_REQUEST, "Invalid input for \"" + path + "\"", e);
        }
    }

    /**
     * Like {@link #inputAs(Class)} but rejects a missing input.
     */
    public <T> T requireInput(Class<T> type) {
        T value = inputAs(type);
        if (value == null) {
            throw new RpcException(ErrorCode.BAD_REQUEST, "Input is required for \"" + path + "\"");
        }
        return value;
    }
}
