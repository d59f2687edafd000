package dev.muxrpc.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Invocation of the operation at {@code path}. A missing input is carried as {@link MissingNode}.
 */
public record RequestMessage(RequestId id, String jsonrpc, OperationKind method, String path, JsonNode input)
    implements ClientMessage {

    public RequestMessage {
        input = input == null ? MissingNode.getInstance() : input;
    }

    public RequestMessage(RequestId id, OperationKind method, String path, JsonNode input) {
        this(id, null, method, path, input);
    }
}
