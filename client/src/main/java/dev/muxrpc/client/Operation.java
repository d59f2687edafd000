package dev.muxrpc.client;

import com.fasterxml.jackson.databind.JsonNode;
import dev.muxrpc.protocol.OperationKind;
import dev.muxrpc.protocol.RequestId;
import dev.muxrpc.protocol.RequestMessage;

/**
 * One invocation issued through a {@link ChannelClient}. The input is already in wire form.
 */
public record Operation(RequestId id, OperationKind kind, String path, JsonNode input) {

    RequestMessage toMessage() {
        return new RequestMessage(id, kind, path, input);
    }
}
