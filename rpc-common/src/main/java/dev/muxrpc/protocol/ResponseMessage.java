package dev.muxrpc.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Response to a request: either a {@link ResponseResult} or an already serialized error shape.
 * The id is {@code null} for failures that cannot be attributed to a request.
 */
public record ResponseMessage(RequestId id, String jsonrpc, ResponseResult result, JsonNode error)
    implements ServerMessage {

    public static ResponseMessage data(RequestId id, String jsonrpc, JsonNode data) {
        return new ResponseMessage(id, jsonrpc, ResponseResult.data(data), null);
    }

    public static ResponseMessage started(RequestId id, String jsonrpc) {
        return new ResponseMessage(id, jsonrpc, ResponseResult.started(), null);
    }

    public static ResponseMessage stopped(RequestId id, String jsonrpc) {
        return new ResponseMessage(id, jsonrpc, ResponseResult.stopped(), null);
    }

    public static ResponseMessage error(RequestId id, String jsonrpc, JsonNode error) {
        return new ResponseMessage(id, jsonrpc, null, error);
    }

    public boolean isError() {
        return error != null;
    }

    public boolean isStopped() {
        return result != null && result.type() == ResultType.STOPPED;
    }
}
