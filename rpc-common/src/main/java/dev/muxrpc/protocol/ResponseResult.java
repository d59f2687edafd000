package dev.muxrpc.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * The {@code result} member of a successful response. Only {@link ResultType#DATA} carries data.
 */
public record ResponseResult(ResultType type, JsonNode data) {

    private static final ResponseResult STARTED = new ResponseResult(ResultType.STARTED, MissingNode.getInstance());
    private static final ResponseResult STOPPED = new ResponseResult(ResultType.STOPPED, MissingNode.getInstance());

    public ResponseResult {
        data = data == null ? MissingNode.getInstance() : data;
    }

    public static ResponseResult data(JsonNode data) {
        return new ResponseResult(ResultType.DATA, data);
    }

    public static ResponseResult started() {
        return STARTED;
    }

    public static ResponseResult stopped() {
        return STOPPED;
    }
}
