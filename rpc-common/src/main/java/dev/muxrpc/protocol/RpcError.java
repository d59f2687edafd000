package dev.muxrpc.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Wire shape of an error response: {@code {message, code, data: {code, httpStatus, path}}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RpcError(String message, int code, Data data) {

    public static RpcError from(RpcException error, String path) {
        ErrorCode errorCode = error.code();
        return new RpcError(error.getMessage(), errorCode.jsonRpcCode(),
            new Data(errorCode.name(), errorCode.httpStatus(), path));
    }

    /**
     * Resolves the symbolic code, falling back to the numeric one when {@code data} is absent.
     */
    public ErrorCode errorCode() {
        if (data != null && data.code() != null) {
            try {
                return ErrorCode.valueOf(data.code());
            } catch (IllegalArgumentException e) {
                return ErrorCode.fromJsonRpcCode(code);
            }
        }
        return ErrorCode.fromJsonRpcCode(code);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Data(String code, Integer httpStatus, String path) {
    }
}
