package dev.muxrpc.protocol;

/**
 * Error codes with their JSON-RPC integer and the closest HTTP status.
 */
public enum ErrorCode {
    PARSE_ERROR(-32700, 400),
    BAD_REQUEST(-32600, 400),
    INTERNAL_SERVER_ERROR(-32603, 500),
    UNAUTHORIZED(-32001, 401),
    FORBIDDEN(-32003, 403),
    NOT_FOUND(-32004, 404),
    METHOD_NOT_SUPPORTED(-32005, 405),
    TIMEOUT(-32008, 408),
    CONFLICT(-32009, 409),
    PRECONDITION_FAILED(-32012, 412),
    PAYLOAD_TOO_LARGE(-32013, 413),
    TOO_MANY_REQUESTS(-32029, 429),
    CLIENT_CLOSED_REQUEST(-32099, 499);

    private final int jsonRpcCode;
    private final int httpStatus;

    ErrorCode(int jsonRpcCode, int httpStatus) {
        this.jsonRpcCode = jsonRpcCode;
        this.httpStatus = httpStatus;
    }

    public int jsonRpcCode() {
        return jsonRpcCode;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public static ErrorCode fromJsonRpcCode(int code) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.jsonRpcCode == code) {
                return errorCode;
            }
        }
        return INTERNAL_SERVER_ERROR;
    }
}
