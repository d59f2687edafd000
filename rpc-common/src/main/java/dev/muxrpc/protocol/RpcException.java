package dev.muxrpc.protocol;

/**
 * Failure with a protocol {@link ErrorCode}. Thrown by operations to choose the code their caller
 * sees; anything else an operation throws is reported as {@link ErrorCode#INTERNAL_SERVER_ERROR}.
 */
public class RpcException extends RuntimeException {

    private final ErrorCode code;

    public RpcException(ErrorCode code, String message) {
        this(code, message, null);
    }

    public RpcException(ErrorCode code, String message, Throwable cause) {
        super(message != null ? message : code.name(), cause);
        this.code = code;
    }

    public static RpcException parseError(Throwable cause) {
        return new RpcException(ErrorCode.PARSE_ERROR, cause.getMessage(), cause);
    }

    public static RpcException badRequest(String message) {
        return new RpcException(ErrorCode.BAD_REQUEST, message);
    }

    public static RpcException internalError(String message) {
        return new RpcException(ErrorCode.INTERNAL_SERVER_ERROR, message);
    }

    /**
     * Returns {@code cause} itself when it already is an {@code RpcException}, otherwise wraps it
     * as an internal error.
     */
    public static RpcException from(Throwable cause) {
        if (cause instanceof RpcException rpcException) {
            return rpcException;
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new RpcException(ErrorCode.INTERNAL_SERVER_ERROR, message, cause);
    }

    public ErrorCode code() {
        return code;
    }
}
