package dev.muxrpc.client;

import dev.muxrpc.protocol.RpcError;
import java.util.Optional;

/**
 * Failure reported to a caller. Carries the responder's error shape when the peer produced it.
 */
public class RpcClientException extends RuntimeException {

    private final transient RpcError shape;

    public RpcClientException(String message) {
        this(message, null, null);
    }

    public RpcClientException(String message, Throwable cause) {
        this(message, null, cause);
    }

    protected RpcClientException(String message, RpcError shape, Throwable cause) {
        super(message, cause);
        this.shape = shape;
    }

    public static RpcClientException fromShape(RpcError shape) {
        return new RpcClientException(shape.message(), shape, null);
    }

    public Optional<RpcError> shape() {
        return Optional.ofNullable(shape);
    }
}
