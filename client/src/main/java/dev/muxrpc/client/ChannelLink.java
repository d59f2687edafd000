package dev.muxrpc.client;

import dev.muxrpc.protocol.DataTransformer;
import dev.muxrpc.protocol.JacksonTransformer;
import dev.muxrpc.protocol.OperationKind;
import dev.muxrpc.protocol.RequestId;
import dev.muxrpc.protocol.ResponseMessage;
import dev.muxrpc.protocol.ResponseResult;
import dev.muxrpc.protocol.RpcError;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Typed operations on top of a {@link ChannelClient}. Inputs and results pass through the
 * configured {@link DataTransformer}; error responses surface as {@link RpcClientException}s carrying
 * the responder's error shape.
 */
public final class ChannelLink {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChannelLink.class);

    private final ChannelClient client;
    private final DataTransformer transformer;
    private final AtomicLong requestIds = new AtomicLong();

    public ChannelLink(ChannelClient client) {
        this(client, new JacksonTransformer());
    }

    public ChannelLink(ChannelClient client, DataTransformer transformer) {
        this.client = Objects.requireNonNull(client, "client");
        this.transformer = Objects.requireNonNull(transformer, "transformer");
    }

    public <T> Mono<T> query(String path, Object input, Class<T> resultType) {
        return single(OperationKind.QUERY, path, input, resultType);
    }

    public <T> Mono<T> mutation(String path, Object input, Class<T> resultType) {
        return single(OperationKind.MUTATION, path, input, resultType);
    }

    /**
     * Cold stream of subscription events. Cancelling the stream sends {@code subscription.stop}; a
     * subscription the responder ends on its own terminates the stream with a
     * {@link SubscriptionEndedException}.
     */
    public <T> Flux<T> subscription(String path, Object input, Class<T> eventType) {
        return Flux.create(sink -> {
            Disposable handle = subscribe(path, input, eventType, new SubscriptionListener<T>() {
                @Override
                public void onData(T data) {
                    if (data == null) {
                        LOGGER.debug("Skipping empty event on {}", path);
                        return;
                    }
                    sink.next(data);
                }

                @Override
                public void onError(RpcClientException error) {
                    sink.error(error);
                }

                @Override
                public void onComplete() {
                    sink.complete();
                }
            });
            sink.onDispose(handle);
        });
    }

    /**
     * Starts a subscription and reports its events to the listener.
     *
     * @return handle that cancels the subscription
     */
    public <T> Disposable subscribe(String path, Object input, Class<T> eventType, SubscriptionListener<T> listener) {
        return execute(OperationKind.SUBSCRIPTION, path, input, eventType, listener);
    }

    public ChannelClient client() {
        return client;
    }

    private <T> Mono<T> single(OperationKind kind, String path, Object input, Class<T> resultType) {
        return Mono.create(sink -> {
            Disposable handle = execute(kind, path, input, resultType, new SubscriptionListener<T>() {
                @Override
                public void onData(T data) {
                    sink.success(data);
                }

                @Override
                public void onError(RpcClientException error) {
                    sink.error(error);
                }

                @Override
                public void onComplete() {
                    sink.success();
                }
            });
            sink.onDispose(handle);
        });
    }

    private <T> Disposable execute(OperationKind kind, String path, Object input, Class<T> type, SubscriptionListener<T> listener) {
        Operation operation = new Operation(RequestId.of(requestIds.incrementAndGet()), kind, path, transformer.serialize(input));
        OperationObserver<T> observer = new OperationObserver<>(operation, type, listener);
        observer.bind(client.request(operation, observer));
        return observer;
    }

    private final class OperationObserver<T> implements ResponseObserver, Disposable {

        private final Operation operation;
        private final Class<T> type;
        private final SubscriptionListener<T> listener;
        private final Disposable.Swap request = Disposables.swap();
        private final AtomicBoolean done = new AtomicBoolean();
        private final AtomicBoolean terminated = new AtomicBoolean();

        private OperationObserver(Operation operation, Class<T> type, SubscriptionListener<T> listener) {
            this.operation = operation;
            this.type = type;
            this.listener = listener;
        }

        private void bind(Disposable handle) {
            request.update(handle);
        }

        @Override
        public void next(ResponseMessage message) {
            if (terminated.get()) {
                return;
            }
            if (message.isError()) {
                fail(decodeError(message));
                return;
            }
            ResponseResult result = message.result();
            switch (result.type()) {
                case STARTED -> listener.onStarted();
                case STOPPED -> LOGGER.debug("Responder stopped {} on {}", operation.id(), operation.path());
                case DATA -> deliver(result);
            }
        }

        private void deliver(ResponseResult result) {
            T data;
            try {
                data = transformer.deserialize(result.data(), type);
            } catch (IllegalArgumentException e) {
                fail(new RpcClientException("Unable to read result of " + operation.path(), e));
                return;
            }
            listener.onData(data);
            if (operation.kind() != OperationKind.SUBSCRIPTION) {
                done.set(true);
                terminate(listener::onComplete);
                request.dispose();
            }
        }

        @Override
        public void error(RpcClientException error) {
            fail(error);
        }

        @Override
        public void complete() {
            if (done.compareAndSet(false, true)) {
                terminate(() -> listener.onError(new SubscriptionEndedException("Operation ended prematurely")));
            } else {
                terminate(listener::onComplete);
            }
        }

        @Override
        public void dispose() {
            done.set(true);
            // a terminated operation already released its request
            if (!terminated.get()) {
                request.dispose();
            }
        }

        @Override
        public boolean isDisposed() {
            return request.isDisposed();
        }

        private void fail(RpcClientException error) {
            done.set(true);
            terminate(() -> listener.onError(error));
            request.dispose();
        }

        private void terminate(Runnable signal) {
            if (terminated.compareAndSet(false, true)) {
                signal.run();
            }
        }

        private RpcClientException decodeError(ResponseMessage message) {
            try {
                RpcError shape = transformer.deserialize(message.error(), RpcError.class);
                if (shape == null || shape.message() == null) {
                    return new RpcClientException("Responder failed " + operation.path() + " without an error message");
                }
                return RpcClientException.fromShape(shape);
            } catch (IllegalArgumentException e) {
                return new RpcClientException("Unreadable error response for " + operation.path(), e);
            }
        }
    }
}
