package dev.muxrpc.server;

import com.fasterxml.jackson.databind.JsonNode;
import dev.muxrpc.protocol.ClientMessage;
import dev.muxrpc.protocol.DataTransformer;
import dev.muxrpc.protocol.EnvelopeCodec;
import dev.muxrpc.protocol.ErrorCode;
import dev.muxrpc.protocol.JacksonTransformer;
import dev.muxrpc.protocol.OperationKind;
import dev.muxrpc.protocol.RequestId;
import dev.muxrpc.protocol.RequestMessage;
import dev.muxrpc.protocol.ResponseMessage;
import dev.muxrpc.protocol.RpcError;
import dev.muxrpc.protocol.RpcException;
import dev.muxrpc.protocol.ServerMessage;
import dev.muxrpc.protocol.ServerNotification;
import dev.muxrpc.protocol.StopMessage;
import dev.muxrpc.transport.ReadyState;
import dev.muxrpc.transport.Transport;
import dev.muxrpc.transport.TransportListener;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.BaseSubscriber;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Responder side of one connection. Validates incoming envelopes, runs operations through the
 * {@link OperationRegistry}, streams subscription events back and keeps the registry of live
 * subscriptions for the connection.
 *
 * <p>An engine is bound to one transport for its whole life. Its state is confined to one serial
 * executor; transport callbacks and Reactor signals are posted to it.
 *
 * @param <C> context type
 */
public final class ResponderEngine<C> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResponderEngine.class);
    private static final AtomicInteger LOOP_COUNTER = new AtomicInteger();

    private final Transport transport;
    private final OperationRegistry<C> registry;
    private final ContextFactory<C> contextFactory;
    private final ErrorObserver<C> errorObserver;
    private final DataTransformer transformer;
    private final EnvelopeCodec codec;
    private final Executor loop;
    private final ExecutorService ownedLoop;

    private final Map<RequestId, ActiveSubscription> subscriptions = new HashMap<>();
    private final List<String> heldFrames = new ArrayList<>();
    private boolean opened;
    private boolean contextReady;
    private boolean closed;
    private C context;

    private ResponderEngine(Builder<C> builder) {
        this.transport = builder.transport;
        this.registry = builder.registry;
        this.contextFactory = builder.contextFactory;
        this.errorObserver = builder.errorObserver;
        this.transformer = builder.transformer != null ? builder.transformer : new JacksonTransformer();
        this.codec = builder.codec != null ? builder.codec : new EnvelopeCodec();
        if (builder.executor != null) {
            this.loop = builder.executor;
            this.ownedLoop = null;
        } else {
            this.ownedLoop = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, "responder-" + LOOP_COUNTER.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
            this.loop = ownedLoop;
        }
    }

    public static <C> Builder<C> builder(Transport transport, OperationRegistry<C> registry) {
        return new Builder<>(transport, registry);
    }

    private void attach() {
        transport.addListener(new EngineListener());
        if (transport.readyState() == ReadyState.OPEN) {
            post(this::handleOpen);
        }
    }

    public Transport transport() {
        return transport;
    }

    /**
     * Asks the caller to drop this connection once it has nothing pending on it.
     *
     * @return completes once the notice was handed to the transport, or skipped because it closed
     */
    public CompletableFuture<Void> sendReconnectNotification() {
        CompletableFuture<Void> sent = new CompletableFuture<>();
        post(() -> {
            respond(ServerNotification.reconnect());
            sent.complete(null);
        });
        return sent;
    }

    /**
     * Snapshot of the ids of the live subscriptions on this connection.
     */
    public CompletableFuture<Set<RequestId>> activeSubscriptions() {
        CompletableFuture<Set<RequestId>> snapshot = new CompletableFuture<>();
        post(() -> snapshot.complete(new LinkedHashSet<>(subscriptions.keySet())));
        return snapshot;
    }

    private void handleOpen() {
        if (opened || closed) {
            return;
        }
        opened = true;
        if (contextFactory == null) {
            onContext(null);
            return;
        }
        Mono<C> pending;
        try {
            pending = Objects.requireNonNull(contextFactory.createContext(transport), "createContext returned null");
        } catch (RuntimeException e) {
            onContextFailure(e);
            return;
        }
        pending.map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .subscribe(
                value -> post(() -> onContext(value.orElse(null))),
                error -> post(() -> onContextFailure(error)));
    }

    private void onContext(C value) {
        if (closed || contextReady) {
            return;
        }
        context = value;
        contextReady = true;
        LOGGER.debug("Context ready on {}", transport.id());
        List<String> frames = new ArrayList<>(heldFrames);
        heldFrames.clear();
        for (String frame : frames) {
            processFrame(frame);
        }
    }

    private void onContextFailure(Throwable cause) {
        if (closed) {
            return;
        }
        RpcException error = RpcException.from(cause);
        LOGGER.warn("Context creation failed on {}, closing: {}", transport.id(), error.getMessage());
        heldFrames.clear();
        report(new ErrorEvent<>(error, null, null, null, null));
        respond(ResponseMessage.error(null, EnvelopeCodec.JSONRPC_VERSION, errorShape(error, null)));
        post(transport::close);
    }

    private void handleMessage(String frame) {
        if (closed) {
            return;
        }
        if (!contextReady) {
            heldFrames.add(frame);
            return;
        }
        processFrame(frame);
    }

    private void processFrame(String frame) {
        List<JsonNode> envelopes;
        try {
            envelopes = codec.readFrame(frame);
        } catch (RpcException e) {
            rejectEnvelope(e);
            return;
        }
        for (JsonNode envelope : envelopes) {
            ClientMessage message;
            try {
                message = codec.parseClientMessage(envelope);
            } catch (RpcException e) {
                rejectEnvelope(e);
                continue;
            }
            handleRequest(message);
        }
    }

    private void handleRequest(ClientMessage message) {
        RequestId id = message.id();
        if (id == null) {
            RpcException error = new RpcException(ErrorCode.BAD_REQUEST, "`id` is required");
            respond(ResponseMessage.error(null, message.jsonrpc(), errorShape(error, null)));
            return;
        }
        if (message instanceof StopMessage) {
            ActiveSubscription subscription = subscriptions.remove(id);
            if (subscription != null) {
                LOGGER.debug("Caller stopped subscription {} on {}", id, transport.id());
                stopSubscription(subscription);
            }
            return;
        }
        RequestMessage request = (RequestMessage) message;
        LOGGER.debug("{} {} as {} on {}", request.method().wireName(), request.path(), id, transport.id());
        Object result;
        try {
            result = registry.invoke(new OperationCall<>(request.path(), request.method(), request.input(), context, transformer));
        } catch (RuntimeException e) {
            onFailure(request, e);
            return;
        }
        if (request.method() == OperationKind.SUBSCRIPTION) {
            startSubscription(request, result);
        } else {
            resolve(request, result);
        }
    }

    private void resolve(RequestMessage request, Object result) {
        if (!(result instanceof Publisher<?> publisher)) {
            respondData(request, result);
            return;
        }
        Mono.<Object>from(publisher)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .subscribe(
                value -> post(() -> respondData(request, value.orElse(null))),
                error -> post(() -> onFailure(request, error)));
    }

    private void startSubscription(RequestMessage request, Object result) {
        if (!(result instanceof Publisher<?> publisher)) {
            onFailure(request, RpcException.internalError("Subscription " + request.path() + " did not return a stream"));
            return;
        }
        ActiveSubscription subscription = new ActiveSubscription(request);
        Flux.<Object>from(publisher).subscribe(subscription);

        if (transport.readyState() != ReadyState.OPEN) {
            // caller went away while the stream was being set up
            subscription.stop();
            return;
        }
        if (subscriptions.containsKey(request.id())) {
            stopSubscription(subscription);
            onFailure(request, RpcException.badRequest("Duplicate id " + request.id()));
            return;
        }
        subscriptions.put(request.id(), subscription);
        respond(ResponseMessage.started(request.id(), request.jsonrpc()));
    }

    private void stopSubscription(ActiveSubscription subscription) {
        subscription.stop();
        respond(ResponseMessage.stopped(subscription.request.id(), subscription.request.jsonrpc()));
    }

    private void respondData(RequestMessage request, Object value) {
        JsonNode data;
        try {
            data = transformer.serialize(value);
        } catch (IllegalArgumentException e) {
            onFailure(request, new RpcException(ErrorCode.INTERNAL_SERVER_ERROR, "Unable to serialize result of " + request.path(), e));
            return;
        }
        respond(ResponseMessage.data(request.id(), request.jsonrpc(), data));
    }

    private void onFailure(RequestMessage request, Throwable cause) {
        RpcException error = RpcException.from(cause);
        report(new ErrorEvent<>(error, request.method(), request.path(), request.input(), context));
        respond(ResponseMessage.error(request.id(), request.jsonrpc(), errorShape(error, request.path())));
    }

    private void rejectEnvelope(RpcException cause) {
        LOGGER.warn("Rejected envelope on {}: {}", transport.id(), cause.getMessage());
        RpcException error = cause.code() == ErrorCode.PARSE_ERROR ? cause : RpcException.parseError(cause);
        respond(ResponseMessage.error(null, EnvelopeCodec.JSONRPC_VERSION, errorShape(error, null)));
    }

    private JsonNode errorShape(RpcException error, String path) {
        return transformer.serialize(RpcError.from(error, path));
    }

    private void respond(ServerMessage message) {
        if (transport.readyState() != ReadyState.OPEN) {
            LOGGER.debug("Transport {} is {}, dropping response {}", transport.id(), transport.readyState(), message.id());
            return;
        }
        try {
            transport.send(codec.writeServerMessage(message));
        } catch (IOException e) {
            LOGGER.warn("Failed to respond on {}", transport.id(), e);
        }
    }

    private void report(ErrorEvent<C> event) {
        if (errorObserver == null) {
            return;
        }
        try {
            errorObserver.onError(event);
        } catch (RuntimeException e) {
            LOGGER.warn("Error observer failed on {}", transport.id(), e);
        }
    }

    private void handleClose() {
        if (closed) {
            return;
        }
        closed = true;
        for (ActiveSubscription subscription : subscriptions.values()) {
            subscription.stop();
        }
        LOGGER.debug("Connection {} closed, released {} subscription(s)", transport.id(), subscriptions.size());
        subscriptions.clear();
        heldFrames.clear();
        if (ownedLoop != null) {
            ownedLoop.shutdown();
        }
    }

    private void handleError(Throwable cause) {
        LOGGER.warn("Transport error on {}", transport.id(), cause);
        RpcException error = new RpcException(ErrorCode.INTERNAL_SERVER_ERROR, "Underlying transport error", cause);
        report(new ErrorEvent<>(error, null, null, null, context));
    }

    private void post(Runnable task) {
        try {
            loop.execute(task);
        } catch (RejectedExecutionException e) {
            LOGGER.debug("Responder loop for {} already shut down, dropping task", transport.id());
        }
    }

    /**
     * Live subscription. Signals arrive on Reactor threads and are re-posted to the loop; once
     * {@link #stop()} ran, late signals are dropped.
     */
    private final class ActiveSubscription extends BaseSubscriber<Object> {

        private final RequestMessage request;
        private boolean stopped;

        private ActiveSubscription(RequestMessage request) {
            this.request = request;
        }

        @Override
        protected void hookOnNext(Object value) {
            post(() -> {
                if (!stopped) {
                    respondData(request, value);
                }
            });
        }

        @Override
        protected void hookOnError(Throwable throwable) {
            post(() -> {
                if (finish()) {
                    onFailure(request, throwable);
                }
            });
        }

        @Override
        protected void hookOnComplete() {
            post(() -> {
                if (finish()) {
                    respond(ResponseMessage.stopped(request.id(), request.jsonrpc()));
                }
            });
        }

        private boolean finish() {
            if (stopped) {
                return false;
            }
            stopped = true;
            subscriptions.remove(request.id(), this);
            return true;
        }

        private void stop() {
            stopped = true;
            dispose();
        }
    }

    private final class EngineListener implements TransportListener {

        @Override
        public void onOpen() {
            post(ResponderEngine.this::handleOpen);
        }

        @Override
        public void onMessage(String frame) {
            post(() -> handleMessage(frame));
        }

        @Override
        public void onClose() {
            post(ResponderEngine.this::handleClose);
        }

        @Override
        public void onError(Throwable error) {
            post(() -> handleError(error));
        }
    }

    public static final class Builder<C> {

        private final Transport transport;
        private final OperationRegistry<C> registry;
        private ContextFactory<C> contextFactory;
        private ErrorObserver<C> errorObserver;
        private DataTransformer transformer;
        private EnvelopeCodec codec;
        private Executor executor;

        private Builder(Transport transport, OperationRegistry<C> registry) {
            this.transport = Objects.requireNonNull(transport, "transport");
            this.registry = Objects.requireNonNull(registry, "registry");
        }

        public Builder<C> contextFactory(ContextFactory<C> contextFactory) {
            this.contextFactory = contextFactory;
            return this;
        }

        public Builder<C> errorObserver(ErrorObserver<C> errorObserver) {
            this.errorObserver = errorObserver;
            return this;
        }

        public Builder<C> transformer(DataTransformer transformer) {
            this.transformer = transformer;
            return this;
        }

        public Builder<C> codec(EnvelopeCodec codec) {
            this.codec = codec;
            return this;
        }

        /**
         * Serial executor used as the engine's event loop. Never shut down by the engine.
         */
        public Builder<C> executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public ResponderEngine<C> build() {
            ResponderEngine<C> engine = new ResponderEngine<>(this);
            engine.attach();
            return engine;
        }
    }
}
