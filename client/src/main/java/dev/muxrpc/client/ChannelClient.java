package dev.muxrpc.client;

import com.fasterxml.jackson.databind.JsonNode;
import dev.muxrpc.protocol.ClientMessage;
import dev.muxrpc.protocol.EnvelopeCodec;
import dev.muxrpc.protocol.OperationKind;
import dev.muxrpc.protocol.RequestId;
import dev.muxrpc.protocol.ResponseMessage;
import dev.muxrpc.protocol.RpcException;
import dev.muxrpc.protocol.ServerMessage;
import dev.muxrpc.protocol.ServerNotification;
import dev.muxrpc.protocol.StopMessage;
import dev.muxrpc.transport.ReadyState;
import dev.muxrpc.transport.Transport;
import dev.muxrpc.transport.TransportListener;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

/**
 * Caller side of a channel. Multiplexes many in-flight operations over one transport, batches the
 * envelopes enqueued within one event-loop turn into a single frame and routes responses back to
 * their {@link ResponseObserver} by request id.
 *
 * <p>All state is confined to one serial executor. Public methods and transport callbacks only post
 * tasks to it, so observers are always invoked from that executor.
 */
public final class ChannelClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChannelClient.class);
    private static final AtomicInteger LOOP_COUNTER = new AtomicInteger();

    enum ConnectionState {
        CONNECTING,
        OPEN,
        CLOSED
    }

    private final EnvelopeCodec codec;
    private final Executor loop;
    private final ExecutorService ownedLoop;

    private final Map<RequestId, PendingRequest> pendingRequests = new LinkedHashMap<>();
    private List<ClientMessage> outgoing = new ArrayList<>();
    private boolean dispatchScheduled;
    private ConnectionState state = ConnectionState.CONNECTING;
    private volatile Transport activeConnection;
    // asked to reconnect; closes once nothing is pending on it
    private Transport drainingConnection;

    private ChannelClient(Builder builder) {
        this.codec = builder.codec != null ? builder.codec : new EnvelopeCodec();
        if (builder.executor != null) {
            this.loop = builder.executor;
            this.ownedLoop = null;
        } else {
            this.ownedLoop = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, "channel-client-" + LOOP_COUNTER.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
            this.loop = ownedLoop;
        }
        this.activeConnection = builder.transport;
    }

    public static Builder builder(Transport transport) {
        return new Builder(transport);
    }

    private void attach(Transport transport) {
        transport.addListener(new ConnectionListener(transport));
        if (transport.readyState() == ReadyState.OPEN) {
            post(() -> handleOpen(transport));
        }
    }

    /**
     * Registers the operation and queues its request envelope for the next flush.
     *
     * @return handle whose {@link Disposable#dispose()} cancels the operation; disposing twice is a
     *     no-op
     */
    public Disposable request(Operation operation, ResponseObserver callbacks) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(callbacks, "callbacks");
        post(() -> enqueue(operation, callbacks));
        return new CancelHandle(operation);
    }

    /**
     * Marks the client closed. The active transport closes once nothing is pending on it and the
     * outgoing queue has drained.
     */
    @Override
    public void close() {
        post(() -> {
            if (state != ConnectionState.CLOSED) {
                LOGGER.info("Closing channel client on {}", activeConnection.id());
            }
            state = ConnectionState.CLOSED;
            closeIfDrained();
            shutdownIfFinished();
        });
    }

    /**
     * Hands the client over to a replacement transport. New requests go out on the replacement;
     * requests still bound to the previous transport move over when their next response arrives on
     * the replacement. The previous transport closes once nothing is bound to it.
     */
    public void switchTransport(Transport replacement) {
        Objects.requireNonNull(replacement, "replacement");
        replacement.addListener(new ConnectionListener(replacement));
        post(() -> {
            Transport previous = activeConnection;
            if (previous == replacement) {
                return;
            }
            LOGGER.info("Switching channel client from {} to {}", previous.id(), replacement.id());
            activeConnection = replacement;
            if (state == ConnectionState.OPEN) {
                state = ConnectionState.CONNECTING;
            }
            if (replacement.readyState() == ReadyState.OPEN) {
                handleOpen(replacement);
            }
            closeIfNoPending(previous);
        });
    }

    public Transport getConnection() {
        return activeConnection;
    }

    /**
     * Snapshot of the ids currently awaiting responses.
     */
    public CompletableFuture<Set<RequestId>> pendingRequestIds() {
        CompletableFuture<Set<RequestId>> snapshot = new CompletableFuture<>();
        post(() -> snapshot.complete(new LinkedHashSet<>(pendingRequests.keySet())));
        return snapshot;
    }

    private void enqueue(Operation operation, ResponseObserver callbacks) {
        Transport connection = activeConnection;
        if (connection.readyState() == ReadyState.CLOSED) {
            callbacks.error(new ChannelClosedException("Channel closed prematurely"));
            return;
        }
        PendingRequest previous = pendingRequests.put(operation.id(), new PendingRequest(operation, callbacks, connection));
        if (previous != null) {
            LOGGER.warn("Request id {} reused while still pending, replacing the earlier request", operation.id());
        }
        LOGGER.debug("Queued {} {} as {}", operation.kind().wireName(), operation.path(), operation.id());
        outgoing.add(operation.toMessage());
        dispatch();
    }

    private void cancel(Operation operation) {
        RequestId id = operation.id();
        PendingRequest request = pendingRequests.get(id);
        boolean owned = request != null && request.operation == operation;
        if (owned) {
            pendingRequests.remove(id);
        }
        outgoing.removeIf(message -> id.equals(message.id()));
        if (owned) {
            LOGGER.debug("Cancelled {}", id);
            request.callbacks.complete();
        }
        if (activeConnection.readyState() == ReadyState.OPEN && operation.kind() == OperationKind.SUBSCRIPTION) {
            outgoing.add(new StopMessage(id));
            dispatch();
        }
        closeIfDrained();
    }

    private void dispatch() {
        if (state == ConnectionState.CONNECTING || dispatchScheduled) {
            return;
        }
        dispatchScheduled = true;
        post(this::flush);
    }

    private void flush() {
        dispatchScheduled = false;
        Transport connection = activeConnection;
        if (connection.readyState() != ReadyState.OPEN || outgoing.isEmpty()) {
            return;
        }
        List<ClientMessage> batch = outgoing;
        try {
            connection.send(codec.writeClientFrame(batch));
        } catch (IOException e) {
            LOGGER.warn("Failed to send {} envelope(s) on {}", batch.size(), connection.id(), e);
            return;
        }
        outgoing = new ArrayList<>();
        closeIfDrained();
    }

    private void handleOpen(Transport transport) {
        if (transport != activeConnection) {
            return;
        }
        if (state == ConnectionState.CLOSED) {
            if (outgoing.isEmpty()) {
                closeIfNoPending(transport);
            } else {
                dispatch();
            }
            return;
        }
        state = ConnectionState.OPEN;
        dispatch();
    }

    private void handleMessage(Transport transport, String frame) {
        List<JsonNode> envelopes;
        try {
            envelopes = codec.readFrame(frame);
        } catch (RpcException e) {
            LOGGER.warn("Dropping unreadable frame from {}: {}", transport.id(), e.getMessage());
            return;
        }
        for (JsonNode envelope : envelopes) {
            ServerMessage message;
            try {
                message = codec.parseServerMessage(envelope);
            } catch (RpcException e) {
                LOGGER.warn("Dropping malformed envelope from {}: {}", transport.id(), e.getMessage());
                continue;
            }
            if (message instanceof ServerNotification notification) {
                handleIncomingRequest(transport, notification);
            } else {
                handleIncomingResponse(transport, (ResponseMessage) message);
            }
        }
        if (transport == activeConnection) {
            closeIfDrained();
        } else {
            closeIfNoPending(transport);
        }
    }

    private void handleIncomingRequest(Transport transport, ServerNotification notification) {
        if (notification.isReconnect() && transport == activeConnection && state == ConnectionState.OPEN) {
            LOGGER.info("Responder on {} asked for a reconnect", transport.id());
            drainingConnection = transport;
            closeIfNoPending(transport);
            return;
        }
        LOGGER.debug("Ignoring {} notification from {}", notification.method(), transport.id());
    }

    private void handleIncomingResponse(Transport transport, ResponseMessage response) {
        if (response.id() == null) {
            LOGGER.warn("Responder on {} reported an error without a request id: {}", transport.id(), response.error());
            return;
        }
        PendingRequest request = pendingRequests.get(response.id());
        if (request == null) {
            LOGGER.debug("No pending request for response {} from {}", response.id(), transport.id());
            return;
        }
        request.callbacks.next(response);

        Transport connection = activeConnection;
        if (request.transport != connection && transport == connection) {
            Transport previous = request.transport;
            request.transport = connection;
            closeIfNoPending(previous);
        }
        if (response.isStopped() && transport == connection) {
            pendingRequests.remove(response.id(), request);
            request.callbacks.complete();
        }
    }

    private void handleClose(Transport transport) {
        List<PendingRequest> affected = new ArrayList<>();
        Iterator<PendingRequest> it = pendingRequests.values().iterator();
        while (it.hasNext()) {
            PendingRequest request = it.next();
            if (request.transport == transport) {
                it.remove();
                affected.add(request);
            }
        }
        for (PendingRequest request : affected) {
            if (state == ConnectionState.CLOSED) {
                request.callbacks.complete();
            } else {
                request.callbacks.error(new ChannelClosedException("Channel closed prematurely"));
            }
        }
        if (transport == drainingConnection) {
            drainingConnection = null;
        }
        if (transport == activeConnection) {
            shutdownIfFinished();
        }
    }

    private void closeIfDrained() {
        if (!outgoing.isEmpty()) {
            return;
        }
        if (state == ConnectionState.CLOSED) {
            closeIfNoPending(activeConnection);
        } else if (drainingConnection != null) {
            closeIfNoPending(drainingConnection);
        }
    }

    /**
     * Releases the owned loop once the client is closed and its transport is gone, in whichever order
     * those happened.
     */
    private void shutdownIfFinished() {
        if (ownedLoop != null && state == ConnectionState.CLOSED
            && activeConnection.readyState() == ReadyState.CLOSED) {
            LOGGER.debug("Channel client on {} shut down", activeConnection.id());
            ownedLoop.shutdown();
        }
    }

    private void closeIfNoPending(Transport transport) {
        for (PendingRequest request : pendingRequests.values()) {
            if (request.transport == transport) {
                return;
            }
        }
        transport.close();
    }

    private void post(Runnable task) {
        try {
            loop.execute(task);
        } catch (RejectedExecutionException e) {
            LOGGER.debug("Channel client loop already shut down, dropping task");
        }
    }

    private static final class PendingRequest {

        private final Operation operation;
        private final ResponseObserver callbacks;
        private Transport transport;

        private PendingRequest(Operation operation, ResponseObserver callbacks, Transport transport) {
            this.operation = operation;
            this.callbacks = callbacks;
            this.transport = transport;
        }
    }

    private final class CancelHandle implements Disposable {

        private final Operation operation;
        private final AtomicBoolean disposed = new AtomicBoolean();

        private CancelHandle(Operation operation) {
            this.operation = operation;
        }

        @Override
        public void dispose() {
            if (disposed.compareAndSet(false, true)) {
                post(() -> cancel(operation));
            }
        }

        @Override
        public boolean isDisposed() {
            return disposed.get();
        }
    }

    private final class ConnectionListener implements TransportListener {

        private final Transport transport;

        private ConnectionListener(Transport transport) {
            this.transport = transport;
        }

        @Override
        public void onOpen() {
            post(() -> handleOpen(transport));
        }

        @Override
        public void onMessage(String frame) {
            post(() -> handleMessage(transport, frame));
        }

        @Override
        public void onClose() {
            post(() -> handleClose(transport));
        }

        @Override
        public void onError(Throwable error) {
            LOGGER.warn("Transport {} reported an error", transport.id(), error);
        }
    }

    public static final class Builder {

        private final Transport transport;
        private EnvelopeCodec codec;
        private Executor executor;

        private Builder(Transport transport) {
            this.transport = Objects.requireNonNull(transport, "transport");
        }

        public Builder codec(EnvelopeCodec codec) {
            this.codec = codec;
            return this;
        }

        /**
         * Serial executor used as the client's event loop. An executor supplied here is never shut
         * down by the client.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        public ChannelClient build() {
            ChannelClient client = new ChannelClient(this);
            client.attach(transport);
            return client;
        }
    }
}
