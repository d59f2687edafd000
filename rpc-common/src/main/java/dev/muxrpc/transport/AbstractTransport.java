package dev.muxrpc.transport;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Listener fan-out and ready-state bookkeeping shared by the concrete transports. Subclasses call
 * the {@code fire*} methods from their single event thread.
 */
public abstract class AbstractTransport implements Transport {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractTransport.class);

    private final String id;
    private final List<TransportListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<ReadyState> readyState = new AtomicReference<>(ReadyState.CONNECTING);

    protected AbstractTransport(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public ReadyState readyState() {
        return readyState.get();
    }

    @Override
    public void addListener(TransportListener listener) {
        listeners.add(listener);
    }

    protected void fireOpen() {
        if (!readyState.compareAndSet(ReadyState.CONNECTING, ReadyState.OPEN)) {
            return;
        }
        LOGGER.info("Transport {} open", id);
        notifyListeners(TransportListener::onOpen);
    }

    protected void fireMessage(String data) {
        notifyListeners(listener -> listener.onMessage(data));
    }

    protected void fireError(Throwable error) {
        notifyListeners(listener -> listener.onError(error));
    }

    /**
     * Moves the transport to {@link ReadyState#CLOSED} without notifying anyone yet.
     *
     * @return {@code true} if this call performed the transition
     */
    protected boolean markClosed() {
        return readyState.getAndSet(ReadyState.CLOSED) != ReadyState.CLOSED;
    }

    protected void notifyClose() {
        LOGGER.info("Transport {} closed", id);
        notifyListeners(TransportListener::onClose);
    }

    protected void fireClose() {
        if (markClosed()) {
            notifyClose();
        }
    }

    private void notifyListeners(Consumer<TransportListener> event) {
        for (TransportListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                LOGGER.warn("Listener failed on transport {}", id, e);
            }
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + ", " + readyState() + "]";
    }
}
