package dev.muxrpc.transport;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process transport. {@link #pair()} creates two connected ends; a frame sent on one end is
 * delivered as a message on the other. Each end runs its events on its own thread, like a real
 * network channel would.
 */
public final class LoopbackTransport extends AbstractTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoopbackTransport.class);

    private static final AtomicInteger PAIR_COUNTER = new AtomicInteger();

    private final ExecutorService events;
    private LoopbackTransport peer;
    private boolean closeDelivered;

    private LoopbackTransport(String id) {
        super(id);
        this.events = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "loopback-" + id);
            thread.setDaemon(true);
            return thread;
        });
    }

    public static Pair pair() {
        int pairId = PAIR_COUNTER.incrementAndGet();
        LoopbackTransport left = new LoopbackTransport("loop-" + pairId + "a");
        LoopbackTransport right = new LoopbackTransport("loop-" + pairId + "b");
        left.peer = right;
        right.peer = left;
        return new Pair(left, right);
    }

    private void open() {
        post(this::fireOpen);
    }

    @Override
    public void send(String frame) throws IOException {
        if (readyState() != ReadyState.OPEN) {
            throw new IOException("Transport " + id() + " is " + readyState());
        }
        Wire.tx(id(), frame);
        peer.post(() -> {
            // frames sent before a close still arrive ahead of it
            if (!peer.closeDelivered) {
                peer.fireOpen();
                Wire.rx(peer.id(), frame);
                peer.fireMessage(frame);
            }
        });
    }

    /**
     * Simulates a channel failure on this end. Does not close anything by itself.
     */
    public void raiseError(Throwable error) {
        post(() -> fireError(error));
    }

    @Override
    public void close() {
        shutdown();
        peer.shutdown();
    }

    private void shutdown() {
        if (markClosed()) {
            post(() -> {
                closeDelivered = true;
                notifyClose();
                events.shutdown();
            });
        }
    }

    private void post(Runnable task) {
        try {
            events.execute(task);
        } catch (RejectedExecutionException e) {
            LOGGER.debug("Dropping event for closed transport {}", id());
        }
    }

    /**
     * Two connected loopback ends.
     */
    public record Pair(LoopbackTransport left, LoopbackTransport right) {

        /**
         * Opens both ends. Listeners registered before this call observe the {@code open} event.
         */
        public Pair open() {
            left.open();
            right.open();
            return this;
        }
    }
}
