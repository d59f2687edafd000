package dev.muxrpc.server.transport;

import dev.muxrpc.server.ResponderEngine;
import dev.muxrpc.server.ResponderFactory;
import dev.muxrpc.transport.LengthPrefixedCodec;
import dev.muxrpc.transport.SocketTransport;
import dev.muxrpc.transport.TransportListener;
import java.io.Closeable;
import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts TCP connections and binds a fresh {@link ResponderEngine} to each of them.
 */
public class TcpServer implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TcpServer.class);

    private static final Duration RECONNECT_NOTICE_TIMEOUT = Duration.ofSeconds(1);

    private final ResponderFactory<?> responders;
    private final int port;
    private final int maxFrameLength;
    private final Map<SocketTransport, ResponderEngine<?>> connections = new ConcurrentHashMap<>();

    private ServerSocket serverSocket;
    private Thread acceptThread;
    private volatile boolean running;

    public TcpServer(ResponderFactory<?> responders, int port) {
        this(responders, port, LengthPrefixedCodec.DEFAULT_MAX_FRAME_LENGTH);
    }

    public TcpServer(ResponderFactory<?> responders, int port, int maxFrameLength) {
        this.responders = responders;
        this.port = port;
        this.maxFrameLength = maxFrameLength;
    }

    public synchronized void start() throws IOException {
        if (running) {
            return;
        }
        serverSocket = new ServerSocket(port);
        running = true;
        acceptThread = new Thread(this::acceptLoop, "tcp-server-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        LOGGER.info("TCP server listening on port {}", serverSocket.getLocalPort());
    }

    /**
     * Port the server is bound to; differs from the configured one when that was {@code 0}.
     */
    public int localPort() {
        ServerSocket socket = serverSocket;
        if (socket == null) {
            throw new IllegalStateException("TCP server not started");
        }
        return socket.getLocalPort();
    }

    public int connectionCount() {
        return connections.size();
    }

    private void acceptLoop() {
        while (running) {
            try {
                Socket socket = serverSocket.accept();
                socket.setTcpNoDelay(true);
                accept(new SocketTransport(socket, maxFrameLength));
            } catch (IOException e) {
                if (running) {
                    LOGGER.error("Error accepting connection", e);
                }
            }
        }
    }

    private void accept(SocketTransport transport) throws IOException {
        LOGGER.info("Accepted connection {}", transport.id());
        ResponderEngine<?> engine = responders.attach(transport);
        connections.put(transport, engine);
        transport.addListener(new TransportListener() {
            @Override
            public void onClose() {
                connections.remove(transport);
            }
        });
        try {
            transport.start();
        } catch (IOException e) {
            transport.close();
            throw e;
        }
    }

    /**
     * Stops accepting, asks every connected caller to reconnect, then closes the connections.
     */
    public void stop() {
        running = false;
        if (serverSocket != null) {
            try {
                serverSocket.close();
            } catch (IOException e) {
                LOGGER.warn("Error closing server socket", e);
            }
        }
        if (acceptThread != null) {
            try {
                acceptThread.join(Duration.ofSeconds(1).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        List<CompletableFuture<Void>> notices = new ArrayList<>();
        for (ResponderEngine<?> engine : connections.values()) {
            notices.add(engine.sendReconnectNotification());
        }
        awaitNotices(notices);
        for (SocketTransport transport : new ArrayList<>(connections.keySet())) {
            transport.close();
        }
        connections.clear();
        LOGGER.info("TCP server stopped");
    }

    private void awaitNotices(List<CompletableFuture<Void>> notices) {
        if (notices.isEmpty()) {
            return;
        }
        try {
            CompletableFuture.allOf(notices.toArray(new CompletableFuture<?>[0]))
                .get(RECONNECT_NOTICE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            LOGGER.warn("Not every connection received the reconnect notice", e);
        }
    }

    @Override
    public void close() {
        stop();
    }
}
