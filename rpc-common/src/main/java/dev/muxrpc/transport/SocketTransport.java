package dev.muxrpc.transport;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Transport} over a connected TCP socket using {@link LengthPrefixedCodec} framing. A daemon
 * reader thread delivers every event for the connection.
 */
public class SocketTransport extends AbstractTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(SocketTransport.class);

    private final Socket socket;
    private final int maxFrameLength;
    private final Object writeLock = new Object();

    private OutputStream out;
    private Thread readerThread;
    private volatile boolean closing;

    public SocketTransport(Socket socket) {
        this(socket, LengthPrefixedCodec.DEFAULT_MAX_FRAME_LENGTH);
    }

    public SocketTransport(Socket socket, int maxFrameLength) {
        super(String.valueOf(socket.getRemoteSocketAddress()));
        this.socket = socket;
        this.maxFrameLength = maxFrameLength;
    }

    /**
     * Opens a client connection. The returned transport is still connecting until {@link #start()}.
     */
    public static SocketTransport connect(String host, int port) throws IOException {
        Socket socket = new Socket();
        socket.setTcpNoDelay(true);
        socket.connect(new InetSocketAddress(host, port));
        LOGGER.info("Connected to {}:{}", host, port);
        return new SocketTransport(socket);
    }

    /**
     * Starts reading and fires {@code open}. Listeners should be registered before calling this.
     */
    public synchronized void start() throws IOException {
        if (readerThread != null) {
            return;
        }
        out = new BufferedOutputStream(socket.getOutputStream());
        InputStream in = new BufferedInputStream(socket.getInputStream());
        readerThread = new Thread(() -> readLoop(in), "socket-transport-" + id());
        readerThread.setDaemon(true);
        readerThread.start();
    }

    private void readLoop(InputStream in) {
        fireOpen();
        try {
            while (readyState() == ReadyState.OPEN) {
                String frame = LengthPrefixedCodec.readFrame(in, maxFrameLength);
                if (frame == null) {
                    break;
                }
                Wire.rx(id(), frame);
                fireMessage(frame);
            }
        } catch (IOException e) {
            if (!closing) {
                LOGGER.warn("Transport error on {}", id(), e);
                fireError(e);
            }
        } finally {
            closeSocket();
            fireClose();
        }
    }

    @Override
    public void send(String frame) throws IOException {
        if (readyState() != ReadyState.OPEN) {
            throw new IOException("Transport " + id() + " is " + readyState());
        }
        Wire.tx(id(), frame);
        synchronized (writeLock) {
            LengthPrefixedCodec.writeFrame(out, frame, maxFrameLength);
        }
    }

    @Override
    public void close() {
        closing = true;
        boolean started;
        synchronized (this) {
            started = readerThread != null;
        }
        closeSocket();
        if (!started) {
            // no reader thread will observe the shutdown
            fireClose();
        }
    }

    private void closeSocket() {
        if (socket.isClosed()) {
            return;
        }
        try {
            socket.close();
        } catch (IOException e) {
            LOGGER.warn("Error closing socket {}", id(), e);
        }
    }
}
