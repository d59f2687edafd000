package dev.muxrpc.server.transport;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import dev.muxrpc.server.ResponderEngine;
import dev.muxrpc.server.ResponderFactory;
import dev.muxrpc.transport.AbstractTransport;
import dev.muxrpc.transport.ReadyState;
import dev.muxrpc.transport.Wire;

/**
 * Serves the protocol over WebSocket text frames. Each WebSocket session is wrapped in a
 * {@link WebSocketSessionTransport} and gets its own {@link ResponderEngine}; one text message
 * carries one frame.
 */
public class WebSocketResponderHandler extends TextWebSocketHandler {

	private static final Logger logger = LoggerFactory.getLogger(WebSocketResponderHandler.class);

	private final ResponderFactory<?> responders;

	private final Map<String, WebSocketSessionTransport> transports = new ConcurrentHashMap<>();

	/**
	 * Create a handler that binds an engine from {@code responders} to every session.
	 * @param responders factory producing one engine per session
	 */
	public WebSocketResponderHandler(ResponderFactory<?> responders) {
		this.responders = responders;
	}

	@Override
	public void afterConnectionEstablished(WebSocketSession session) {
		logger.info("WebSocket connection established: {}", session.getId());
		WebSocketSessionTransport transport = new WebSocketSessionTransport(session);
		this.transports.put(session.getId(), transport);
		this.responders.attach(transport);
		transport.open();
	}

	@Override
	protected void handleTextMessage(WebSocketSession session, TextMessage message) {
		WebSocketSessionTransport transport = this.transports.get(session.getId());
		if (transport == null) {
			logger.warn("Message for unknown WebSocket session {}", session.getId());
			return;
		}
		transport.receive(message.getPayload());
	}

	@Override
	public void handleTransportError(WebSocketSession session, Throwable exception) {
		logger.warn("Transport error detected on WebSocket {}", session.getId(), exception);
		WebSocketSessionTransport transport = this.transports.get(session.getId());
		if (transport != null) {
			transport.error(exception);
		}
	}

	@Override
	public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
		logger.info("WebSocket connection {} closed with status {}", session.getId(), status);
		WebSocketSessionTransport transport = this.transports.remove(session.getId());
		if (transport != null) {
			transport.closed();
		}
	}

	/**
	 * Number of sessions currently bound to an engine.
	 * @return open session count
	 */
	public int sessionCount() {
		return this.transports.size();
	}

	/**
	 * Transport adapter that writes frames to the underlying WebSocket session. Events are fired
	 * from the container thread that delivered them.
	 */
	static final class WebSocketSessionTransport extends AbstractTransport {

		private final WebSocketSession session;

		private final ReentrantLock sendLock = new ReentrantLock();

		WebSocketSessionTransport(WebSocketSession session) {
			super("ws-" + session.getId());
			this.session = session;
		}

		void open() {
			fireOpen();
		}

		void receive(String frame) {
			Wire.rx(id(), frame);
			fireMessage(frame);
		}

		void error(Throwable exception) {
			fireError(exception);
		}

		void closed() {
			fireClose();
		}

		@Override
		public void send(String frame) throws IOException {
			if (readyState() != ReadyState.OPEN || !this.session.isOpen()) {
				throw new IOException("WebSocket session " + this.session.getId() + " is closed");
			}
			Wire.tx(id(), frame);
			this.sendLock.lock();
			try {
				this.session.sendMessage(new TextMessage(frame));
			}
			finally {
				this.sendLock.unlock();
			}
		}

		@Override
		public void close() {
			this.sendLock.lock();
			try {
				if (this.session.isOpen()) {
					this.session.close(CloseStatus.NORMAL);
				}
			}
			catch (IOException ex) {
				logger.warn("Failed to close WebSocket session {}", this.session.getId(), ex);
			}
			finally {
				this.sendLock.unlock();
			}
			fireClose();
		}

	}

}
