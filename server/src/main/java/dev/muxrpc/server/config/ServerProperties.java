package dev.muxrpc.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import dev.muxrpc.transport.LengthPrefixedCodec;

/**
 * Configuration properties for the responder endpoints. The TCP endpoint is always on; the
 * WebSocket endpoint is opt-in.
 */
@ConfigurationProperties(prefix = "muxrpc.server")
public class ServerProperties {

	private final Tcp tcp = new Tcp();

	private final WebSocket websocket = new WebSocket();

	/**
	 * Settings of the length-prefixed TCP endpoint.
	 * @return TCP settings
	 */
	public Tcp getTcp() {
		return tcp;
	}

	/**
	 * Settings of the WebSocket endpoint.
	 * @return WebSocket settings
	 */
	public WebSocket getWebsocket() {
		return websocket;
	}

	/**
	 * TCP endpoint settings.
	 */
	public static class Tcp {

		/**
		 * Port to listen on. {@code 0} picks a free port.
		 */
		private int port = 7071;

		/**
		 * Largest accepted frame in bytes.
		 */
		private int maxFrameLength = LengthPrefixedCodec.DEFAULT_MAX_FRAME_LENGTH;

		public int getPort() {
			return port;
		}

		public void setPort(int port) {
			this.port = port;
		}

		public int getMaxFrameLength() {
			return maxFrameLength;
		}

		public void setMaxFrameLength(int maxFrameLength) {
			this.maxFrameLength = maxFrameLength;
		}

	}

	/**
	 * WebSocket endpoint settings.
	 */
	public static class WebSocket {

		/**
		 * Whether to register the WebSocket endpoint.
		 */
		private boolean enabled = false;

		/**
		 * HTTP path the WebSocket endpoint binds to. Defaults to {@code /rpc}.
		 */
		private String endpoint = "/rpc";

		/**
		 * Origins allowed to open WebSocket connections.
		 */
		private String[] allowedOrigins = { "*" };

		public boolean isEnabled() {
			return enabled;
		}

		public void setEnabled(boolean enabled) {
			this.enabled = enabled;
		}

		public String getEndpoint() {
			return endpoint;
		}

		public void setEndpoint(String endpoint) {
			this.endpoint = endpoint;
		}

		public String[] getAllowedOrigins() {
			return allowedOrigins;
		}

		public void setAllowedOrigins(String[] allowedOrigins) {
			this.allowedOrigins = allowedOrigins;
		}

	}

}
