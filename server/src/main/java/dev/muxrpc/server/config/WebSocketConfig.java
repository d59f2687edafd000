package dev.muxrpc.server.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import lombok.RequiredArgsConstructor;

import dev.muxrpc.server.ResponderFactory;
import dev.muxrpc.server.transport.WebSocketResponderHandler;

/**
 * Registers the WebSocket endpoint when {@code muxrpc.server.websocket.enabled=true}.
 */
@Configuration
@EnableWebSocket
@ConditionalOnProperty(prefix = "muxrpc.server.websocket", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

	private final ServerProperties serverProperties;

	private final ResponderFactory<?> responderFactory;

	/**
	 * Handler binding one responder engine to every WebSocket session.
	 * @return the WebSocket handler
	 */
	@Bean
	public WebSocketResponderHandler webSocketResponderHandler() {
		return new WebSocketResponderHandler(this.responderFactory);
	}

	@Override
	public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
		ServerProperties.WebSocket websocket = this.serverProperties.getWebsocket();
		registry.addHandler(webSocketResponderHandler(), websocket.getEndpoint())
			.setAllowedOrigins(websocket.getAllowedOrigins());
	}

}
