package dev.muxrpc.server.demo;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * In-memory publish/subscribe hub keyed by channel name. Messages published while nobody listens
 * on a channel are dropped.
 */
@Component
public class MessageBus {

	private static final Logger logger = LoggerFactory.getLogger(MessageBus.class);

	private final Map<String, Sinks.Many<ChatMessage>> channels = new ConcurrentHashMap<>();

	/**
	 * Publish a message to its channel.
	 * @param message message to deliver to the current listeners of {@code message.channel()}
	 */
	public void publish(ChatMessage message) {
		logger.debug("Publishing message {} on channel {}", message.id(), message.channel());
		channel(message.channel()).emitNext(message, Sinks.EmitFailureHandler.busyLooping(Duration.ofMillis(100)));
	}

	/**
	 * Listen to a channel.
	 * @param channel channel name
	 * @return hot stream of the messages published from now on
	 */
	public Flux<ChatMessage> listen(String channel) {
		return channel(channel).asFlux();
	}

	private Sinks.Many<ChatMessage> channel(String name) {
		return this.channels.computeIfAbsent(name, key -> Sinks.many().multicast().directBestEffort());
	}

}
