package dev.muxrpc.server.demo;

import java.time.Instant;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.RequiredArgsConstructor;

import dev.muxrpc.protocol.ErrorCode;
import dev.muxrpc.protocol.RpcException;
import dev.muxrpc.server.ContextFactory;
import dev.muxrpc.server.Router;
import reactor.core.publisher.Mono;

/**
 * Sample procedures served by the application:
 * <ul>
 * <li>{@code greeting} (query): {@code {id}} to {@code {hello: id}}</li>
 * <li>{@code messages.add} (mutation): publishes a {@link ChatMessage} and echoes it</li>
 * <li>{@code messages.onAdd} (subscription): streams the messages of {@code {channel}}</li>
 * </ul>
 */
@Configuration
@RequiredArgsConstructor
public class DemoRouterConfig {

	private final MessageBus messageBus;

	/**
	 * Router with the demo procedures.
	 * @return the demo router
	 */
	@Bean
	public Router<DemoContext> demoRouter() {
		return Router.<DemoContext>builder()
			.query("greeting", call -> new Greeting(call.requireInput(GreetingInput.class).id()))
			.mutation("messages.add", call -> {
				ChatMessage message = call.requireInput(ChatMessage.class);
				if (message.channel() == null || message.channel().isBlank()) {
					throw new RpcException(ErrorCode.BAD_REQUEST, "channel is required");
				}
				this.messageBus.publish(message);
				return message;
			})
			.subscription("messages.onAdd",
					call -> this.messageBus.listen(call.requireInput(ChannelInput.class).channel()))
			.build();
	}

	/**
	 * Context naming the connection each call arrives on.
	 * @return context factory for the demo procedures
	 */
	@Bean
	public ContextFactory<DemoContext> demoContextFactory() {
		return transport -> Mono.just(new DemoContext(transport.id(), Instant.now()));
	}

	/**
	 * Input of the {@code greeting} query.
	 * @param id name to greet
	 */
	public record GreetingInput(String id) {
	}

	/**
	 * Result of the {@code greeting} query.
	 * @param hello the greeted name
	 */
	public record Greeting(String hello) {
	}

	/**
	 * Input of the {@code messages.onAdd} subscription.
	 * @param channel channel to follow
	 */
	public record ChannelInput(String channel) {
	}

}
