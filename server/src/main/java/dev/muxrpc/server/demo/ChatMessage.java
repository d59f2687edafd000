package dev.muxrpc.server.demo;

/**
 * A message posted to a channel of the {@link MessageBus}.
 * @param id caller supplied message id
 * @param channel channel the message is posted to
 * @param content message text
 */
public record ChatMessage(String id, String channel, String content) {
}
