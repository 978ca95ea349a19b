/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.transport;

import io.flymcp.spec.McpSchema;
import reactor.core.publisher.Mono;

/**
 * Outbound side of the connection to the single peer.
 */
public interface McpServerTransport {

	/**
	 * Sends a message to the peer. Each message is written as one whole frame.
	 * @param message the message to send
	 * @return completes once the message has been written
	 */
	Mono<Void> sendMessage(McpSchema.JSONRPCMessage message);

	/**
	 * Stops reading, flushes pending output and releases the transport's threads.
	 * @return completes when the transport is closed
	 */
	Mono<Void> closeGracefully();

	default void close() {
		this.closeGracefully().subscribe();
	}

}
