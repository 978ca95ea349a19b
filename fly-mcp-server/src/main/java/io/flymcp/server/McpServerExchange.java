/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server;

import io.flymcp.util.Assert;
import reactor.core.publisher.Mono;

/**
 * Per-request view of the session handed to request handlers: the id being answered and
 * a channel for out-of-band notifications to the peer.
 */
public class McpServerExchange {

	private final McpServerSession session;

	private final Object requestId;

	public McpServerExchange(McpServerSession session, Object requestId) {
		Assert.notNull(session, "session must not be null");
		this.session = session;
		this.requestId = requestId;
	}

	public Object getRequestId() {
		return requestId;
	}

	/**
	 * Sends a notification to the peer.
	 * @param method the notification method
	 * @param params the notification parameters
	 * @return completes once the notification has been written
	 */
	public Mono<Void> sendNotification(String method, Object params) {
		return session.sendNotification(method, params);
	}

}
