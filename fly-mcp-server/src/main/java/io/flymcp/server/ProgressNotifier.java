/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server;

import io.flymcp.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Sends {@code notifications/progress} for one request. Notifications are only sent when
 * the peer supplied a progress token; otherwise every call completes without effect.
 * Delivery failures are logged and never fail the calling handler.
 */
public final class ProgressNotifier {

	private static final Logger logger = LoggerFactory.getLogger(ProgressNotifier.class);

	/**
	 * Notifier that never sends anything.
	 */
	public static final ProgressNotifier NOOP = new ProgressNotifier(null, null);

	private static final double TOTAL_PERCENT = 100.0;

	private final McpServerExchange exchange;

	private final Object progressToken;

	private ProgressNotifier(@Nullable McpServerExchange exchange, @Nullable Object progressToken) {
		this.exchange = exchange;
		this.progressToken = progressToken;
	}

	/**
	 * Creates a notifier for a request.
	 * @param exchange the request exchange, may be null
	 * @param progressToken the token from the request metadata, may be null
	 * @return a live notifier, or {@link #NOOP} if either argument is missing
	 */
	public static ProgressNotifier of(@Nullable McpServerExchange exchange, @Nullable Object progressToken) {
		if (exchange == null || progressToken == null) {
			return NOOP;
		}
		return new ProgressNotifier(exchange, progressToken);
	}

	public boolean isEnabled() {
		return exchange != null && progressToken != null;
	}

	@Nullable
	public Object getProgressToken() {
		return progressToken;
	}

	/**
	 * Reports progress. When a percentage is given the notification carries it as
	 * {@code progress} with a {@code total} of 100.
	 * @param message a human-readable status message
	 * @param percent completion percentage, or null if unknown
	 * @return completes once the notification has been written or skipped
	 */
	public Mono<Void> notifyProgress(String message, @Nullable Integer percent) {
		if (!isEnabled()) {
			return Mono.empty();
		}
		McpSchema.ProgressNotification notification = new McpSchema.ProgressNotification(progressToken,
				percent != null ? percent.doubleValue() : null, percent != null ? TOTAL_PERCENT : null, message);
		return exchange.sendNotification(McpSchema.METHOD_NOTIFICATION_PROGRESS, notification).onErrorResume(e -> {
			logger.warn("Failed to send progress notification for token {}: {}", progressToken, e.getMessage());
			return Mono.empty();
		});
	}

	public Mono<Void> notifyProgress(String message) {
		return notifyProgress(message, null);
	}

}
