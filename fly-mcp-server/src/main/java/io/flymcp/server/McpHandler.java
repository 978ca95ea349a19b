/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server;

import java.util.Map;

import io.flymcp.util.Assert;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Callback implementing a tool, resource or prompt.
 * <p>
 * A handler receives the call arguments, the request's {@link CancellationToken} and a
 * {@link ProgressNotifier}. It may complete with any JSON-serializable value, complete
 * empty for a {@code null} result, or fail with an exception that is converted into a
 * JSON-RPC error. Cancellation is cooperative: the server stops waiting as soon as the
 * token is cancelled, but the handler is expected to observe the token and stop its
 * work.
 */
@FunctionalInterface
public interface McpHandler {

	Mono<Object> handle(Map<String, Object> params, CancellationToken token, ProgressNotifier progress);

	/**
	 * Adapts a blocking handler. The handler runs on the bounded elastic scheduler so it
	 * never blocks the transport threads.
	 * @param handler the blocking handler
	 * @return the asynchronous handler
	 */
	static McpHandler sync(SyncHandler handler) {
		Assert.notNull(handler, "handler must not be null");
		return (params, token, progress) -> Mono.fromCallable(() -> handler.handle(params, token, progress))
			.subscribeOn(Schedulers.boundedElastic());
	}

	/**
	 * Blocking variant of {@link McpHandler}. A {@code null} return value is a valid
	 * result.
	 */
	@FunctionalInterface
	interface SyncHandler {

		Object handle(Map<String, Object> params, CancellationToken token, ProgressNotifier progress)
				throws Exception;

	}

}
