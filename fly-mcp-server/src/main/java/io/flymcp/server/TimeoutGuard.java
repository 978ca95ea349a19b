/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server;

import java.time.Duration;

import io.flymcp.server.error.OperationTimeoutException;
import io.flymcp.util.Assert;
import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Bounds the duration of an operation.
 */
public final class TimeoutGuard {

	private TimeoutGuard() {
	}

	/**
	 * Races the body against a timer. If the timer fires first the body is cancelled and
	 * the result fails with {@link OperationTimeoutException}; otherwise the body's
	 * outcome passes through unchanged.
	 * @param body the operation
	 * @param timeout the time budget
	 * @param operationName the name reported in the timeout error
	 * @param <T> the result type
	 * @return the bounded operation
	 */
	public static <T> Mono<T> withTimeout(Mono<T> body, Duration timeout, @Nullable String operationName) {
		Assert.notNull(body, "body must not be null");
		Assert.notNull(timeout, "timeout must not be null");
		return body.timeout(timeout, Mono.defer(() -> Mono.error(new OperationTimeoutException(timeout, operationName))));
	}

}
