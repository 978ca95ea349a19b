/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server;

import java.util.concurrent.atomic.AtomicBoolean;

import io.flymcp.server.error.RequestCancelledException;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.annotation.Nullable;

/**
 * Cooperative cancellation signal for one in-flight request.
 * <p>
 * The token starts active and can be cancelled exactly once; further calls to
 * {@link #cancel()} have no effect. Handlers either poll {@link #isCancelled()} /
 * {@link #throwIfCancelled()} or compose with {@link #onCancel()}.
 */
public class CancellationToken {

	private final Object requestId;

	private final AtomicBoolean cancelled = new AtomicBoolean();

	private final Sinks.Empty<Void> cancelSignal = Sinks.empty();

	public CancellationToken() {
		this(null);
	}

	public CancellationToken(@Nullable Object requestId) {
		this.requestId = requestId;
	}

	@Nullable
	public Object getRequestId() {
		return requestId;
	}

	public boolean isCancelled() {
		return cancelled.get();
	}

	public boolean isActive() {
		return !cancelled.get();
	}

	/**
	 * Cancels the token. Only the first call signals {@link #onCancel()} subscribers.
	 */
	public void cancel() {
		if (cancelled.compareAndSet(false, true)) {
			cancelSignal.tryEmitEmpty();
		}
	}

	/**
	 * Returns a signal completing once the token is cancelled. Late subscribers to an
	 * already cancelled token complete immediately.
	 * @return the cancellation signal
	 */
	public Mono<Void> onCancel() {
		return cancelSignal.asMono();
	}

	/**
	 * Throws if the token has been cancelled.
	 * @throws RequestCancelledException if cancelled
	 */
	public void throwIfCancelled() {
		if (isCancelled()) {
			throw new RequestCancelledException(requestId);
		}
	}

}
