/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.flymcp.util.Assert;
import io.flymcp.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps in-flight request ids to their {@link CancellationToken}. Numeric ids are compared
 * by value, so {@code 7} and {@code 7L} refer to the same request.
 */
public class CancellationRegistry {

	private static final Logger logger = LoggerFactory.getLogger(CancellationRegistry.class);

	private final ConcurrentHashMap<Object, CancellationToken> tokens = new ConcurrentHashMap<>();

	public void register(Object requestId, CancellationToken token) {
		Assert.notNull(requestId, "requestId must not be null");
		Assert.notNull(token, "token must not be null");
		CancellationToken previous = tokens.put(Utils.normalizeId(requestId), token);
		if (previous != null && previous != token) {
			logger.warn("Replaced cancellation token for duplicate request id {}", requestId);
		}
	}

	/**
	 * Cancels the token registered for the request and removes it. Unknown ids are
	 * ignored.
	 * @param requestId the request id
	 * @return {@code true} if a token was found
	 */
	public boolean cancel(Object requestId) {
		if (requestId == null) {
			return false;
		}
		CancellationToken token = tokens.remove(Utils.normalizeId(requestId));
		if (token == null) {
			logger.debug("No in-flight request {} to cancel", requestId);
			return false;
		}
		token.cancel();
		return true;
	}

	public Optional<CancellationToken> get(Object requestId) {
		if (requestId == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(tokens.get(Utils.normalizeId(requestId)));
	}

	public void remove(Object requestId) {
		if (requestId != null) {
			tokens.remove(Utils.normalizeId(requestId));
		}
	}

	/**
	 * Removes the registration only if it still maps to the given token.
	 * @param requestId the request id
	 * @param token the expected token
	 */
	public void remove(Object requestId, CancellationToken token) {
		if (requestId != null) {
			tokens.remove(Utils.normalizeId(requestId), token);
		}
	}

	public int size() {
		return tokens.size();
	}

}
