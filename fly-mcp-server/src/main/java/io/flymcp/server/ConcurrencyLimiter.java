/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server;

import java.util.HashMap;
import java.util.Map;

import io.flymcp.server.error.ConcurrencyLimitException;
import io.flymcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Bounds the number of operations executing at once, globally and per admission key.
 * <p>
 * All counters are guarded by the limiter's monitor, so the check and the increment of
 * {@link #tryStart(String)} happen atomically. The global count always equals the sum of
 * the per-key counts and a key is dropped from the table when its count returns to zero.
 */
public class ConcurrencyLimiter {

	private static final Logger logger = LoggerFactory.getLogger(ConcurrencyLimiter.class);

	private final int maxGlobal;

	private final Map<String, Integer> perToolLimits;

	private final Map<String, Integer> currentPerTool = new HashMap<>();

	private int currentGlobal;

	public ConcurrencyLimiter(int maxGlobal) {
		this(maxGlobal, Map.of());
	}

	public ConcurrencyLimiter(int maxGlobal, Map<String, Integer> perToolLimits) {
		Assert.isTrue(maxGlobal > 0, "maxGlobal must be positive");
		Assert.notNull(perToolLimits, "perToolLimits must not be null");
		this.maxGlobal = maxGlobal;
		this.perToolLimits = new HashMap<>(perToolLimits);
	}

	/**
	 * Whether an operation with the given key could start now.
	 * @param name the admission key
	 * @return {@code true} if both the global and the per-key limit have room
	 */
	public synchronized boolean canStart(String name) {
		if (currentGlobal >= maxGlobal) {
			return false;
		}
		Integer limit = perToolLimits.get(name);
		return limit == null || currentPerTool.getOrDefault(name, 0) < limit;
	}

	/**
	 * Records the start of an operation without checking the limits.
	 * @param name the admission key
	 */
	public synchronized void start(String name) {
		currentGlobal++;
		currentPerTool.merge(name, 1, Integer::sum);
	}

	/**
	 * Starts an operation if the limits allow it.
	 * @param name the admission key
	 * @return {@code true} if a slot was taken, {@code false} with no side effect
	 * otherwise
	 */
	public synchronized boolean tryStart(String name) {
		if (!canStart(name)) {
			return false;
		}
		start(name);
		return true;
	}

	/**
	 * Releases the slot of a finished operation.
	 * @param name the admission key
	 */
	public synchronized void complete(String name) {
		Integer count = currentPerTool.get(name);
		if (count == null) {
			logger.warn("Completion for {} without a matching start", name);
			return;
		}
		if (count <= 1) {
			currentPerTool.remove(name);
		}
		else {
			currentPerTool.put(name, count - 1);
		}
		currentGlobal--;
	}

	/**
	 * Sets the limit for a key unless one is already configured.
	 * @param name the admission key
	 * @param limit the limit, ignored when {@code null}
	 */
	public synchronized void defaultLimit(String name, Integer limit) {
		if (limit != null) {
			Assert.isTrue(limit > 0, "Concurrency limit for " + name + " must be positive");
			perToolLimits.putIfAbsent(name, limit);
		}
	}

	public synchronized int currentConcurrency() {
		return currentGlobal;
	}

	public synchronized int getToolConcurrency(String name) {
		return currentPerTool.getOrDefault(name, 0);
	}

	/**
	 * Returns the effective limit for a key.
	 * @param name the admission key
	 * @return the per-key limit if configured, otherwise the global limit
	 */
	public synchronized int limitFor(String name) {
		return perToolLimits.getOrDefault(name, maxGlobal);
	}

	public int getMaxGlobal() {
		return maxGlobal;
	}

	/**
	 * Runs the body inside a slot. The slot is taken on subscription and released when
	 * the body completes, fails or is cancelled.
	 * @param name the admission key
	 * @param body the operation
	 * @param <T> the result type
	 * @return the guarded operation, failing with {@link ConcurrencyLimitException} if no
	 * slot is free
	 */
	public <T> Mono<T> execute(String name, Mono<T> body) {
		return Mono.defer(() -> {
			if (!tryStart(name)) {
				return Mono.error(limitExceeded(name));
			}
			return body.doFinally(signal -> complete(name));
		});
	}

	/**
	 * Creates the error reported when the key cannot start.
	 * @param name the admission key
	 * @return the error describing current usage and limit
	 */
	public synchronized ConcurrencyLimitException limitExceeded(String name) {
		return new ConcurrencyLimitException(name, getToolConcurrency(name), limitFor(name));
	}

}
