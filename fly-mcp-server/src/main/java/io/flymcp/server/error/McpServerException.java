/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.error;

import java.util.Collections;
import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * Base class of the failures a server operation can report to the peer. Each subclass
 * maps to one JSON-RPC error code in {@link ErrorConverter}.
 */
public abstract class McpServerException extends RuntimeException {

	private final Map<String, Object> context;

	protected McpServerException(String message) {
		this(message, null, null);
	}

	protected McpServerException(String message, @Nullable Throwable cause, @Nullable Map<String, Object> context) {
		super(message, cause);
		this.context = (context != null) ? Collections.unmodifiableMap(context) : Map.of();
	}

	/**
	 * Returns additional diagnostic values attached by the thrower.
	 * @return the context, never null
	 */
	public Map<String, Object> getContext() {
		return context;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append(": ").append(getMessage());
		if (!context.isEmpty()) {
			sb.append(" (context: ").append(context).append(')');
		}
		if (getCause() != null) {
			sb.append(" (caused by: ").append(getCause()).append(')');
		}
		return sb.toString();
	}

}
