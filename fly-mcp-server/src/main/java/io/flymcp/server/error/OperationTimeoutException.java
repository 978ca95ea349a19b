/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.error;

import java.time.Duration;

import reactor.util.annotation.Nullable;

public class OperationTimeoutException extends McpServerException {

	private final Duration timeout;

	private final String operationName;

	public OperationTimeoutException(Duration timeout, @Nullable String operationName) {
		super(operationName != null ? "Operation (" + operationName + ") timed out after " + format(timeout)
				: "Operation timed out after " + format(timeout));
		this.timeout = timeout;
		this.operationName = operationName;
	}

	public Duration getTimeout() {
		return timeout;
	}

	@Nullable
	public String getOperationName() {
		return operationName;
	}

	private static String format(Duration timeout) {
		long millis = timeout.toMillis();
		return (millis % 1000 == 0) ? (millis / 1000) + "s" : millis + "ms";
	}

}
