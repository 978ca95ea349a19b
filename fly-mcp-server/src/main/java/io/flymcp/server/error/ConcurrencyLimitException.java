/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.error;

public class ConcurrencyLimitException extends McpServerException {

	private final String toolName;

	private final int current;

	private final int limit;

	public ConcurrencyLimitException(String toolName, int current, int limit) {
		super("Maximum concurrency reached for tool: " + toolName + " (current: " + current + ", limit: " + limit
				+ ")");
		this.toolName = toolName;
		this.current = current;
		this.limit = limit;
	}

	public String getToolName() {
		return toolName;
	}

	public int getCurrent() {
		return current;
	}

	public int getLimit() {
		return limit;
	}

}
