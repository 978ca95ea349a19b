/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.error;

public class ToolNotFoundException extends McpServerException {

	private final String toolName;

	public ToolNotFoundException(String toolName) {
		super("Tool not found: " + toolName);
		this.toolName = toolName;
	}

	public String getToolName() {
		return toolName;
	}

}
