/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.error;

public class PromptNotFoundException extends McpServerException {

	private final String promptId;

	public PromptNotFoundException(String promptId) {
		super("Prompt not found: " + promptId);
		this.promptId = promptId;
	}

	public String getPromptId() {
		return promptId;
	}

}
