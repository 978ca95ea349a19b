/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.registry;

import io.flymcp.server.error.McpServerException;
import io.flymcp.server.error.PromptNotFoundException;
import io.flymcp.spec.McpSchema;

public class PromptRegistry extends AbstractDefinitionRegistry<PromptDefinition, McpSchema.Prompt> {

	@Override
	protected McpSchema.Prompt describe(PromptDefinition definition) {
		return definition.toPrompt();
	}

	@Override
	protected McpServerException notFound(String key) {
		return new PromptNotFoundException(key);
	}

}
