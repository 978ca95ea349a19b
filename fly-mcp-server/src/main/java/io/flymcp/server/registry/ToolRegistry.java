/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.registry;

import io.flymcp.server.error.McpServerException;
import io.flymcp.server.error.ToolNotFoundException;
import io.flymcp.spec.McpSchema;

public class ToolRegistry extends AbstractDefinitionRegistry<ToolDefinition, McpSchema.Tool> {

	@Override
	protected McpSchema.Tool describe(ToolDefinition definition) {
		return definition.toTool();
	}

	@Override
	protected McpServerException notFound(String key) {
		return new ToolNotFoundException(key);
	}

}
