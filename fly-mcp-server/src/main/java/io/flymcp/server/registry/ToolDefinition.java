/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.registry;

import io.flymcp.spec.McpSchema;

/**
 * A tool callable through {@code tools/call}. Tools are keyed and admitted by their
 * name.
 */
public class ToolDefinition extends AbstractDefinition {

	private ToolDefinition(Builder builder) {
		super(builder);
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String key() {
		return getName();
	}

	@Override
	public String admissionKey() {
		return getName();
	}

	/**
	 * Returns the metadata advertised by {@code tools/list}.
	 * @return the tool metadata
	 */
	public McpSchema.Tool toTool() {
		return new McpSchema.Tool(getName(), getDescription(), getParamsSchema(), getResultSchema(),
				trueOrNull(isReadOnly()), trueOrNull(isWritesToDisk()), trueOrNull(isRequiresConfirmation()),
				trueOrNull(isIdempotent()));
	}

	public static class Builder extends AbstractBuilder<ToolDefinition, Builder> {

		@Override
		protected Builder self() {
			return this;
		}

		@Override
		public ToolDefinition build() {
			return new ToolDefinition(this);
		}

	}

}
