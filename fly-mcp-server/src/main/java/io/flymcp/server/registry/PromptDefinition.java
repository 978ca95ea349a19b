/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.registry;

import java.util.ArrayList;
import java.util.List;

import io.flymcp.spec.McpSchema;

/**
 * A prompt template served through {@code prompts/get}. Prompts are keyed by name and
 * admitted under {@code prompts/<name>}.
 */
public class PromptDefinition extends AbstractDefinition {

	public static final String ADMISSION_PREFIX = "prompts/";

	private final List<McpSchema.PromptArgument> arguments;

	private PromptDefinition(Builder builder) {
		super(builder);
		this.arguments = List.copyOf(builder.arguments);
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
		return ADMISSION_PREFIX + getName();
	}

	public List<McpSchema.PromptArgument> getArguments() {
		return arguments;
	}

	/**
	 * Returns the metadata advertised by {@code prompts/list}.
	 * @return the prompt metadata
	 */
	public McpSchema.Prompt toPrompt() {
		return new McpSchema.Prompt(getName(), getDescription(), arguments.isEmpty() ? null : arguments);
	}

	public static class Builder extends AbstractBuilder<PromptDefinition, Builder> {

		private final List<McpSchema.PromptArgument> arguments = new ArrayList<>();

		public Builder argument(String name, String description, boolean required) {
			this.arguments.add(new McpSchema.PromptArgument(name, description, required));
			return this;
		}

		@Override
		protected Builder self() {
			return this;
		}

		@Override
		public PromptDefinition build() {
			return new PromptDefinition(this);
		}

	}

}
