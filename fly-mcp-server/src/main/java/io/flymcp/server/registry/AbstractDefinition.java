/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.registry;

import java.time.Duration;
import java.util.Map;

import io.flymcp.server.McpHandler;
import io.flymcp.util.Assert;
import reactor.util.annotation.Nullable;

/**
 * Common description of a callable server operation: its name, schemas, behavioural
 * flags, execution overrides and handler. Definitions are immutable.
 */
public abstract class AbstractDefinition {

	private final String name;

	private final String description;

	private final Map<String, Object> paramsSchema;

	private final Map<String, Object> resultSchema;

	private final boolean readOnly;

	private final boolean writesToDisk;

	private final boolean requiresConfirmation;

	private final boolean idempotent;

	private final Duration timeout;

	private final Integer maxConcurrency;

	private final McpHandler handler;

	protected AbstractDefinition(AbstractBuilder<?, ?> builder) {
		Assert.hasText(builder.name, "name must not be empty");
		Assert.notNull(builder.handler, "handler must not be null");
		if (builder.timeout != null) {
			Assert.isTrue(!builder.timeout.isNegative() && !builder.timeout.isZero(), "timeout must be positive");
		}
		if (builder.maxConcurrency != null) {
			Assert.isTrue(builder.maxConcurrency > 0, "maxConcurrency must be positive");
		}
		this.name = builder.name;
		this.description = builder.description;
		this.paramsSchema = builder.paramsSchema;
		this.resultSchema = builder.resultSchema;
		this.readOnly = builder.readOnly;
		this.writesToDisk = builder.writesToDisk;
		this.requiresConfirmation = builder.requiresConfirmation;
		this.idempotent = builder.idempotent;
		this.timeout = builder.timeout;
		this.maxConcurrency = builder.maxConcurrency;
		this.handler = builder.handler;
	}

	/**
	 * Returns the key the definition is registered and looked up under.
	 * @return the registry key
	 */
	public abstract String key();

	/**
	 * Returns the key used for concurrency limits and per-operation timeouts.
	 * @return the admission key
	 */
	public abstract String admissionKey();

	public String getName() {
		return name;
	}

	@Nullable
	public String getDescription() {
		return description;
	}

	@Nullable
	public Map<String, Object> getParamsSchema() {
		return paramsSchema;
	}

	@Nullable
	public Map<String, Object> getResultSchema() {
		return resultSchema;
	}

	public boolean isReadOnly() {
		return readOnly;
	}

	public boolean isWritesToDisk() {
		return writesToDisk;
	}

	public boolean isRequiresConfirmation() {
		return requiresConfirmation;
	}

	public boolean isIdempotent() {
		return idempotent;
	}

	@Nullable
	public Duration getTimeout() {
		return timeout;
	}

	@Nullable
	public Integer getMaxConcurrency() {
		return maxConcurrency;
	}

	public McpHandler getHandler() {
		return handler;
	}

	/**
	 * Returns {@code Boolean.TRUE} for set flags and {@code null} otherwise, so that unset
	 * flags are omitted from listings.
	 * @param flag the flag value
	 * @return the listed value
	 */
	protected static Boolean trueOrNull(boolean flag) {
		return flag ? Boolean.TRUE : null;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{key=" + key() + ", name=" + name + "}";
	}

	/**
	 * Shared builder of definitions.
	 *
	 * @param <D> the definition type
	 * @param <B> the concrete builder type
	 */
	public abstract static class AbstractBuilder<D extends AbstractDefinition, B extends AbstractBuilder<D, B>> {

		private String name;

		private String description;

		private Map<String, Object> paramsSchema;

		private Map<String, Object> resultSchema;

		private boolean readOnly;

		private boolean writesToDisk;

		private boolean requiresConfirmation;

		private boolean idempotent;

		private Duration timeout;

		private Integer maxConcurrency;

		private McpHandler handler;

		protected abstract B self();

		public abstract D build();

		public B name(String name) {
			this.name = name;
			return self();
		}

		public B description(String description) {
			this.description = description;
			return self();
		}

		public B paramsSchema(Map<String, Object> paramsSchema) {
			this.paramsSchema = paramsSchema;
			return self();
		}

		public B resultSchema(Map<String, Object> resultSchema) {
			this.resultSchema = resultSchema;
			return self();
		}

		public B readOnly(boolean readOnly) {
			this.readOnly = readOnly;
			return self();
		}

		public B writesToDisk(boolean writesToDisk) {
			this.writesToDisk = writesToDisk;
			return self();
		}

		public B requiresConfirmation(boolean requiresConfirmation) {
			this.requiresConfirmation = requiresConfirmation;
			return self();
		}

		public B idempotent(boolean idempotent) {
			this.idempotent = idempotent;
			return self();
		}

		public B timeout(Duration timeout) {
			this.timeout = timeout;
			return self();
		}

		public B maxConcurrency(Integer maxConcurrency) {
			this.maxConcurrency = maxConcurrency;
			return self();
		}

		public B handler(McpHandler handler) {
			this.handler = handler;
			return self();
		}

	}

}
