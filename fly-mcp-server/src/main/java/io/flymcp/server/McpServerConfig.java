/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import io.flymcp.util.Assert;
import io.flymcp.util.Utils;

/**
 * Immutable server configuration, built once and passed to the components that need it.
 * <p>
 * Per-tool concurrency limits and timeouts are keyed by the admission key of an
 * operation: the tool name for tools, {@code resources/<name>} for resources and
 * {@code prompts/<name>} for prompts.
 */
public final class McpServerConfig {

	public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

	public static final int DEFAULT_MAX_CONCURRENCY = 10;

	public static final String DEFAULT_LOG_PATTERN = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";

	/**
	 * Property prefix understood by {@link #fromProperties(Properties)}.
	 */
	public static final String PREFIX = "fly.mcp.";

	private final String serverName;

	private final String serverVersion;

	private final String instructions;

	private final Duration defaultTimeout;

	private final int maxConcurrency;

	private final Map<String, Integer> perToolLimits;

	private final Map<String, Duration> perToolTimeouts;

	private final SizeLimits sizeLimits;

	private final String logLevel;

	private final String logPattern;

	private final boolean includeCorrelationIds;

	private McpServerConfig(Builder builder) {
		this.serverName = builder.serverName;
		this.serverVersion = builder.serverVersion;
		this.instructions = builder.instructions;
		this.defaultTimeout = builder.defaultTimeout;
		this.maxConcurrency = builder.maxConcurrency;
		this.perToolLimits = Map.copyOf(builder.perToolLimits);
		this.perToolTimeouts = Map.copyOf(builder.perToolTimeouts);
		this.sizeLimits = builder.sizeLimits;
		this.logLevel = builder.logLevel;
		this.logPattern = builder.logPattern;
		this.includeCorrelationIds = builder.includeCorrelationIds;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Returns a configuration with all defaults.
	 * @return the default configuration
	 */
	public static McpServerConfig defaults() {
		return builder().build();
	}

	/**
	 * Reads a configuration from properties. Durations are ISO-8601 ({@code PT30S}) or a
	 * plain number of milliseconds; sizes are bytes. Recognized keys, all prefixed with
	 * {@value #PREFIX}:
	 * <ul>
	 * <li>{@code server.name}, {@code server.version}, {@code server.instructions}</li>
	 * <li>{@code timeout.default}, {@code timeout.tool.<key>}</li>
	 * <li>{@code concurrency.max}, {@code concurrency.tool.<key>}</li>
	 * <li>{@code limits.parameters}, {@code limits.result}, {@code limits.resource},
	 * {@code limits.message}</li>
	 * <li>{@code log.level}, {@code log.pattern}, {@code log.correlation-ids}</li>
	 * </ul>
	 * @param properties the properties
	 * @return the validated configuration
	 * @throws IllegalArgumentException if a value cannot be parsed or is invalid
	 */
	public static McpServerConfig fromProperties(Properties properties) {
		Assert.notNull(properties, "properties must not be null");
		Builder builder = builder();

		String name = properties.getProperty(PREFIX + "server.name");
		if (Utils.hasText(name)) {
			builder.serverName(name.trim());
		}
		String version = properties.getProperty(PREFIX + "server.version");
		if (Utils.hasText(version)) {
			builder.serverVersion(version.trim());
		}
		String instructions = properties.getProperty(PREFIX + "server.instructions");
		if (Utils.hasText(instructions)) {
			builder.instructions(instructions.trim());
		}

		String timeout = properties.getProperty(PREFIX + "timeout.default");
		if (Utils.hasText(timeout)) {
			builder.defaultTimeout(parseDuration(PREFIX + "timeout.default", timeout));
		}
		String maxConcurrency = properties.getProperty(PREFIX + "concurrency.max");
		if (Utils.hasText(maxConcurrency)) {
			builder.maxConcurrency(parseInt(PREFIX + "concurrency.max", maxConcurrency));
		}

		SizeLimits defaults = SizeLimits.DEFAULT;
		builder.sizeLimits(new SizeLimits(
				intProperty(properties, PREFIX + "limits.parameters", defaults.maxParameterSize()),
				intProperty(properties, PREFIX + "limits.result", defaults.maxResultSize()),
				intProperty(properties, PREFIX + "limits.resource", defaults.maxResourceSize()),
				intProperty(properties, PREFIX + "limits.message", defaults.maxMessageSize())));

		String level = properties.getProperty(PREFIX + "log.level");
		if (Utils.hasText(level)) {
			builder.logLevel(level.trim());
		}
		String pattern = properties.getProperty(PREFIX + "log.pattern");
		if (Utils.hasText(pattern)) {
			builder.logPattern(pattern);
		}
		String correlationIds = properties.getProperty(PREFIX + "log.correlation-ids");
		if (Utils.hasText(correlationIds)) {
			builder.includeCorrelationIds(Boolean.parseBoolean(correlationIds.trim()));
		}

		String toolLimitPrefix = PREFIX + "concurrency.tool.";
		String toolTimeoutPrefix = PREFIX + "timeout.tool.";
		for (String key : properties.stringPropertyNames()) {
			if (key.startsWith(toolLimitPrefix) && key.length() > toolLimitPrefix.length()) {
				builder.toolConcurrency(key.substring(toolLimitPrefix.length()),
						parseInt(key, properties.getProperty(key)));
			}
			else if (key.startsWith(toolTimeoutPrefix) && key.length() > toolTimeoutPrefix.length()) {
				builder.toolTimeout(key.substring(toolTimeoutPrefix.length()),
						parseDuration(key, properties.getProperty(key)));
			}
		}

		return builder.build();
	}

	/**
	 * Checks that every limit and timeout is positive.
	 * @throws IllegalArgumentException naming the first invalid setting
	 */
	public void validate() {
		if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
			throw new IllegalArgumentException("defaultTimeout must be positive");
		}
		if (maxConcurrency <= 0) {
			throw new IllegalArgumentException("maxConcurrency must be positive");
		}
		perToolLimits.forEach((tool, limit) -> {
			if (limit <= 0) {
				throw new IllegalArgumentException("Concurrency limit for " + tool + " must be positive");
			}
		});
		perToolTimeouts.forEach((tool, toolTimeout) -> {
			if (toolTimeout.isNegative() || toolTimeout.isZero()) {
				throw new IllegalArgumentException("Timeout for " + tool + " must be positive");
			}
		});
		sizeLimits.validate();
	}

	/**
	 * Returns the timeout for the given admission key.
	 * @param key the admission key
	 * @return the per-tool timeout if configured, otherwise the default timeout
	 */
	public Duration timeoutFor(String key) {
		return perToolTimeouts.getOrDefault(key, defaultTimeout);
	}

	public String getServerName() {
		return serverName;
	}

	public String getServerVersion() {
		return serverVersion;
	}

	public String getInstructions() {
		return instructions;
	}

	public Duration getDefaultTimeout() {
		return defaultTimeout;
	}

	public int getMaxConcurrency() {
		return maxConcurrency;
	}

	public Map<String, Integer> getPerToolLimits() {
		return perToolLimits;
	}

	public Map<String, Duration> getPerToolTimeouts() {
		return perToolTimeouts;
	}

	public SizeLimits getSizeLimits() {
		return sizeLimits;
	}

	public String getLogLevel() {
		return logLevel;
	}

	public String getLogPattern() {
		return logPattern;
	}

	public boolean isIncludeCorrelationIds() {
		return includeCorrelationIds;
	}

	@Override
	public String toString() {
		return "McpServerConfig{serverName=" + serverName + ", serverVersion=" + serverVersion + ", defaultTimeout="
				+ defaultTimeout + ", maxConcurrency=" + maxConcurrency + ", perToolLimits=" + perToolLimits
				+ ", perToolTimeouts=" + perToolTimeouts + ", sizeLimits=" + sizeLimits + ", logLevel=" + logLevel
				+ "}";
	}

	private static int intProperty(Properties properties, String key, int defaultValue) {
		String value = properties.getProperty(key);
		return Utils.hasText(value) ? parseInt(key, value) : defaultValue;
	}

	private static int parseInt(String key, String value) {
		try {
			return Integer.parseInt(value.trim());
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
		}
	}

	static Duration parseDuration(String key, String value) {
		String text = value.trim();
		try {
			if (text.startsWith("P") || text.startsWith("p")) {
				return Duration.parse(text);
			}
			return Duration.ofMillis(Long.parseLong(text));
		}
		catch (DateTimeParseException | NumberFormatException e) {
			throw new IllegalArgumentException("Invalid duration for " + key + ": " + value, e);
		}
	}

	public static class Builder {

		private String serverName = "fly-mcp";

		private String serverVersion = "0.1.0";

		private String instructions;

		private Duration defaultTimeout = DEFAULT_TIMEOUT;

		private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;

		private final Map<String, Integer> perToolLimits = new HashMap<>();

		private final Map<String, Duration> perToolTimeouts = new HashMap<>();

		private SizeLimits sizeLimits = SizeLimits.DEFAULT;

		private String logLevel = "INFO";

		private String logPattern = DEFAULT_LOG_PATTERN;

		private boolean includeCorrelationIds = true;

		private Builder() {
		}

		public Builder serverName(String serverName) {
			Assert.hasText(serverName, "serverName must not be empty");
			this.serverName = serverName;
			return this;
		}

		public Builder serverVersion(String serverVersion) {
			Assert.hasText(serverVersion, "serverVersion must not be empty");
			this.serverVersion = serverVersion;
			return this;
		}

		public Builder instructions(String instructions) {
			this.instructions = instructions;
			return this;
		}

		public Builder defaultTimeout(Duration defaultTimeout) {
			Assert.notNull(defaultTimeout, "defaultTimeout must not be null");
			this.defaultTimeout = defaultTimeout;
			return this;
		}

		public Builder maxConcurrency(int maxConcurrency) {
			this.maxConcurrency = maxConcurrency;
			return this;
		}

		public Builder toolConcurrency(String key, int limit) {
			Assert.hasText(key, "key must not be empty");
			this.perToolLimits.put(key, limit);
			return this;
		}

		public Builder toolTimeout(String key, Duration timeout) {
			Assert.hasText(key, "key must not be empty");
			Assert.notNull(timeout, "timeout must not be null");
			this.perToolTimeouts.put(key, timeout);
			return this;
		}

		public Builder sizeLimits(SizeLimits sizeLimits) {
			Assert.notNull(sizeLimits, "sizeLimits must not be null");
			this.sizeLimits = sizeLimits;
			return this;
		}

		public Builder logLevel(String logLevel) {
			Assert.hasText(logLevel, "logLevel must not be empty");
			this.logLevel = logLevel;
			return this;
		}

		public Builder logPattern(String logPattern) {
			Assert.hasText(logPattern, "logPattern must not be empty");
			this.logPattern = logPattern;
			return this;
		}

		public Builder includeCorrelationIds(boolean includeCorrelationIds) {
			this.includeCorrelationIds = includeCorrelationIds;
			return this;
		}

		/**
		 * Builds and validates the configuration.
		 * @return the configuration
		 * @throws IllegalArgumentException if a setting is invalid
		 */
		public McpServerConfig build() {
			McpServerConfig config = new McpServerConfig(this);
			config.validate();
			return config;
		}

	}

}
