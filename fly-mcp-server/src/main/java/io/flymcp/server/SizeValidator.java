/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import io.flymcp.json.McpJsonMapper;
import io.flymcp.server.error.InvalidParamsException;
import io.flymcp.util.Assert;

/**
 * Measures payloads as UTF-8 encoded JSON and rejects those above the configured
 * {@link SizeLimits}.
 */
public class SizeValidator {

	private final SizeLimits limits;

	private final McpJsonMapper jsonMapper;

	public SizeValidator(SizeLimits limits, McpJsonMapper jsonMapper) {
		Assert.notNull(limits, "limits must not be null");
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		this.limits = limits;
		this.jsonMapper = jsonMapper;
	}

	public void validateParameters(Object params) {
		validateValueSize(params, limits.maxParameterSize(), "parameters");
	}

	public void validateResult(Object result) {
		validateValueSize(result, limits.maxResultSize(), "result");
	}

	public void validateResourceContent(String content) {
		long size = (content != null) ? content.getBytes(StandardCharsets.UTF_8).length : 0;
		if (size > limits.maxResourceSize()) {
			throw new InvalidParamsException("Resource content exceeds maximum size: " + size + " bytes > "
					+ limits.maxResourceSize() + " bytes", List.of(), List.of("content"));
		}
	}

	/**
	 * Validates the JSON size of a value.
	 * @param value the value to measure
	 * @param limit the maximum size in bytes
	 * @param name the field name reported on violation
	 * @throws InvalidParamsException if the value is too large or cannot be serialized
	 */
	public void validateValueSize(Object value, int limit, String name) {
		long size;
		try {
			size = jsonMapper.writeValueAsBytes(value).length;
		}
		catch (IOException e) {
			throw new InvalidParamsException("Failed to validate " + name + " size: " + e.getMessage(), List.of(),
					List.of(name));
		}
		if (size > limit) {
			throw new InvalidParamsException(name + " exceeds maximum size: " + size + " bytes > " + limit + " bytes",
					List.of(), List.of(name));
		}
	}

	public SizeLimits getLimits() {
		return limits;
	}

}
