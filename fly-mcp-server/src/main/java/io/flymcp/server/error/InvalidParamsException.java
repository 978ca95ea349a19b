/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.error;

import java.util.List;

/**
 * Structurally invalid parameters: missing fields, fields of the wrong shape, or
 * payloads exceeding a size limit.
 */
public class InvalidParamsException extends McpServerException {

	private final List<String> missingFields;

	private final List<String> invalidFields;

	public InvalidParamsException(String message) {
		this(message, List.of(), List.of());
	}

	public InvalidParamsException(String message, List<String> missingFields, List<String> invalidFields) {
		super(message);
		this.missingFields = (missingFields != null) ? List.copyOf(missingFields) : List.of();
		this.invalidFields = (invalidFields != null) ? List.copyOf(invalidFields) : List.of();
	}

	public List<String> getMissingFields() {
		return missingFields;
	}

	public List<String> getInvalidFields() {
		return invalidFields;
	}

}
