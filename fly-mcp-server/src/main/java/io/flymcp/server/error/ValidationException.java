/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.error;

import java.util.List;
import java.util.Map;

/**
 * Parameters or results that do not match their JSON schema.
 */
public class ValidationException extends McpServerException {

	private final Map<String, List<String>> fieldErrors;

	public ValidationException(String message, Map<String, List<String>> fieldErrors) {
		super(message);
		this.fieldErrors = (fieldErrors != null) ? Map.copyOf(fieldErrors) : Map.of();
	}

	public Map<String, List<String>> getFieldErrors() {
		return fieldErrors;
	}

}
