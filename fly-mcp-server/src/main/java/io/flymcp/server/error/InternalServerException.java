/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.error;

import java.util.Map;

import reactor.util.annotation.Nullable;

public class InternalServerException extends McpServerException {

	public InternalServerException(String message, @Nullable Throwable cause) {
		super(message, cause, null);
	}

	public InternalServerException(String message, @Nullable Throwable cause, @Nullable Map<String, Object> context) {
		super(message, cause, context);
	}

}
