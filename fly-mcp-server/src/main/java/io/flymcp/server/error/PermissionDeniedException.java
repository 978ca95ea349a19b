/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.error;

import reactor.util.annotation.Nullable;

public class PermissionDeniedException extends McpServerException {

	private final String reason;

	public PermissionDeniedException(String message, @Nullable String reason) {
		super(message);
		this.reason = reason;
	}

	@Nullable
	public String getReason() {
		return reason;
	}

}
