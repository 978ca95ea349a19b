/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.error;

public class RequestCancelledException extends McpServerException {

	private final Object requestId;

	public RequestCancelledException(Object requestId) {
		super("Request cancelled: " + requestId);
		this.requestId = requestId;
	}

	public Object getRequestId() {
		return requestId;
	}

}
