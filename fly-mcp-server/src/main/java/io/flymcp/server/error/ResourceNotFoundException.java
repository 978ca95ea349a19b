/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.error;

public class ResourceNotFoundException extends McpServerException {

	private final String uri;

	public ResourceNotFoundException(String uri) {
		super("Resource not found: " + uri);
		this.uri = uri;
	}

	public String getUri() {
		return uri;
	}

}
