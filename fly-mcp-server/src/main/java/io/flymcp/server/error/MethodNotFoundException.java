/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.error;

public class MethodNotFoundException extends McpServerException {

	private final String methodName;

	public MethodNotFoundException(String methodName) {
		super("Method not found: " + methodName);
		this.methodName = methodName;
	}

	public String getMethodName() {
		return methodName;
	}

}
