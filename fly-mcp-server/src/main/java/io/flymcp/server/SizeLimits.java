/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server;

/**
 * Byte limits applied to UTF-8 JSON payloads.
 *
 * @param maxParameterSize largest accepted call parameters
 * @param maxResultSize largest result a handler may return
 * @param maxResourceSize largest resource content that may be read
 * @param maxMessageSize largest inbound frame body
 */
public record SizeLimits(int maxParameterSize, int maxResultSize, int maxResourceSize, int maxMessageSize) {

	public static final int MIB = 1024 * 1024;

	public static final SizeLimits DEFAULT = new SizeLimits(MIB, 10 * MIB, 50 * MIB, 2 * MIB);

	/**
	 * Checks that all limits are positive and that parameters fit in a message.
	 * @throws IllegalArgumentException if a limit is invalid
	 */
	public void validate() {
		if (maxParameterSize <= 0) {
			throw new IllegalArgumentException("maxParameterSize must be positive");
		}
		if (maxResultSize <= 0) {
			throw new IllegalArgumentException("maxResultSize must be positive");
		}
		if (maxResourceSize <= 0) {
			throw new IllegalArgumentException("maxResourceSize must be positive");
		}
		if (maxMessageSize <= 0) {
			throw new IllegalArgumentException("maxMessageSize must be positive");
		}
		if (maxParameterSize > maxMessageSize) {
			throw new IllegalArgumentException("maxParameterSize (" + maxParameterSize
					+ ") cannot exceed maxMessageSize (" + maxMessageSize + ")");
		}
	}

}
