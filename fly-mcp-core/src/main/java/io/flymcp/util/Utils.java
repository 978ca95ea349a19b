/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.util;

import reactor.util.annotation.Nullable;

/**
 * String and request id helpers.
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Returns whether the string holds at least one non-whitespace character.
	 * @param str the string, may be {@code null}
	 * @return {@code false} for {@code null}, empty and blank strings
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Normalizes a JSON-RPC request id so that numeric ids compare by value regardless of
	 * the boxed type the JSON decoder produced.
	 * @param id the request id, a {@link String} or a {@link Number}
	 * @return a {@link Long} for integral numbers, the id itself otherwise
	 */
	public static Object normalizeId(@Nullable Object id) {
		if (id instanceof Integer || id instanceof Long || id instanceof Short || id instanceof Byte) {
			return ((Number) id).longValue();
		}
		return id;
	}

}
