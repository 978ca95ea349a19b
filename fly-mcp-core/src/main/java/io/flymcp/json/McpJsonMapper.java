/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.json;

import java.io.IOException;
import java.util.Iterator;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * JSON binding used by the codec, the validators and the call pipeline. Implementations
 * are discovered through {@link ServiceLoader} by {@link #createDefault()}; the Jackson
 * binding in {@code io.flymcp.json.jackson} is registered out of the box.
 */
public interface McpJsonMapper {

	<T> T readValue(String content, Class<T> type) throws IOException;

	<T> T readValue(String content, TypeRef<T> type) throws IOException;

	/**
	 * Converts an already decoded value, such as request params, to another type.
	 * @param fromValue the source value
	 * @param type the target class
	 * @return the converted value
	 * @param <T> the target type
	 * @throws IllegalArgumentException if the value does not fit the target type
	 */
	<T> T convertValue(Object fromValue, Class<T> type);

	<T> T convertValue(Object fromValue, TypeRef<T> type);

	String writeValueAsString(Object value) throws IOException;

	/**
	 * Serializes a value to UTF-8 JSON. Size limits are measured on these bytes.
	 * @param value the value to serialize
	 * @return the encoded JSON
	 * @throws IOException if the value cannot be serialized
	 */
	byte[] writeValueAsBytes(Object value) throws IOException;

	/**
	 * Creates a mapper from the first {@link McpJsonMapperSupplier} registered under
	 * {@code META-INF/services}. Suppliers that fail to load are skipped.
	 * @return the mapper
	 * @throws IllegalStateException if no supplier yields a mapper, with the failures
	 * of skipped suppliers attached as suppressed exceptions
	 */
	static McpJsonMapper createDefault() {
		IllegalStateException failure = new IllegalStateException("No McpJsonMapperSupplier could create a mapper");
		Iterator<McpJsonMapperSupplier> suppliers = ServiceLoader.load(McpJsonMapperSupplier.class).iterator();
		while (true) {
			McpJsonMapperSupplier supplier;
			try {
				if (!suppliers.hasNext()) {
					throw failure;
				}
				supplier = suppliers.next();
			}
			catch (ServiceConfigurationError e) {
				failure.addSuppressed(e);
				continue;
			}
			try {
				McpJsonMapper mapper = supplier.get();
				if (mapper != null) {
					return mapper;
				}
			}
			catch (RuntimeException e) {
				failure.addSuppressed(e);
			}
		}
	}

}
