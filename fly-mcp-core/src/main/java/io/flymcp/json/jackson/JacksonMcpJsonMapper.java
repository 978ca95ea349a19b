/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.json.jackson;

import java.io.IOException;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.flymcp.json.McpJsonMapper;
import io.flymcp.json.TypeRef;
import io.flymcp.util.Assert;

/**
 * Jackson-based implementation of {@link McpJsonMapper}.
 */
public final class JacksonMcpJsonMapper implements McpJsonMapper {

	private final ObjectMapper objectMapper;

	/**
	 * Creates a mapper delegating to the given Jackson {@link ObjectMapper}.
	 * @param objectMapper the Jackson mapper, must not be null
	 */
	public JacksonMcpJsonMapper(ObjectMapper objectMapper) {
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		this.objectMapper = objectMapper;
	}

	/**
	 * Returns the underlying Jackson {@link ObjectMapper}.
	 * @return the object mapper
	 */
	public ObjectMapper getObjectMapper() {
		return objectMapper;
	}

	@Override
	public <T> T readValue(String content, Class<T> type) throws IOException {
		return objectMapper.readValue(content, type);
	}

	@Override
	public <T> T readValue(String content, TypeRef<T> type) throws IOException {
		JavaType javaType = objectMapper.getTypeFactory().constructType(type.getType());
		return objectMapper.readValue(content, javaType);
	}

	@Override
	public <T> T convertValue(Object fromValue, Class<T> type) {
		return objectMapper.convertValue(fromValue, type);
	}

	@Override
	public <T> T convertValue(Object fromValue, TypeRef<T> type) {
		JavaType javaType = objectMapper.getTypeFactory().constructType(type.getType());
		return objectMapper.convertValue(fromValue, javaType);
	}

	@Override
	public String writeValueAsString(Object value) throws IOException {
		return objectMapper.writeValueAsString(value);
	}

	@Override
	public byte[] writeValueAsBytes(Object value) throws IOException {
		return objectMapper.writeValueAsBytes(value);
	}

}
