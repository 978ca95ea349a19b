package io.flymcp.examples.stdio;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

import io.flymcp.json.McpJsonMapper;
import io.flymcp.json.TypeRef;

final class Schemas {

	private static final McpJsonMapper MAPPER = McpJsonMapper.createDefault();

	private Schemas() {
	}

	static Map<String, Object> schema(String json) {
		try {
			return MAPPER.readValue(json, new TypeRef<Map<String, Object>>() {
			});
		}
		catch (IOException e) {
			throw new UncheckedIOException("Invalid schema: " + json, e);
		}
	}

}
