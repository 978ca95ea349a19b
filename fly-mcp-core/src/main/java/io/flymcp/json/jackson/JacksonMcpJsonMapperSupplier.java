/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.json.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import io.flymcp.json.McpJsonMapper;
import io.flymcp.json.McpJsonMapperSupplier;

public class JacksonMcpJsonMapperSupplier implements McpJsonMapperSupplier {

	@Override
	public McpJsonMapper get() {
		JsonMapper jsonMapper = JsonMapper.builder()
			.disable(MapperFeature.CAN_OVERRIDE_ACCESS_MODIFIERS)
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.addModule(new ParameterNamesModule())
			.build();
		return new JacksonMcpJsonMapper(jsonMapper);
	}

}
