/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.json.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.flymcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default implementation of the {@link JsonSchemaValidator} interface. It uses the
 * NetworkNT JSON Schema Validator library (draft 2020-12) and caches compiled schemas
 * by their JSON text.
 */
public class DefaultJsonSchemaValidator implements JsonSchemaValidator {

	private static final Logger logger = LoggerFactory.getLogger(DefaultJsonSchemaValidator.class);

	private static final String ROOT_FIELD = "$";

	private final ObjectMapper objectMapper;

	private final JsonSchemaFactory schemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

	private final ConcurrentHashMap<String, JsonSchema> schemaCache = new ConcurrentHashMap<>();

	public DefaultJsonSchemaValidator() {
		this(new ObjectMapper());
	}

	public DefaultJsonSchemaValidator(ObjectMapper objectMapper) {
		Assert.notNull(objectMapper, "ObjectMapper must not be null");
		this.objectMapper = objectMapper;
	}

	@Override
	public ValidationResponse validate(Map<String, Object> schema, Object content) {
		Assert.notNull(schema, "Schema must not be null");

		try {
			String schemaText = this.objectMapper.writeValueAsString(schema);
			JsonSchema jsonSchema = this.schemaCache.computeIfAbsent(schemaText, this.schemaFactory::getSchema);

			JsonNode contentNode = this.objectMapper.valueToTree(content);

			Set<ValidationMessage> validationResult = jsonSchema.validate(contentNode);
			if (validationResult.isEmpty()) {
				return ValidationResponse.asValid();
			}

			Map<String, List<String>> fieldErrors = new LinkedHashMap<>();
			for (ValidationMessage message : validationResult) {
				fieldErrors.computeIfAbsent(fieldOf(message), k -> new ArrayList<>()).add(message.getMessage());
			}
			logger.debug("Schema validation failed: {}", validationResult);
			return ValidationResponse.asInvalid("Validation failed: " + validationResult, fieldErrors);
		}
		catch (JsonProcessingException | IllegalArgumentException e) {
			logger.warn("Failed to validate content: error parsing schema", e);
			return ValidationResponse.asInvalid("Error parsing JSON Schema: " + e.getMessage(),
					Map.of(ROOT_FIELD, List.of(String.valueOf(e.getMessage()))));
		}
	}

	private static String fieldOf(ValidationMessage message) {
		if (message.getProperty() != null) {
			return message.getProperty();
		}
		String location = message.getInstanceLocation() != null ? message.getInstanceLocation().toString() : null;
		if (location == null || location.isEmpty() || ROOT_FIELD.equals(location)) {
			return ROOT_FIELD;
		}
		return location.startsWith("$.") ? location.substring(2) : location;
	}

}
