/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.json.schema;

import java.util.List;
import java.util.Map;

/**
 * Validates call parameters and results against a JSON schema.
 */
public interface JsonSchemaValidator {

	/**
	 * Represents the result of a validation operation.
	 *
	 * @param valid Indicates whether the validation was successful.
	 * @param errorMessage An error message if the validation failed, otherwise null.
	 * @param fieldErrors Validation messages keyed by the offending field, empty when
	 * valid. Errors that cannot be attributed to a field are keyed by {@code "$"}.
	 */
	record ValidationResponse(boolean valid, String errorMessage, Map<String, List<String>> fieldErrors) {

		public static ValidationResponse asValid() {
			return new ValidationResponse(true, null, Map.of());
		}

		public static ValidationResponse asInvalid(String message, Map<String, List<String>> fieldErrors) {
			return new ValidationResponse(false, message, fieldErrors);
		}
	}

	/**
	 * Validates the content against the provided JSON schema.
	 * @param schema The JSON schema to validate against.
	 * @param content The content to validate, usually a map of arguments.
	 * @return A ValidationResponse indicating whether the validation was successful or
	 * not.
	 */
	ValidationResponse validate(Map<String, Object> schema, Object content);

}
