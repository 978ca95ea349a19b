/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.error;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

import io.flymcp.spec.McpError;
import io.flymcp.spec.McpSchema.ErrorCodes;
import io.flymcp.spec.McpSchema.JSONRPCResponse.JSONRPCError;
import reactor.util.annotation.Nullable;

/**
 * Converts failures raised while serving a request into JSON-RPC error objects. Every
 * throwable maps to exactly one error; unknown throwables become
 * {@link ErrorCodes#INTERNAL_ERROR} without exposing a stack trace.
 */
public final class ErrorConverter {

	private ErrorConverter() {
	}

	/**
	 * Converts a throwable into a JSON-RPC error.
	 * @param error the failure
	 * @param requestId the id of the request being answered, merged into the error data
	 * when not null and the data is absent or an object
	 * @return the wire error
	 */
	public static JSONRPCError toJsonRpcError(Throwable error, @Nullable Object requestId) {
		Map<String, Object> data = new LinkedHashMap<>();

		if (error instanceof McpError mcpError) {
			JSONRPCError wireError = mcpError.getJsonRpcError();
			if (requestId == null || (wireError.data() != null && !(wireError.data() instanceof Map))) {
				return wireError;
			}
			if (wireError.data() instanceof Map<?, ?> existing) {
				existing.forEach((key, value) -> data.put(String.valueOf(key), value));
			}
			return error(wireError.code(), wireError.message(), data, requestId);
		}

		if (error instanceof ToolNotFoundException e) {
			data.put("tool", e.getToolName());
			return error(ErrorCodes.NOT_FOUND, e.getMessage(), data, requestId);
		}
		if (error instanceof ResourceNotFoundException e) {
			data.put("uri", e.getUri());
			return error(ErrorCodes.NOT_FOUND, e.getMessage(), data, requestId);
		}
		if (error instanceof PromptNotFoundException e) {
			data.put("promptId", e.getPromptId());
			return error(ErrorCodes.NOT_FOUND, e.getMessage(), data, requestId);
		}
		if (error instanceof MethodNotFoundException e) {
			data.put("method", e.getMethodName());
			return error(ErrorCodes.METHOD_NOT_FOUND, e.getMessage(), data, requestId);
		}
		if (error instanceof ValidationException e) {
			if (!e.getFieldErrors().isEmpty()) {
				data.put("fieldErrors", e.getFieldErrors());
			}
			return error(ErrorCodes.INVALID_PARAMS, e.getMessage(), data, requestId);
		}
		if (error instanceof InvalidParamsException e) {
			if (!e.getMissingFields().isEmpty()) {
				data.put("missingFields", e.getMissingFields());
			}
			if (!e.getInvalidFields().isEmpty()) {
				data.put("invalidFields", e.getInvalidFields());
			}
			return error(ErrorCodes.INVALID_PARAMS, e.getMessage(), data, requestId);
		}
		if (error instanceof RequestCancelledException e) {
			data.put("requestId", e.getRequestId() != null ? e.getRequestId() : requestId);
			return new JSONRPCError(ErrorCodes.REQUEST_CANCELLED, e.getMessage(), data);
		}
		if (error instanceof OperationTimeoutException e) {
			data.put("timeout", e.getTimeout().toSeconds());
			if (e.getOperationName() != null) {
				data.put("operation", e.getOperationName());
			}
			return error(ErrorCodes.REQUEST_TIMEOUT, e.getMessage(), data, requestId);
		}
		if (error instanceof ConcurrencyLimitException e) {
			data.put("tool", e.getToolName());
			data.put("current", e.getCurrent());
			data.put("limit", e.getLimit());
			return error(ErrorCodes.PERMISSION_DENIED, e.getMessage(), data, requestId);
		}
		if (error instanceof PermissionDeniedException e) {
			if (e.getReason() != null) {
				data.put("reason", e.getReason());
			}
			return error(ErrorCodes.PERMISSION_DENIED, e.getMessage(), data, requestId);
		}
		if (error instanceof InternalServerException e) {
			if (!e.getContext().isEmpty()) {
				data.putAll(e.getContext());
			}
			return error(ErrorCodes.INTERNAL_ERROR, e.getMessage(), data, requestId);
		}
		if (error instanceof CancellationException) {
			return error(ErrorCodes.REQUEST_CANCELLED, error.toString(), data, requestId);
		}
		if (error instanceof TimeoutException) {
			return error(ErrorCodes.REQUEST_TIMEOUT, error.toString(), data, requestId);
		}

		data.put("error", error.toString());
		return error(ErrorCodes.INTERNAL_ERROR, "Internal server error: " + error.getMessage(), data, requestId);
	}

	/**
	 * Whether the throwable belongs to the taxonomy reported with a specific code.
	 * @param error the failure
	 * @return {@code true} unless the failure would be reported as an unknown internal
	 * error
	 */
	public static boolean isKnownError(Throwable error) {
		return error instanceof McpServerException || error instanceof McpError
				|| error instanceof CancellationException || error instanceof TimeoutException;
	}

	private static JSONRPCError error(int code, String message, Map<String, Object> data,
			@Nullable Object requestId) {
		if (requestId != null) {
			data.put("requestId", requestId);
		}
		return new JSONRPCError(code, message, data.isEmpty() ? null : data);
	}

}
