/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import io.flymcp.json.McpJsonMapper;
import io.flymcp.json.schema.JsonSchemaValidator;
import io.flymcp.server.error.ErrorConverter;
import io.flymcp.server.error.InternalServerException;
import io.flymcp.server.error.InvalidParamsException;
import io.flymcp.server.error.PermissionDeniedException;
import io.flymcp.server.error.RequestCancelledException;
import io.flymcp.server.error.ValidationException;
import io.flymcp.server.registry.AbstractDefinition;
import io.flymcp.server.registry.PromptDefinition;
import io.flymcp.server.registry.PromptRegistry;
import io.flymcp.server.registry.ResourceDefinition;
import io.flymcp.server.registry.ResourceRegistry;
import io.flymcp.server.registry.ToolDefinition;
import io.flymcp.server.registry.ToolRegistry;
import io.flymcp.spec.McpSchema;
import io.flymcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.util.annotation.Nullable;

/**
 * Executes {@code tools/call}, {@code resources/read} and {@code prompts/get} requests.
 * <p>
 * A call is admitted in stages, each of which may reject it without invoking the
 * handler: the definition is resolved, the arguments are measured and validated against
 * the parameter schema, the confirmation flag is checked and the concurrency limiter is
 * consulted. An admitted call registers a fresh {@link CancellationToken} under its
 * request id, takes a limiter slot and runs its handler inside the timeout guard, racing
 * the token's cancel signal. Whatever the outcome, the slot is released and the token
 * removed.
 * <p>
 * Everything up to the token registration happens on the subscribing thread, so a
 * cancel notification read after the request always finds its token.
 */
public class McpCallPipeline {

	private static final Logger logger = LoggerFactory.getLogger(McpCallPipeline.class);

	/**
	 * Argument that must be {@code true} for definitions requiring confirmation.
	 */
	public static final String CONFIRM = "confirm";

	private final McpServerConfig config;

	private final ToolRegistry tools;

	private final ResourceRegistry resources;

	private final PromptRegistry prompts;

	private final ConcurrencyLimiter limiter;

	private final CancellationRegistry cancellations;

	private final SizeValidator sizeValidator;

	private final JsonSchemaValidator schemaValidator;

	private final McpJsonMapper jsonMapper;

	public McpCallPipeline(McpServerConfig config, ToolRegistry tools, ResourceRegistry resources,
			PromptRegistry prompts, ConcurrencyLimiter limiter, CancellationRegistry cancellations,
			SizeValidator sizeValidator, JsonSchemaValidator schemaValidator, McpJsonMapper jsonMapper) {
		Assert.notNull(config, "config must not be null");
		Assert.notNull(tools, "tools must not be null");
		Assert.notNull(resources, "resources must not be null");
		Assert.notNull(prompts, "prompts must not be null");
		Assert.notNull(limiter, "limiter must not be null");
		Assert.notNull(cancellations, "cancellations must not be null");
		Assert.notNull(sizeValidator, "sizeValidator must not be null");
		Assert.notNull(schemaValidator, "schemaValidator must not be null");
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		this.config = config;
		this.tools = tools;
		this.resources = resources;
		this.prompts = prompts;
		this.limiter = limiter;
		this.cancellations = cancellations;
		this.sizeValidator = sizeValidator;
		this.schemaValidator = schemaValidator;
		this.jsonMapper = jsonMapper;
	}

	/**
	 * Calls a tool.
	 * @param exchange the request exchange
	 * @param params the request params {@code {name, arguments?, _meta?}}
	 * @return the tool result
	 */
	public Mono<McpSchema.CallToolResult> callTool(McpServerExchange exchange, Map<String, Object> params) {
		return Mono.defer(() -> {
			String name = requireText(params, "name");
			Map<String, Object> arguments = mapParam(params, "arguments");
			ToolDefinition definition = tools.require(name);
			return run(exchange, definition, arguments, progressToken(params),
					result -> toCallToolResult(definition, result));
		});
	}

	/**
	 * Reads a resource. The handler receives the request params without {@code _meta},
	 * including the requested {@code uri}.
	 * @param exchange the request exchange
	 * @param params the request params {@code {uri, _meta?}}
	 * @return the resource contents
	 */
	public Mono<McpSchema.ReadResourceResult> readResource(McpServerExchange exchange, Map<String, Object> params) {
		return Mono.defer(() -> {
			String uri = requireText(params, "uri");
			ResourceDefinition definition = resources.require(uri);
			Map<String, Object> arguments = new LinkedHashMap<>(params);
			arguments.remove(McpSchema.META);
			return run(exchange, definition, arguments, progressToken(params),
					result -> toReadResourceResult(definition, uri, result));
		});
	}

	/**
	 * Renders a prompt.
	 * @param exchange the request exchange
	 * @param params the request params {@code {name, arguments?, _meta?}}
	 * @return the prompt messages
	 */
	public Mono<McpSchema.GetPromptResult> getPrompt(McpServerExchange exchange, Map<String, Object> params) {
		return Mono.defer(() -> {
			String name = requireText(params, "name");
			Map<String, Object> arguments = mapParam(params, "arguments");
			PromptDefinition definition = prompts.require(name);
			checkRequiredArguments(definition, arguments);
			return run(exchange, definition, arguments, progressToken(params),
					result -> toGetPromptResult(definition, result));
		});
	}

	/**
	 * Resolves the timeout of a definition: a configured per-key timeout wins over the
	 * definition's own timeout, which wins over the default.
	 * @param definition the definition
	 * @return the effective timeout
	 */
	Duration timeoutFor(AbstractDefinition definition) {
		Duration configured = config.getPerToolTimeouts().get(definition.admissionKey());
		if (configured != null) {
			return configured;
		}
		return (definition.getTimeout() != null) ? definition.getTimeout() : config.getDefaultTimeout();
	}

	private <T> Mono<T> run(McpServerExchange exchange, AbstractDefinition definition, Map<String, Object> arguments,
			@Nullable Object progressToken, Function<Object, T> converter) {
		String admissionKey = definition.admissionKey();

		sizeValidator.validateParameters(arguments);
		validateArguments(definition, arguments);
		checkConfirmation(definition, arguments);
		limiter.defaultLimit(admissionKey, definition.getMaxConcurrency());
		if (!limiter.canStart(admissionKey)) {
			throw limiter.limitExceeded(admissionKey);
		}

		Object requestId = exchange.getRequestId();
		CancellationToken token = new CancellationToken(requestId);
		cancellations.register(requestId, token);

		ProgressNotifier progress = ProgressNotifier.of(exchange, progressToken);
		Duration timeout = timeoutFor(definition);
		String label = label(definition.getName());
		long startNanos = System.nanoTime();

		Mono<T> execution = Mono.defer(() -> definition.getHandler().handle(arguments, token, progress))
			.map(Optional::of)
			.defaultIfEmpty(Optional.empty())
			.map(result -> converter.apply(result.orElse(null)));
		Mono<T> cancelled = token.onCancel().then(Mono.error(() -> new RequestCancelledException(requestId)));

		return limiter
			.execute(admissionKey,
					TimeoutGuard.withTimeout(Mono.firstWithSignal(execution, cancelled), timeout, definition.getName()))
			.doOnSubscribe(subscription -> logger.info("[{}] Starting {} (request {})", label, admissionKey,
					requestId))
			.doOnSuccess(result -> logger.info("[{}] Completed in {} ms", label, elapsedMillis(startNanos)))
			.doOnError(error -> {
				if (ErrorConverter.isKnownError(error)) {
					logger.warn("[{}] Failed after {} ms: {}", label, elapsedMillis(startNanos), error.getMessage());
				}
				else {
					logger.error("[{}] Failed after {} ms", label, elapsedMillis(startNanos), error);
				}
			})
			.doFinally(signal -> {
				cancellations.remove(requestId, token);
				if (signal != SignalType.ON_COMPLETE) {
					// stop cooperative handlers that lost the race
					token.cancel();
				}
			});
	}

	private void validateArguments(AbstractDefinition definition, Map<String, Object> arguments) {
		Map<String, Object> schema = definition.getParamsSchema();
		if (schema == null) {
			return;
		}
		JsonSchemaValidator.ValidationResponse response = schemaValidator.validate(schema, arguments);
		if (!response.valid()) {
			throw new ValidationException("Invalid parameters for " + definition.getName() + ": "
					+ response.errorMessage(), response.fieldErrors());
		}
	}

	private static void checkConfirmation(AbstractDefinition definition, Map<String, Object> arguments) {
		if (definition.isRequiresConfirmation() && !Boolean.TRUE.equals(arguments.get(CONFIRM))) {
			throw new PermissionDeniedException(
					definition.getName() + " requires confirmation: set \"" + CONFIRM + "\": true",
					"confirmation_required");
		}
	}

	private static void checkRequiredArguments(PromptDefinition definition, Map<String, Object> arguments) {
		List<String> missing = new ArrayList<>();
		for (McpSchema.PromptArgument argument : definition.getArguments()) {
			if (Boolean.TRUE.equals(argument.required()) && arguments.get(argument.name()) == null) {
				missing.add(argument.name());
			}
		}
		if (!missing.isEmpty()) {
			throw new InvalidParamsException("Missing required arguments for prompt " + definition.getName() + ": "
					+ String.join(", ", missing), missing, List.of());
		}
	}

	private McpSchema.CallToolResult toCallToolResult(ToolDefinition definition, @Nullable Object result) {
		sizeValidator.validateResult(result);
		if (result instanceof McpSchema.CallToolResult callToolResult) {
			return callToolResult;
		}
		String text = (result instanceof String string) ? string : toJson(result);
		Map<String, Object> resultSchema = definition.getResultSchema();
		if (resultSchema == null) {
			return McpSchema.CallToolResult.text(text, null);
		}
		Object json = (result != null) ? jsonMapper.convertValue(result, Object.class) : null;
		Object structured = (json instanceof Map) ? json : Collections.singletonMap("result", json);
		JsonSchemaValidator.ValidationResponse response = schemaValidator.validate(resultSchema, structured);
		if (!response.valid()) {
			throw new InternalServerException("Result schema validation failed: " + response.errorMessage(), null,
					Map.of("tool", definition.getName(), "fieldErrors", response.fieldErrors()));
		}
		return McpSchema.CallToolResult.text(text, structured);
	}

	private McpSchema.ReadResourceResult toReadResourceResult(ResourceDefinition definition, String uri,
			@Nullable Object result) {
		if (result instanceof McpSchema.ReadResourceResult readResourceResult) {
			readResourceResult.contents().forEach(contents -> sizeValidator.validateResourceContent(contents.text()));
			return readResourceResult;
		}
		McpSchema.TextResourceContents contents;
		if (result instanceof McpSchema.TextResourceContents textContents) {
			contents = textContents;
		}
		else {
			String text = (result instanceof String string) ? string : toJson(result);
			contents = new McpSchema.TextResourceContents(uri, definition.getMimeType(), text);
		}
		sizeValidator.validateResourceContent(contents.text());
		return new McpSchema.ReadResourceResult(List.of(contents));
	}

	private McpSchema.GetPromptResult toGetPromptResult(PromptDefinition definition, @Nullable Object result) {
		sizeValidator.validateResult(result);
		if (result instanceof McpSchema.GetPromptResult getPromptResult) {
			return getPromptResult;
		}
		if (result == null) {
			return new McpSchema.GetPromptResult(definition.getDescription(), List.of());
		}
		if (result instanceof String text) {
			return new McpSchema.GetPromptResult(definition.getDescription(),
					List.of(new McpSchema.PromptMessage(McpSchema.Role.USER, new McpSchema.TextContent(text))));
		}
		try {
			return jsonMapper.convertValue(result, McpSchema.GetPromptResult.class);
		}
		catch (IllegalArgumentException e) {
			throw new InternalServerException("Prompt " + definition.getName() + " returned an invalid result", e);
		}
	}

	private String toJson(@Nullable Object value) {
		try {
			return jsonMapper.writeValueAsString(value);
		}
		catch (IOException e) {
			throw new InternalServerException("Failed to serialize result: " + e.getMessage(), e);
		}
	}

	private String label(String name) {
		if (!config.isIncludeCorrelationIds()) {
			return name;
		}
		return "req_" + name + "_" + ChronoUnit.MICROS.between(Instant.EPOCH, Instant.now());
	}

	private static long elapsedMillis(long startNanos) {
		return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
	}

	@Nullable
	private static Object progressToken(Map<String, Object> params) {
		Object meta = params.get(McpSchema.META);
		if (meta instanceof Map<?, ?> metaMap) {
			return metaMap.get(McpSchema.PROGRESS_TOKEN);
		}
		return null;
	}

	private static String requireText(Map<String, Object> params, String field) {
		Object value = params.get(field);
		if (value == null) {
			throw new InvalidParamsException("Missing required parameter: " + field, List.of(field), List.of());
		}
		if (!(value instanceof String) || ((String) value).isEmpty()) {
			throw new InvalidParamsException("Parameter " + field + " must be a non-empty string", List.of(),
					List.of(field));
		}
		return (String) value;
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> mapParam(Map<String, Object> params, String field) {
		Object value = params.get(field);
		if (value == null) {
			return Map.of();
		}
		if (value instanceof Map) {
			return (Map<String, Object>) value;
		}
		throw new InvalidParamsException("Parameter " + field + " must be an object", List.of(), List.of(field));
	}

}
