package io.flymcp.examples.stdio;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import io.flymcp.server.McpHandler;
import io.flymcp.server.registry.ToolDefinition;
import reactor.core.publisher.Mono;

import static io.flymcp.examples.stdio.Schemas.schema;

/**
 * Tools served by the example server.
 */
public final class Tools {

	static final String ECHO_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"message": {
						"type": "string"
					},
					"delayMs": {
						"type": "integer",
						"minimum": 0
					}
				},
				"required": ["message"]
			}
			""";

	static final String ECHO_RESULT_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"echo": {
						"type": "string"
					}
				},
				"required": ["echo"]
			}
			""";

	static final String PROCESS_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"steps": {
						"type": "integer",
						"minimum": 1,
						"maximum": 100
					},
					"stepDelayMs": {
						"type": "integer",
						"minimum": 0
					}
				},
				"required": ["steps"]
			}
			""";

	static final String CLEAR_LOG_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"runId": {
						"type": "string"
					},
					"confirm": {
						"type": "boolean"
					}
				},
				"required": ["runId"]
			}
			""";

	private Tools() {
	}

	/**
	 * Echoes its message back, optionally after a delay. Only one call runs at a time.
	 * @return the tool
	 */
	public static ToolDefinition echo() {
		McpHandler handler = (params, token, progress) -> {
			Map<String, Object> result = Map.of("echo", String.valueOf(params.get("message")));
			long delay = ((Number) params.getOrDefault("delayMs", 0)).longValue();
			if (delay == 0) {
				return Mono.just(result);
			}
			return Mono.<Object>just(result).delayElement(Duration.ofMillis(delay));
		};
		return ToolDefinition.builder()
			.name("echo")
			.description("Echoes the message back")
			.paramsSchema(schema(ECHO_SCHEMA))
			.resultSchema(schema(ECHO_RESULT_SCHEMA))
			.readOnly(true)
			.idempotent(true)
			.maxConcurrency(1)
			.handler(handler)
			.build();
	}

	/**
	 * Simulates a long running job, reporting progress and writing each step to a run
	 * log. Observes cancellation between steps.
	 * @param runLogs the run log store
	 * @return the tool
	 */
	public static ToolDefinition process(RunLogResourceProvider runLogs) {
		McpHandler handler = McpHandler.sync((params, token, progress) -> {
			int steps = ((Number) params.get("steps")).intValue();
			long stepDelay = ((Number) params.getOrDefault("stepDelayMs", 100)).longValue();
			String runId = UUID.randomUUID().toString();
			for (int step = 1; step <= steps; step++) {
				token.throwIfCancelled();
				Thread.sleep(stepDelay);
				runLogs.append(runId, "step " + step + "/" + steps + " done");
				progress.notifyProgress("Completed step " + step, step * 100 / steps).block();
			}
			Map<String, Object> result = new LinkedHashMap<>();
			result.put("runId", runId);
			result.put("steps", steps);
			result.put("log", RunLogResourceProvider.URI_PREFIX + runId);
			return result;
		});
		return ToolDefinition.builder()
			.name("process")
			.description("Runs a simulated job and records its output under logs://run/<runId>")
			.paramsSchema(schema(PROCESS_SCHEMA))
			.timeout(Duration.ofMinutes(1))
			.handler(handler)
			.build();
	}

	/**
	 * Deletes a run log. Requires {@code "confirm": true}.
	 * @param runLogs the run log store
	 * @return the tool
	 */
	public static ToolDefinition clearRunLog(RunLogResourceProvider runLogs) {
		McpHandler handler = (params, token, progress) -> Mono
			.fromCallable(() -> Map.of("cleared", runLogs.clear(String.valueOf(params.get("runId")))));
		return ToolDefinition.builder()
			.name("clear_run_log")
			.description("Deletes the log of a run")
			.paramsSchema(schema(CLEAR_LOG_SCHEMA))
			.requiresConfirmation(true)
			.idempotent(true)
			.handler(handler)
			.build();
	}

}
