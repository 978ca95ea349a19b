/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.flymcp.json.McpJsonMapper;
import io.flymcp.json.schema.DefaultJsonSchemaValidator;
import io.flymcp.server.error.ConcurrencyLimitException;
import io.flymcp.server.error.InternalServerException;
import io.flymcp.server.error.InvalidParamsException;
import io.flymcp.server.error.OperationTimeoutException;
import io.flymcp.server.error.PermissionDeniedException;
import io.flymcp.server.error.RequestCancelledException;
import io.flymcp.server.error.ToolNotFoundException;
import io.flymcp.server.error.ValidationException;
import io.flymcp.server.registry.PromptDefinition;
import io.flymcp.server.registry.PromptRegistry;
import io.flymcp.server.registry.ResourceDefinition;
import io.flymcp.server.registry.ResourceRegistry;
import io.flymcp.server.registry.ToolDefinition;
import io.flymcp.server.registry.ToolRegistry;
import io.flymcp.server.transport.McpServerTransport;
import io.flymcp.spec.McpSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class McpCallPipelineTests {

	private static final Map<String, Object> MESSAGE_SCHEMA = Map.of("type", "object", "properties",
			Map.of("message", Map.of("type", "string")), "required", List.of("message"));

	private static final Map<String, Object> ECHO_RESULT_SCHEMA = Map.of("type", "object", "properties",
			Map.of("echo", Map.of("type", "string")), "required", List.of("echo"));

	private final List<McpSchema.JSONRPCMessage> sent = new CopyOnWriteArrayList<>();

	private final ToolRegistry tools = new ToolRegistry();

	private final ResourceRegistry resources = new ResourceRegistry();

	private final PromptRegistry prompts = new PromptRegistry();

	private final ConcurrencyLimiter limiter = new ConcurrencyLimiter(10);

	private final CancellationRegistry cancellations = new CancellationRegistry();

	private McpServerSession session;

	private McpCallPipeline pipeline;

	@BeforeEach
	void setUp() {
		McpServerTransport transport = new McpServerTransport() {
			@Override
			public Mono<Void> sendMessage(McpSchema.JSONRPCMessage message) {
				return Mono.fromRunnable(() -> sent.add(message));
			}

			@Override
			public Mono<Void> closeGracefully() {
				return Mono.empty();
			}
		};
		session = new McpServerSession(transport, Map.of(), Map.of());
		pipeline = createPipeline(McpServerConfig.defaults());
	}

	private McpCallPipeline createPipeline(McpServerConfig config) {
		McpJsonMapper jsonMapper = McpJsonMapper.createDefault();
		return new McpCallPipeline(config, tools, resources, prompts, limiter, cancellations,
				new SizeValidator(new SizeLimits(64, 1024, 32, 2048), jsonMapper), new DefaultJsonSchemaValidator(),
				jsonMapper);
	}

	private McpServerExchange exchange(Object requestId) {
		return new McpServerExchange(session, requestId);
	}

	private static Map<String, Object> call(String name, Map<String, Object> arguments) {
		return Map.of("name", name, "arguments", arguments);
	}

	private void registerEcho() {
		tools.register(ToolDefinition.builder()
			.name("echo")
			.paramsSchema(MESSAGE_SCHEMA)
			.resultSchema(ECHO_RESULT_SCHEMA)
			.handler((params, token, progress) -> Mono.just(Map.of("echo", params.get("message"))))
			.build());
	}

	@Test
	void callsToolAndReturnsStructuredContent() {
		registerEcho();

		StepVerifier.create(pipeline.callTool(exchange(1), call("echo", Map.of("message", "hi"))))
			.assertNext(result -> {
				assertThat(result.content()).containsExactly(new McpSchema.TextContent("{\"echo\":\"hi\"}"));
				assertThat(result.structuredContent()).isEqualTo(Map.of("echo", "hi"));
				assertThat(result.isError()).isNull();
			})
			.verifyComplete();

		assertThat(cancellations.size()).isZero();
		assertThat(limiter.currentConcurrency()).isZero();
	}

	@Test
	void logsCallsWithCorrelationId() {
		registerEcho();
		ListAppender<ILoggingEvent> appender = new ListAppender<>();
		appender.start();
		Logger logger = (Logger) LoggerFactory.getLogger(McpCallPipeline.class);
		logger.addAppender(appender);
		try {
			StepVerifier.create(pipeline.callTool(exchange(7), call("echo", Map.of("message", "hi"))))
				.expectNextCount(1)
				.verifyComplete();
		}
		finally {
			logger.detachAppender(appender);
		}

		assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage)
			.anySatisfy(message -> assertThat(message).matches("\\[req_echo_\\d+] Starting echo \\(request 7\\)"))
			.anySatisfy(message -> assertThat(message).matches("\\[req_echo_\\d+] Completed in \\d+ ms"));
	}

	@Test
	void labelsCallsByNameWithoutCorrelationIds() {
		registerEcho();
		pipeline = createPipeline(McpServerConfig.builder().includeCorrelationIds(false).build());
		ListAppender<ILoggingEvent> appender = new ListAppender<>();
		appender.start();
		Logger logger = (Logger) LoggerFactory.getLogger(McpCallPipeline.class);
		logger.addAppender(appender);
		try {
			StepVerifier.create(pipeline.callTool(exchange(8), call("echo", Map.of("message", "hi"))))
				.expectNextCount(1)
				.verifyComplete();
		}
		finally {
			logger.detachAppender(appender);
		}

		assertThat(appender.list).extracting(ILoggingEvent::getFormattedMessage)
			.contains("[echo] Starting echo (request 8)");
	}

	@Test
	void wrapsNonObjectResultsForResultSchema() {
		tools.register(ToolDefinition.builder()
			.name("count")
			.resultSchema(Map.of("type", "object", "properties", Map.of("result", Map.of("type", "integer"))))
			.handler((params, token, progress) -> Mono.just(3))
			.build());

		StepVerifier.create(pipeline.callTool(exchange(1), call("count", Map.of())))
			.assertNext(result -> {
				assertThat(result.content()).containsExactly(new McpSchema.TextContent("3"));
				assertThat(result.structuredContent()).isEqualTo(Map.of("result", 3));
			})
			.verifyComplete();
	}

	@Test
	void emptyHandlerResultIsNull() {
		tools.register(ToolDefinition.builder()
			.name("nothing")
			.handler((params, token, progress) -> Mono.empty())
			.build());

		StepVerifier.create(pipeline.callTool(exchange(1), call("nothing", Map.of())))
			.assertNext(result -> assertThat(result.content()).containsExactly(new McpSchema.TextContent("null")))
			.verifyComplete();
	}

	@Test
	void resultSchemaMismatchIsInternalError() {
		tools.register(ToolDefinition.builder()
			.name("liar")
			.resultSchema(ECHO_RESULT_SCHEMA)
			.handler((params, token, progress) -> Mono.just(Map.of("other", 1)))
			.build());

		StepVerifier.create(pipeline.callTool(exchange(1), call("liar", Map.of())))
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOf(InternalServerException.class)
				.hasMessageStartingWith("Result schema validation failed"))
			.verify();
		assertThat(limiter.currentConcurrency()).isZero();
	}

	@Test
	void rejectsMissingToolName() {
		StepVerifier.create(pipeline.callTool(exchange(1), Map.of("arguments", Map.of())))
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOfSatisfying(InvalidParamsException.class,
					e -> assertThat(e.getMissingFields()).containsExactly("name")))
			.verify();
	}

	@Test
	void rejectsUnknownTool() {
		StepVerifier.create(pipeline.callTool(exchange(1), call("ghost", Map.of())))
			.verifyError(ToolNotFoundException.class);
	}

	@Test
	void rejectsArgumentsViolatingSchema() {
		registerEcho();

		StepVerifier.create(pipeline.callTool(exchange(1), call("echo", Map.of())))
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOfSatisfying(ValidationException.class,
					e -> assertThat(e.getFieldErrors()).containsKey("message")))
			.verify();
		assertThat(cancellations.size()).isZero();
	}

	@Test
	void rejectsOversizedArguments() {
		registerEcho();

		StepVerifier.create(pipeline.callTool(exchange(1), call("echo", Map.of("message", "x".repeat(100)))))
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOfSatisfying(InvalidParamsException.class,
					e -> assertThat(e.getInvalidFields()).containsExactly("parameters")))
			.verify();
	}

	@Test
	void requiresConfirmation() {
		tools.register(ToolDefinition.builder()
			.name("wipe")
			.requiresConfirmation(true)
			.handler((params, token, progress) -> Mono.just("wiped"))
			.build());

		StepVerifier.create(pipeline.callTool(exchange(1), call("wipe", Map.of())))
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOfSatisfying(PermissionDeniedException.class,
					e -> assertThat(e.getReason()).isEqualTo("confirmation_required")))
			.verify();

		StepVerifier.create(pipeline.callTool(exchange(2), call("wipe", Map.of("confirm", true))))
			.assertNext(result -> assertThat(result.content()).containsExactly(new McpSchema.TextContent("wiped")))
			.verifyComplete();
	}

	@Test
	void rejectsCallsBeyondToolConcurrency() {
		Sinks.Empty<Void> release = Sinks.empty();
		tools.register(ToolDefinition.builder()
			.name("slow")
			.maxConcurrency(1)
			.handler((params, token, progress) -> release.asMono().thenReturn("done"))
			.build());

		StepVerifier.create(pipeline.callTool(exchange(1), call("slow", Map.of())))
			.expectSubscription()
			.then(() -> {
				assertThat(limiter.getToolConcurrency("slow")).isEqualTo(1);
				assertThatThrownBy(() -> pipeline.callTool(exchange(2), call("slow", Map.of())).block())
					.isInstanceOf(ConcurrencyLimitException.class);
				assertThat(cancellations.get(2)).isEmpty();
				release.tryEmitEmpty();
			})
			.assertNext(result -> assertThat(result.content()).containsExactly(new McpSchema.TextContent("done")))
			.verifyComplete();

		assertThat(limiter.currentConcurrency()).isZero();
	}

	@Test
	void cancellationAnswersImmediatelyAndCancelsToken() {
		AtomicReference<CancellationToken> seen = new AtomicReference<>();
		tools.register(ToolDefinition.builder().name("hang").handler((params, token, progress) -> {
			seen.set(token);
			return Mono.never();
		}).build());

		StepVerifier.create(pipeline.callTool(exchange(7), call("hang", Map.of())))
			.expectSubscription()
			.then(() -> assertThat(cancellations.cancel(7L)).isTrue())
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOfSatisfying(RequestCancelledException.class,
					e -> assertThat(e.getRequestId()).isEqualTo(7)))
			.verify(Duration.ofSeconds(5));

		assertThat(seen.get().isCancelled()).isTrue();
		assertThat(limiter.currentConcurrency()).isZero();
		assertThat(cancellations.size()).isZero();
	}

	@Test
	void timeoutCancelsTokenAndReleasesSlot() {
		AtomicReference<CancellationToken> seen = new AtomicReference<>();
		tools.register(ToolDefinition.builder()
			.name("hang")
			.timeout(Duration.ofMillis(50))
			.handler((params, token, progress) -> {
				seen.set(token);
				return Mono.never();
			})
			.build());

		StepVerifier.create(pipeline.callTool(exchange(8), call("hang", Map.of())))
			.expectError(OperationTimeoutException.class)
			.verify(Duration.ofSeconds(5));

		// the slot and the token are released right after the error is delivered
		await().atMost(Duration.ofSeconds(1)).untilAsserted(() -> {
			assertThat(seen.get().isCancelled()).isTrue();
			assertThat(limiter.currentConcurrency()).isZero();
			assertThat(cancellations.size()).isZero();
		});
	}

	@Test
	void configuredTimeoutWinsOverDefinition() {
		McpCallPipeline configured = createPipeline(
				McpServerConfig.builder().toolTimeout("hang", Duration.ofSeconds(2)).build());
		ToolDefinition definition = ToolDefinition.builder()
			.name("hang")
			.timeout(Duration.ofMillis(50))
			.handler((params, token, progress) -> Mono.never())
			.build();
		ToolDefinition plain = ToolDefinition.builder()
			.name("plain")
			.handler((params, token, progress) -> Mono.never())
			.build();

		assertThat(configured.timeoutFor(definition)).isEqualTo(Duration.ofSeconds(2));
		assertThat(pipeline.timeoutFor(definition)).isEqualTo(Duration.ofMillis(50));
		assertThat(pipeline.timeoutFor(plain)).isEqualTo(McpServerConfig.DEFAULT_TIMEOUT);
	}

	@Test
	void sendsProgressWhenTokenSupplied() {
		tools.register(ToolDefinition.builder()
			.name("work")
			.handler((params, token, progress) -> progress.notifyProgress("half", 50).thenReturn("ok"))
			.build());

		StepVerifier
			.create(pipeline.callTool(exchange(1),
					Map.of("name", "work", "_meta", Map.of(McpSchema.PROGRESS_TOKEN, "p-1"))))
			.expectNextCount(1)
			.verifyComplete();

		assertThat(sent).singleElement()
			.isEqualTo(new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION,
					McpSchema.METHOD_NOTIFICATION_PROGRESS, new McpSchema.ProgressNotification("p-1", 50.0, 100.0,
							"half")));
	}

	@Test
	void readsResourceByPrefix() {
		resources.register(ResourceDefinition.builder()
			.uri("logs://run/")
			.name("run-logs")
			.handler((params, token, progress) -> Mono.just("log of " + params.get("uri")))
			.build());

		StepVerifier.create(pipeline.readResource(exchange(1), Map.of("uri", "logs://run/9")))
			.assertNext(result -> assertThat(result.contents()).containsExactly(
					new McpSchema.TextResourceContents("logs://run/9", "text/plain", "log of logs://run/9")))
			.verifyComplete();
		assertThat(limiter.getToolConcurrency("resources/run-logs")).isZero();
	}

	@Test
	void rejectsOversizedResourceContent() {
		resources.register(ResourceDefinition.builder()
			.uri("big://")
			.name("big")
			.handler((params, token, progress) -> Mono.just("z".repeat(40)))
			.build());

		StepVerifier.create(pipeline.readResource(exchange(1), Map.of("uri", "big://1")))
			.verifyError(InvalidParamsException.class);
	}

	@Test
	void rendersPromptFromText() {
		prompts.register(PromptDefinition.builder()
			.name("greeting")
			.description("Greets")
			.argument("name", "Who", true)
			.handler((params, token, progress) -> Mono.just("Hello " + params.get("name")))
			.build());

		StepVerifier.create(pipeline.getPrompt(exchange(1), call("greeting", Map.of("name", "Ada"))))
			.assertNext(result -> {
				assertThat(result.description()).isEqualTo("Greets");
				assertThat(result.messages()).containsExactly(
						new McpSchema.PromptMessage(McpSchema.Role.USER, new McpSchema.TextContent("Hello Ada")));
			})
			.verifyComplete();

		StepVerifier.create(pipeline.getPrompt(exchange(2), call("greeting", Map.of())))
			.expectErrorSatisfies(error -> assertThat(error).isInstanceOfSatisfying(InvalidParamsException.class,
					e -> assertThat(e.getMissingFields()).containsExactly("name")))
			.verify();
	}

}
