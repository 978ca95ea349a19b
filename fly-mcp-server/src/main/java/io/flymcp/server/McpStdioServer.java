/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.HashMap;
import java.util.Map;

import io.flymcp.json.McpJsonMapper;
import io.flymcp.json.schema.DefaultJsonSchemaValidator;
import io.flymcp.json.schema.JsonSchemaValidator;
import io.flymcp.server.McpServerSession.McpNotificationHandler;
import io.flymcp.server.McpServerSession.McpRequestHandler;
import io.flymcp.server.error.InvalidParamsException;
import io.flymcp.server.registry.PromptDefinition;
import io.flymcp.server.registry.PromptRegistry;
import io.flymcp.server.registry.ResourceDefinition;
import io.flymcp.server.registry.ResourceRegistry;
import io.flymcp.server.registry.ToolDefinition;
import io.flymcp.server.registry.ToolRegistry;
import io.flymcp.server.transport.StdioServerTransport;
import io.flymcp.spec.McpSchema;
import io.flymcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * A JSON-RPC server serving tools, resources and prompts to a single peer over a pair
 * of byte streams.
 *
 * <pre>{@code
 * McpStdioServer server = McpStdioServer.builder()
 *     .config(McpServerConfig.defaults())
 *     .tool(ToolDefinition.builder()
 *         .name("echo")
 *         .handler((params, token, progress) -> Mono.just(params))
 *         .build())
 *     .build();
 * server.serve();
 * }</pre>
 */
public class McpStdioServer {

	private static final Logger logger = LoggerFactory.getLogger(McpStdioServer.class);

	private final McpServerConfig config;

	private final ToolRegistry tools;

	private final ResourceRegistry resources;

	private final PromptRegistry prompts;

	private final CancellationRegistry cancellations;

	private final ConcurrencyLimiter limiter;

	private final McpJsonMapper jsonMapper;

	private final StdioServerTransport transport;

	private final McpServerSession session;

	private McpStdioServer(Builder builder) {
		this.config = builder.config;
		this.tools = builder.tools;
		this.resources = builder.resources;
		this.prompts = builder.prompts;
		this.jsonMapper = builder.jsonMapper;
		this.cancellations = new CancellationRegistry();
		this.limiter = new ConcurrencyLimiter(config.getMaxConcurrency(), config.getPerToolLimits());
		this.transport = new StdioServerTransport(builder.jsonMapper, builder.inputStream, builder.outputStream,
				config.getSizeLimits().maxMessageSize());

		McpCallPipeline pipeline = new McpCallPipeline(config, tools, resources, prompts, limiter, cancellations,
				new SizeValidator(config.getSizeLimits(), builder.jsonMapper), builder.schemaValidator,
				builder.jsonMapper);

		Map<String, McpRequestHandler<?>> requestHandlers = new HashMap<>();
		requestHandlers.put(McpSchema.METHOD_INITIALIZE, (exchange, params) -> Mono.fromCallable(() -> initializeResult(params)));
		requestHandlers.put(McpSchema.METHOD_PING, (exchange, params) -> Mono.just(Map.of()));
		requestHandlers.put(McpSchema.METHOD_TOOLS_LIST,
				(exchange, params) -> Mono.fromSupplier(() -> new McpSchema.ListToolsResult(tools.list())));
		requestHandlers.put(McpSchema.METHOD_TOOLS_CALL,
				(McpRequestHandler<McpSchema.CallToolResult>) pipeline::callTool);
		requestHandlers.put(McpSchema.METHOD_RESOURCES_LIST,
				(exchange, params) -> Mono.fromSupplier(() -> new McpSchema.ListResourcesResult(resources.list())));
		requestHandlers.put(McpSchema.METHOD_RESOURCES_READ,
				(McpRequestHandler<McpSchema.ReadResourceResult>) pipeline::readResource);
		requestHandlers.put(McpSchema.METHOD_PROMPT_LIST,
				(exchange, params) -> Mono.fromSupplier(() -> new McpSchema.ListPromptsResult(prompts.list())));
		requestHandlers.put(McpSchema.METHOD_PROMPT_GET,
				(McpRequestHandler<McpSchema.GetPromptResult>) pipeline::getPrompt);

		Map<String, McpNotificationHandler> notificationHandlers = new HashMap<>();
		notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_INITIALIZED, params -> Mono.fromRunnable(() -> {
			logger.info("Client initialized");
		}));
		notificationHandlers.put(McpSchema.METHOD_CANCEL_REQUEST,
				params -> cancel(new McpSchema.CancelledNotification(params.get("id"), null)));
		notificationHandlers.put(McpSchema.METHOD_NOTIFICATION_CANCELLED,
				params -> Mono.defer(
						() -> cancel(jsonMapper.convertValue(params, McpSchema.CancelledNotification.class))));

		this.session = new McpServerSession(transport, requestHandlers, notificationHandlers);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Serves requests until the input stream is closed, then releases the transport.
	 */
	public void serve() {
		logger.info("Starting {} {} ({})", config.getServerName(), config.getServerVersion(), config);
		try {
			start().block();
		}
		finally {
			closeGracefully().block();
			logger.info("{} stopped", config.getServerName());
		}
	}

	/**
	 * Starts serving without blocking.
	 * @return completes when the input stream is closed and every in-flight request has
	 * been answered
	 */
	public Mono<Void> start() {
		return transport.connect(session::handle);
	}

	public Mono<Void> closeGracefully() {
		return session.closeGracefully();
	}

	public McpServerConfig getConfig() {
		return config;
	}

	public ToolRegistry getTools() {
		return tools;
	}

	public ResourceRegistry getResources() {
		return resources;
	}

	public PromptRegistry getPrompts() {
		return prompts;
	}

	public ConcurrencyLimiter getLimiter() {
		return limiter;
	}

	public CancellationRegistry getCancellations() {
		return cancellations;
	}

	private McpSchema.InitializeResult initializeResult(Map<String, Object> params) {
		McpSchema.InitializeRequest request;
		try {
			request = jsonMapper.convertValue(params, McpSchema.InitializeRequest.class);
		}
		catch (IllegalArgumentException e) {
			throw new InvalidParamsException("Invalid initialize params: " + e.getMessage());
		}
		McpSchema.Implementation client = request.clientInfo();
		logger.info("Initialize request from {} {} (protocol {})", (client != null) ? client.name() : "unknown client",
				(client != null) ? client.version() : "", request.protocolVersion());
		McpSchema.ServerCapabilities capabilities = new McpSchema.ServerCapabilities(
				new McpSchema.ServerCapabilities.PromptCapabilities(false),
				new McpSchema.ServerCapabilities.ResourceCapabilities(false, false),
				new McpSchema.ServerCapabilities.ToolCapabilities(false));
		return new McpSchema.InitializeResult(McpSchema.LATEST_PROTOCOL_VERSION, capabilities,
				new McpSchema.Implementation(config.getServerName(), config.getServerVersion()),
				config.getInstructions());
	}

	private Mono<Void> cancel(McpSchema.CancelledNotification notification) {
		Object requestId = notification.requestId();
		String reason = notification.reason();
		return Mono.fromRunnable(() -> {
			if (requestId == null) {
				logger.warn("Cancel notification without a request id");
			}
			else if (cancellations.cancel(requestId)) {
				logger.info("Cancelled request {}{}", requestId, (reason != null) ? " (" + reason + ")" : "");
			}
		});
	}

	public static class Builder {

		private McpServerConfig config = McpServerConfig.defaults();

		private ToolRegistry tools = new ToolRegistry();

		private ResourceRegistry resources = new ResourceRegistry();

		private PromptRegistry prompts = new PromptRegistry();

		private McpJsonMapper jsonMapper;

		private JsonSchemaValidator schemaValidator;

		private InputStream inputStream = System.in;

		private OutputStream outputStream = System.out;

		private Builder() {
		}

		public Builder config(McpServerConfig config) {
			Assert.notNull(config, "config must not be null");
			this.config = config;
			return this;
		}

		public Builder tools(ToolRegistry tools) {
			Assert.notNull(tools, "tools must not be null");
			this.tools = tools;
			return this;
		}

		public Builder resources(ResourceRegistry resources) {
			Assert.notNull(resources, "resources must not be null");
			this.resources = resources;
			return this;
		}

		public Builder prompts(PromptRegistry prompts) {
			Assert.notNull(prompts, "prompts must not be null");
			this.prompts = prompts;
			return this;
		}

		public Builder tool(ToolDefinition tool) {
			this.tools.register(tool);
			return this;
		}

		public Builder resource(ResourceDefinition resource) {
			this.resources.register(resource);
			return this;
		}

		public Builder prompt(PromptDefinition prompt) {
			this.prompts.register(prompt);
			return this;
		}

		public Builder jsonMapper(McpJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "jsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		public Builder schemaValidator(JsonSchemaValidator schemaValidator) {
			Assert.notNull(schemaValidator, "schemaValidator must not be null");
			this.schemaValidator = schemaValidator;
			return this;
		}

		public Builder streams(InputStream inputStream, OutputStream outputStream) {
			Assert.notNull(inputStream, "inputStream must not be null");
			Assert.notNull(outputStream, "outputStream must not be null");
			this.inputStream = inputStream;
			this.outputStream = outputStream;
			return this;
		}

		public McpStdioServer build() {
			if (jsonMapper == null) {
				jsonMapper = McpJsonMapper.createDefault();
			}
			if (schemaValidator == null) {
				schemaValidator = new DefaultJsonSchemaValidator();
			}
			return new McpStdioServer(this);
		}

	}

}
