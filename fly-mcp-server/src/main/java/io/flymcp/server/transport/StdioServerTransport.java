/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import io.flymcp.json.McpJsonMapper;
import io.flymcp.spec.McpSchema;
import io.flymcp.spec.transport.FrameCodec;
import io.flymcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Transport speaking Content-Length framed JSON-RPC over a pair of byte streams, usually
 * standard input and output.
 * <p>
 * A dedicated thread reads and decodes inbound frames; frames that are not valid JSON-RPC
 * are logged and dropped. Each decoded message is handed to the handler as a detached
 * unit, so slow requests do not hold up the reader. A second dedicated thread writes
 * outbound frames one at a time.
 */
public class StdioServerTransport implements McpServerTransport {

	private static final Logger logger = LoggerFactory.getLogger(StdioServerTransport.class);

	private final McpJsonMapper jsonMapper;

	private final InputStream inputStream;

	private final OutputStream outputStream;

	private final int maxMessageBytes;

	private final Scheduler inboundScheduler;

	private final Scheduler outboundScheduler;

	private final AtomicBoolean isStarted = new AtomicBoolean(false);

	private final AtomicBoolean isClosing = new AtomicBoolean(false);

	/**
	 * Creates a transport over the process standard streams.
	 * @param jsonMapper the JSON mapper
	 * @param maxMessageBytes the largest accepted frame body
	 */
	public StdioServerTransport(McpJsonMapper jsonMapper, int maxMessageBytes) {
		this(jsonMapper, System.in, System.out, maxMessageBytes);
	}

	public StdioServerTransport(McpJsonMapper jsonMapper, InputStream inputStream, OutputStream outputStream,
			int maxMessageBytes) {
		Assert.notNull(jsonMapper, "The JsonMapper can not be null");
		Assert.notNull(inputStream, "The InputStream can not be null");
		Assert.notNull(outputStream, "The OutputStream can not be null");
		Assert.isTrue(maxMessageBytes > 0, "maxMessageBytes must be positive");
		this.jsonMapper = jsonMapper;
		this.inputStream = inputStream;
		this.outputStream = outputStream;
		this.maxMessageBytes = maxMessageBytes;
		this.inboundScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(), "stdio-inbound");
		this.outboundScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(),
				"stdio-outbound");
	}

	/**
	 * Starts reading inbound messages.
	 * @param handler invoked for each decoded message, must not signal errors
	 * @return completes when the input stream reaches end of file, or errors if it
	 * cannot be read
	 */
	public Mono<Void> connect(Function<McpSchema.JSONRPCMessage, Mono<Void>> handler) {
		Assert.notNull(handler, "handler must not be null");
		if (!isStarted.compareAndSet(false, true)) {
			return Mono.error(new IllegalStateException("Transport is already connected"));
		}
		return FrameCodec.decode(inputStream, maxMessageBytes)
			.subscribeOn(inboundScheduler)
			.concatMap(this::deserialize)
			.flatMap(message -> handler.apply(message)
				.onErrorResume(error -> {
					logger.error("Error handling inbound message", error);
					return Mono.empty();
				}), Integer.MAX_VALUE)
			.doOnComplete(() -> logger.debug("Input stream closed"))
			.then();
	}

	@Override
	public Mono<Void> sendMessage(McpSchema.JSONRPCMessage message) {
		return Mono.fromCallable(() -> {
			String json = jsonMapper.writeValueAsString(message);
			FrameCodec.write(outputStream, json);
			logger.debug("Message sent: {}", json);
			return json;
		}).subscribeOn(outboundScheduler).onErrorMap(IOException.class, e -> {
			if (!isClosing.get()) {
				logger.error("Error writing message", e);
			}
			return new IllegalStateException("Failed to send message", e);
		}).then();
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			if (isClosing.compareAndSet(false, true)) {
				logger.debug("Session transport closing gracefully");
				inboundScheduler.dispose();
				outboundScheduler.dispose();
			}
		});
	}

	private Flux<McpSchema.JSONRPCMessage> deserialize(String body) {
		try {
			logger.debug("Received JSON message: {}", body);
			return Flux.just(McpSchema.deserializeJsonRpcMessage(jsonMapper, body));
		}
		catch (IOException | IllegalArgumentException e) {
			logger.error("Error processing inbound message for message: {}", body, e);
			return Flux.empty();
		}
	}

}
