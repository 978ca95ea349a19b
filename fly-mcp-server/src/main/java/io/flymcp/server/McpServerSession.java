/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server;

import java.util.List;
import java.util.Map;

import io.flymcp.server.error.ErrorConverter;
import io.flymcp.server.error.InvalidParamsException;
import io.flymcp.server.error.MethodNotFoundException;
import io.flymcp.server.transport.McpServerTransport;
import io.flymcp.spec.McpSchema;
import io.flymcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Routes the messages of the single connected peer to request and notification
 * handlers.
 * <p>
 * Every request produces exactly one response: the handler's result, or the JSON-RPC
 * error its failure converts to. Unknown request methods are answered with
 * {@link McpSchema.ErrorCodes#METHOD_NOT_FOUND}. Notifications never produce a response;
 * unknown notification methods are logged and ignored. Responses sent by the peer are
 * ignored since the server issues no requests of its own.
 */
public class McpServerSession {

	private static final Logger logger = LoggerFactory.getLogger(McpServerSession.class);

	private final McpServerTransport transport;

	private final Map<String, McpRequestHandler<?>> requestHandlers;

	private final Map<String, McpNotificationHandler> notificationHandlers;

	/**
	 * Creates a session.
	 * @param transport the transport used to answer the peer
	 * @param requestHandlers handlers keyed by request method
	 * @param notificationHandlers handlers keyed by notification method
	 */
	public McpServerSession(McpServerTransport transport, Map<String, McpRequestHandler<?>> requestHandlers,
			Map<String, McpNotificationHandler> notificationHandlers) {
		Assert.notNull(transport, "transport must not be null");
		Assert.notNull(requestHandlers, "requestHandlers must not be null");
		Assert.notNull(notificationHandlers, "notificationHandlers must not be null");
		this.transport = transport;
		this.requestHandlers = Map.copyOf(requestHandlers);
		this.notificationHandlers = Map.copyOf(notificationHandlers);
	}

	/**
	 * Handles one inbound message.
	 * @param message the decoded message
	 * @return completes once the message has been handled and, for requests, answered.
	 * Never signals an error.
	 */
	public Mono<Void> handle(McpSchema.JSONRPCMessage message) {
		if (message instanceof McpSchema.JSONRPCRequest request) {
			return handleRequest(request);
		}
		else if (message instanceof McpSchema.JSONRPCNotification notification) {
			return handleNotification(notification);
		}
		else if (message instanceof McpSchema.JSONRPCResponse response) {
			logger.debug("Ignoring response from peer for id {}", response.id());
			return Mono.empty();
		}
		logger.warn("Received unknown message type: {}", message);
		return Mono.empty();
	}

	/**
	 * Sends a notification to the peer.
	 * @param method the notification method
	 * @param params the notification parameters
	 * @return completes once the notification has been written
	 */
	public Mono<Void> sendNotification(String method, Object params) {
		return transport.sendMessage(new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION, method, params));
	}

	public Mono<Void> closeGracefully() {
		return transport.closeGracefully();
	}

	private Mono<Void> handleRequest(McpSchema.JSONRPCRequest request) {
		Object id = request.id();
		McpRequestHandler<?> handler = this.requestHandlers.get(request.method());

		Mono<?> result;
		if (handler == null) {
			result = Mono.error(new MethodNotFoundException(request.method()));
		}
		else {
			McpServerExchange exchange = new McpServerExchange(this, id);
			result = Mono.defer(() -> handler.handle(exchange, paramsOf(request.params())));
		}

		return result.map(value -> McpSchema.JSONRPCResponse.success(id, value))
			.switchIfEmpty(Mono.fromSupplier(() -> McpSchema.JSONRPCResponse.success(id, Map.of())))
			.onErrorResume(error -> {
				if (ErrorConverter.isKnownError(error)) {
					logger.debug("Request {} ({}) failed: {}", id, request.method(), error.getMessage());
				}
				else {
					logger.error("Unexpected error handling request {} ({})", id, request.method(), error);
				}
				return Mono.just(McpSchema.JSONRPCResponse.error(id, ErrorConverter.toJsonRpcError(error, id)));
			})
			.flatMap(this.transport::sendMessage)
			.onErrorResume(error -> {
				logger.error("Failed to send response for request {}", id, error);
				return Mono.empty();
			});
	}

	private Mono<Void> handleNotification(McpSchema.JSONRPCNotification notification) {
		McpNotificationHandler handler = this.notificationHandlers.get(notification.method());
		if (handler == null) {
			logger.warn("No handler registered for notification method: {}", notification.method());
			return Mono.empty();
		}
		return Mono.defer(() -> handler.handle(paramsOf(notification.params()))).onErrorResume(error -> {
			logger.error("Error handling notification {}", notification.method(), error);
			return Mono.empty();
		});
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> paramsOf(Object params) {
		if (params == null) {
			return Map.of();
		}
		if (params instanceof Map) {
			return (Map<String, Object>) params;
		}
		throw new InvalidParamsException("params must be an object", List.of(), List.of("params"));
	}

	/**
	 * Handles a request method.
	 *
	 * @param <T> the result type
	 */
	@FunctionalInterface
	public interface McpRequestHandler<T> {

		/**
		 * Handles a request.
		 * @param exchange the per-request exchange
		 * @param params the request parameters, empty when absent
		 * @return the result, an empty result is answered with an empty object
		 */
		Mono<T> handle(McpServerExchange exchange, Map<String, Object> params);

	}

	/**
	 * Handles a notification method.
	 */
	@FunctionalInterface
	public interface McpNotificationHandler {

		Mono<Void> handle(Map<String, Object> params);

	}

}
