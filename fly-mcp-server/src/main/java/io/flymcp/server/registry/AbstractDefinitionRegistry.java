/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.registry;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.flymcp.server.CancellationToken;
import io.flymcp.server.ProgressNotifier;
import io.flymcp.server.error.McpServerException;
import io.flymcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Thread-safe in-memory registry of definitions keyed by {@link AbstractDefinition#key()}.
 * Registering a definition under an existing key replaces it. Listings are sorted by key
 * since {@link ConcurrentHashMap} does not guarantee iteration order.
 *
 * @param <D> the definition type
 * @param <M> the metadata type advertised in listings
 */
public abstract class AbstractDefinitionRegistry<D extends AbstractDefinition, M> {

	private static final Logger logger = LoggerFactory.getLogger(AbstractDefinitionRegistry.class);

	private final ConcurrentHashMap<String, D> definitions = new ConcurrentHashMap<>();

	public void register(D definition) {
		Assert.notNull(definition, "definition must not be null");
		// Last-write-wins policy
		D previous = definitions.put(definition.key(), definition);
		if (previous != null) {
			logger.debug("Replaced {} registered under {}", previous, definition.key());
		}
	}

	public boolean remove(String key) {
		return definitions.remove(key) != null;
	}

	/**
	 * Returns the definition registered under exactly this key.
	 * @param key the registry key
	 * @return the definition, if any
	 */
	public Optional<D> get(String key) {
		if (key == null) {
			return Optional.empty();
		}
		return Optional.ofNullable(definitions.get(key));
	}

	/**
	 * Resolves the definition serving a key, failing with the registry's not-found error.
	 * @param key the key requested by the peer
	 * @return the definition
	 * @throws McpServerException if nothing serves the key
	 */
	public D require(String key) {
		return lookup(key).orElseThrow(() -> notFound(key));
	}

	/**
	 * Lists the metadata of all definitions, sorted by key.
	 * @return the metadata
	 */
	public List<M> list() {
		return definitions.values()
			.stream()
			.sorted(Comparator.comparing(AbstractDefinition::key))
			.map(this::describe)
			.toList();
	}

	/**
	 * Invokes the handler serving a key without admission control.
	 * @param key the key requested by the peer
	 * @param params the call arguments
	 * @param token the cancellation token
	 * @param progress the progress notifier
	 * @return the handler result
	 */
	public Mono<Object> call(String key, Map<String, Object> params, CancellationToken token,
			ProgressNotifier progress) {
		return Mono.defer(() -> require(key).getHandler().handle(params, token, progress));
	}

	public int size() {
		return definitions.size();
	}

	protected Map<String, D> definitions() {
		return definitions;
	}

	/**
	 * Finds the definition serving a key. Defaults to an exact match.
	 * @param key the key requested by the peer
	 * @return the definition, if any
	 */
	protected Optional<D> lookup(String key) {
		return get(key);
	}

	protected abstract M describe(D definition);

	protected abstract McpServerException notFound(String key);

}
