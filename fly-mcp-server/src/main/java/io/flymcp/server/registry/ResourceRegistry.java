/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.registry;

import java.util.Comparator;
import java.util.Optional;

import io.flymcp.server.error.McpServerException;
import io.flymcp.server.error.ResourceNotFoundException;
import io.flymcp.spec.McpSchema;

/**
 * Registry of resources keyed by URI.
 */
public class ResourceRegistry extends AbstractDefinitionRegistry<ResourceDefinition, McpSchema.Resource> {

	/**
	 * Resolves a requested URI: an exact registration wins, otherwise the registration
	 * with the longest URI that prefixes the requested one.
	 * @param uri the requested URI
	 * @return the serving definition, if any
	 */
	public Optional<ResourceDefinition> resolve(String uri) {
		if (uri == null) {
			return Optional.empty();
		}
		Optional<ResourceDefinition> exact = get(uri);
		if (exact.isPresent()) {
			return exact;
		}
		return definitions().values()
			.stream()
			.filter(definition -> uri.startsWith(definition.getUri()))
			.max(Comparator.comparingInt(definition -> definition.getUri().length()));
	}

	@Override
	protected Optional<ResourceDefinition> lookup(String key) {
		return resolve(key);
	}

	@Override
	protected McpSchema.Resource describe(ResourceDefinition definition) {
		return definition.toResource();
	}

	@Override
	protected McpServerException notFound(String key) {
		return new ResourceNotFoundException(key);
	}

}
