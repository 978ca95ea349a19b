/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server.registry;

import io.flymcp.server.error.ResourceNotFoundException;
import io.flymcp.spec.McpSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceRegistryTests {

	private final ResourceRegistry registry = new ResourceRegistry();

	private static ResourceDefinition resource(String uri, String name) {
		return ResourceDefinition.builder()
			.uri(uri)
			.name(name)
			.handler((params, token, progress) -> Mono.just(name))
			.build();
	}

	@BeforeEach
	void setUp() {
		registry.register(resource("logs://", "all-logs"));
		registry.register(resource("logs://run/", "run-logs"));
		registry.register(resource("config://app", "app-config"));
	}

	@Test
	void exactMatchWins() {
		assertThat(registry.resolve("config://app")).map(ResourceDefinition::getName).contains("app-config");
	}

	@Test
	void fallsBackToLongestPrefix() {
		assertThat(registry.resolve("logs://run/42")).map(ResourceDefinition::getName).contains("run-logs");
		assertThat(registry.resolve("logs://build/7")).map(ResourceDefinition::getName).contains("all-logs");
	}

	@Test
	void unknownUriIsNotFound() {
		assertThat(registry.resolve("file:///etc/hosts")).isEmpty();
		assertThatThrownBy(() -> registry.require("file:///etc/hosts"))
			.isInstanceOfSatisfying(ResourceNotFoundException.class,
					e -> assertThat(e.getUri()).isEqualTo("file:///etc/hosts"));
	}

	@Test
	void admissionKeyUsesName() {
		assertThat(registry.require("logs://run/1").admissionKey()).isEqualTo("resources/run-logs");
	}

	@Test
	void listsSortedByUri() {
		assertThat(registry.list()).extracting(McpSchema.Resource::uri)
			.containsExactly("config://app", "logs://", "logs://run/");
		assertThat(registry.list().get(0).mimeType()).isEqualTo("text/plain");
	}

}
