/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationRegistryTests {

	private final CancellationRegistry registry = new CancellationRegistry();

	@Test
	void cancelCancelsAndRemovesToken() {
		CancellationToken token = new CancellationToken("a");
		registry.register("a", token);

		assertThat(registry.cancel("a")).isTrue();

		assertThat(token.isCancelled()).isTrue();
		assertThat(registry.get("a")).isEmpty();
		assertThat(registry.size()).isZero();
	}

	@Test
	void cancellingUnknownIdIsNoOp() {
		assertThat(registry.cancel("missing")).isFalse();
		assertThat(registry.cancel(null)).isFalse();
	}

	@Test
	void cancellingTwiceIsIdempotent() {
		CancellationToken token = new CancellationToken(1);
		registry.register(1, token);

		assertThat(registry.cancel(1)).isTrue();
		assertThat(registry.cancel(1)).isFalse();
		assertThat(token.isCancelled()).isTrue();
	}

	@Test
	void numericIdsMatchAcrossTypes() {
		CancellationToken token = new CancellationToken(7);
		registry.register(7, token);

		assertThat(registry.get(7L)).contains(token);
		assertThat(registry.cancel(7L)).isTrue();
		assertThat(token.isCancelled()).isTrue();
	}

	@Test
	void stringAndNumericIdsAreDistinct() {
		registry.register(3, new CancellationToken(3));

		assertThat(registry.get("3")).isEmpty();
	}

	@Test
	void conditionalRemoveKeepsNewerToken() {
		CancellationToken first = new CancellationToken(5);
		CancellationToken second = new CancellationToken(5);
		registry.register(5, first);
		registry.register(5, second);

		registry.remove(5, first);
		assertThat(registry.get(5)).contains(second);

		registry.remove(5, second);
		assertThat(registry.get(5)).isEmpty();
	}

}
