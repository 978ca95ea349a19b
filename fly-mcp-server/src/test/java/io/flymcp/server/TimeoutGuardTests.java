/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server;

import java.time.Duration;
import java.util.Map;

import io.flymcp.server.error.ErrorConverter;
import io.flymcp.server.error.OperationTimeoutException;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class TimeoutGuardTests {

	@Test
	void neverCompletingBodyTimesOutAndReleasesSlot() {
		ConcurrencyLimiter limiter = new ConcurrencyLimiter(1);
		Mono<Object> guarded = limiter.execute("hang",
				TimeoutGuard.withTimeout(Mono.never(), Duration.ofMillis(50), "hang"));

		Duration elapsed = StepVerifier.create(guarded)
			.expectErrorSatisfies(error -> {
				assertThat(error).isInstanceOf(OperationTimeoutException.class);
				OperationTimeoutException timeout = (OperationTimeoutException) error;
				assertThat(timeout.getTimeout()).isEqualTo(Duration.ofMillis(50));
				assertThat(timeout.getOperationName()).isEqualTo("hang");
			})
			.verify(Duration.ofSeconds(5));

		assertThat(elapsed).isLessThan(Duration.ofMillis(500));
		await().atMost(Duration.ofMillis(500)).until(() -> limiter.currentConcurrency() == 0);
	}

	@Test
	void resultArrivingFirstPassesThrough() {
		StepVerifier.create(TimeoutGuard.withTimeout(Mono.just("done"), Duration.ofSeconds(1), "fast"))
			.expectNext("done")
			.verifyComplete();
	}

	@Test
	void errorArrivingFirstPassesThrough() {
		StepVerifier
			.create(TimeoutGuard.withTimeout(Mono.error(new IllegalStateException("boom")), Duration.ofSeconds(1),
					null))
			.verifyErrorMessage("boom");
	}

	@Test
	void timeoutMessageNamesOperation() {
		assertThat(new OperationTimeoutException(Duration.ofSeconds(30), "build").getMessage())
			.isEqualTo("Operation (build) timed out after 30s");
		assertThat(new OperationTimeoutException(Duration.ofSeconds(30), null).getMessage())
			.isEqualTo("Operation timed out after 30s");
	}

	@Test
	void subSecondTimeoutReportsMilliseconds() {
		OperationTimeoutException error = new OperationTimeoutException(Duration.ofMillis(250), "echo");

		assertThat(error.getMessage()).isEqualTo("Operation (echo) timed out after 250ms");
		assertThat(ErrorConverter.toJsonRpcError(error, null).data()).isEqualTo(Map.of("timeout", 0L, "operation", "echo"));
	}

}
