/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.flymcp.server;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.flymcp.server.error.ConcurrencyLimitException;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ConcurrencyLimiterTests {

	@Test
	void shouldRejectExactlyOneOfNPlusOneConcurrentCalls() throws Exception {
		int max = 4;
		ConcurrencyLimiter limiter = new ConcurrencyLimiter(max);
		Sinks.Empty<Void> release = Sinks.empty();
		AtomicInteger rejected = new AtomicInteger();
		CountDownLatch done = new CountDownLatch(max + 1);

		ExecutorService executor = Executors.newFixedThreadPool(max + 1);
		try {
			for (int i = 0; i < max + 1; i++) {
				executor.execute(() -> limiter.execute("work", release.asMono().thenReturn("ok"))
					.doOnError(ConcurrencyLimitException.class, e -> rejected.incrementAndGet())
					.doFinally(signal -> done.countDown())
					.subscribe(value -> {
					}, error -> {
					}));
			}

			await()
				.atMost(Duration.ofSeconds(5))
				.until(() -> rejected.get() == 1 && limiter.currentConcurrency() == max);

			release.tryEmitEmpty();
			assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
		}
		finally {
			executor.shutdownNow();
		}

		assertThat(rejected.get()).isEqualTo(1);
		await().atMost(Duration.ofSeconds(1)).until(() -> limiter.currentConcurrency() == 0);
		assertThat(limiter.getToolConcurrency("work")).isZero();
	}

	@Test
	void shouldEnforcePerToolLimit() {
		ConcurrencyLimiter limiter = new ConcurrencyLimiter(10, Map.of("slow", 1));

		assertThat(limiter.tryStart("slow")).isTrue();
		assertThat(limiter.canStart("slow")).isFalse();
		assertThat(limiter.canStart("fast")).isTrue();

		ConcurrencyLimitException error = limiter.limitExceeded("slow");
		assertThat(error.getToolName()).isEqualTo("slow");
		assertThat(error.getCurrent()).isEqualTo(1);
		assertThat(error.getLimit()).isEqualTo(1);
		assertThat(error.getMessage()).isEqualTo("Maximum concurrency reached for tool: slow (current: 1, limit: 1)");

		limiter.complete("slow");
		assertThat(limiter.canStart("slow")).isTrue();
	}

	@Test
	void shouldEnforceGlobalLimitAcrossKeys() {
		ConcurrencyLimiter limiter = new ConcurrencyLimiter(2);

		assertThat(limiter.tryStart("a")).isTrue();
		assertThat(limiter.tryStart("b")).isTrue();
		assertThat(limiter.tryStart("c")).isFalse();
		assertThat(limiter.currentConcurrency()).isEqualTo(2);
		assertThat(limiter.getToolConcurrency("c")).isZero();
	}

	@Test
	void shouldReleaseSlotOnError() {
		ConcurrencyLimiter limiter = new ConcurrencyLimiter(1);

		StepVerifier.create(limiter.execute("failing", Mono.error(new IllegalStateException("boom"))))
			.verifyErrorMessage("boom");

		assertThat(limiter.currentConcurrency()).isZero();
	}

	@Test
	void shouldReleaseSlotOnCancel() {
		ConcurrencyLimiter limiter = new ConcurrencyLimiter(1);

		StepVerifier.create(limiter.execute("never", Mono.never()))
			.expectSubscription()
			.then(() -> assertThat(limiter.currentConcurrency()).isEqualTo(1))
			.thenCancel()
			.verify();

		assertThat(limiter.currentConcurrency()).isZero();
	}

	@Test
	void shouldNotStartWhenRejected() {
		ConcurrencyLimiter limiter = new ConcurrencyLimiter(1);
		List<String> started = new ArrayList<>();
		limiter.start("busy");

		StepVerifier.create(limiter.execute("other", Mono.fromRunnable(() -> started.add("other"))))
			.verifyError(ConcurrencyLimitException.class);

		assertThat(started).isEmpty();
		assertThat(limiter.currentConcurrency()).isEqualTo(1);
	}

	@Test
	void shouldIgnoreUnmatchedComplete() {
		ConcurrencyLimiter limiter = new ConcurrencyLimiter(1);

		limiter.complete("unknown");

		assertThat(limiter.currentConcurrency()).isZero();
	}

	@Test
	void configuredLimitWinsOverDefault() {
		ConcurrencyLimiter limiter = new ConcurrencyLimiter(10, Map.of("echo", 3));

		limiter.defaultLimit("echo", 1);
		limiter.defaultLimit("other", 2);
		limiter.defaultLimit("unbounded", null);

		assertThat(limiter.limitFor("echo")).isEqualTo(3);
		assertThat(limiter.limitFor("other")).isEqualTo(2);
		assertThat(limiter.limitFor("unbounded")).isEqualTo(10);
	}

	@Test
	void shouldRejectNonPositiveLimits() {
		assertThatThrownBy(() -> new ConcurrencyLimiter(0)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new ConcurrencyLimiter(1).defaultLimit("x", 0))
			.isInstanceOf(IllegalArgumentException.class);
	}

}
