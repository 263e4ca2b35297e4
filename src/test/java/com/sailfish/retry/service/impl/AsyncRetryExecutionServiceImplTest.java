package com.sailfish.retry.service.impl;

import com.sailfish.retry.backoff.ThreadLocalRandomSource;
import com.sailfish.retry.callback.AsyncFailureCallback;
import com.sailfish.retry.callback.CallbackRegistry;
import com.sailfish.retry.policy.ExhaustionAction;
import com.sailfish.retry.policy.RetryConfigurationException;
import com.sailfish.retry.policy.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Collections;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class AsyncRetryExecutionServiceImplTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private AsyncRetryExecutionServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new AsyncRetryExecutionServiceImpl();
        service.start();
    }

    @AfterEach
    void tearDown() {
        service.shutdown(1);
    }

    @Test
    @DisplayName("Should complete with the value of the first successful attempt")
    void shouldCompleteAfterTransientFailures() {
        // Given
        RetryPolicy<String> policy = RetryPolicy.<String>asyncBuilder()
                .maxRetries(3)
                .baseDelay(Duration.ofMillis(5))
                .build();
        AtomicInteger attempts = new AtomicInteger();

        // When
        CompletableFuture<String> result = service.execute(policy, () -> attempts.incrementAndGet() < 3
                ? CompletableFuture.failedFuture(new IOException("flaky"))
                : CompletableFuture.completedFuture("ok"));

        // Then
        assertThat(result).succeedsWithin(TIMEOUT).isEqualTo("ok");
        assertThat(attempts).hasValue(3);
    }

    @Test
    @DisplayName("Should complete exceptionally with the original exception once attempts are used up")
    void shouldReraiseThroughFuture() {
        // Given
        RetryPolicy<Object> policy = RetryPolicy.asyncBuilder().maxRetries(2).build();
        IOException failure = new IOException("down");
        AtomicInteger attempts = new AtomicInteger();

        // When
        CompletableFuture<Object> result = service.execute(policy, () -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(failure);
        });

        // Then
        Throwable thrown = catchThrowable(() -> result.get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));
        assertThat(thrown).isInstanceOf(ExecutionException.class);
        assertThat(thrown.getCause()).isSameAs(failure);
        assertThat(attempts).hasValue(3);
    }

    @Test
    @DisplayName("Should complete exceptionally with a non-qualifying exception after a single attempt")
    void shouldNotRetryNonQualifyingFailure() {
        RetryPolicy<Object> policy = RetryPolicy.asyncBuilder()
                .retryOn(IOException.class)
                .maxRetries(5)
                .build();
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<Object> result = service.execute(policy, () -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(new IllegalStateException("fatal"));
        });

        Throwable thrown = catchThrowable(() -> result.get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));
        assertThat(thrown).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(attempts).hasValue(1);
    }

    @Test
    @DisplayName("Should treat a synchronous throw or a null stage as a failed attempt")
    void shouldTreatSynchronousThrowAndNullStageAsFailures() {
        RetryPolicy<String> policy = RetryPolicy.<String>asyncBuilder().maxRetries(2).build();
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = service.execute(policy, () -> {
            int attempt = attempts.incrementAndGet();
            if (attempt == 1) {
                throw new IOException("thrown before any stage");
            }
            if (attempt == 2) {
                return null;
            }
            return CompletableFuture.completedFuture("third time");
        });

        assertThat(result).succeedsWithin(TIMEOUT).isEqualTo("third time");
        assertThat(attempts).hasValue(3);
    }

    @Test
    @DisplayName("Should complete exceptionally with an Error thrown synchronously by a scheduled retry")
    void shouldCompleteWithErrorThrownOnRetry() {
        // Given
        RetryPolicy<String> policy = RetryPolicy.<String>asyncBuilder().maxRetries(3).build();
        AssertionError error = new AssertionError("boom");
        AtomicInteger attempts = new AtomicInteger();

        // When
        CompletableFuture<String> result = service.execute(policy, () -> {
            if (attempts.incrementAndGet() == 1) {
                return CompletableFuture.failedFuture(new IOException("first"));
            }
            throw error;
        });

        // Then
        Throwable thrown = catchThrowable(() -> result.get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));
        assertThat(thrown).isInstanceOf(ExecutionException.class);
        assertThat(thrown.getCause()).isSameAs(error);
        assertThat(attempts).hasValue(2);
    }

    @Test
    @DisplayName("Should await each asynchronous callback before the next one, in registration order")
    void shouldAwaitCallbacksInOrder() {
        // Given
        List<String> calls = Collections.synchronizedList(new ArrayList<>());
        AsyncFailureCallback slow = failure -> CompletableFuture.runAsync(
                () -> calls.add("slow"), CompletableFuture.delayedExecutor(20, TimeUnit.MILLISECONDS));
        AsyncFailureCallback fast = failure -> {
            calls.add("fast");
            return null;
        };
        RetryPolicy<String> policy = RetryPolicy.<String>asyncBuilder()
                .maxRetries(1)
                .callbacks(CallbackRegistry.asyncBuilder()
                        .on(IOException.class, slow)
                        .on(Exception.class, fast)
                        .build())
                .build();
        AtomicInteger attempts = new AtomicInteger();

        // When
        CompletableFuture<String> result = service.execute(policy, () -> attempts.incrementAndGet() == 1
                ? CompletableFuture.failedFuture(new IOException("once"))
                : CompletableFuture.completedFuture("ok"));

        // Then
        assertThat(result).succeedsWithin(TIMEOUT).isEqualTo("ok");
        assertThat(calls).containsExactly("slow", "fast");
    }

    @Test
    @DisplayName("Should complete exceptionally with the callback failure and stop retrying")
    void shouldStopWhenCallbackFails() {
        RetryPolicy<Object> policy = RetryPolicy.asyncBuilder()
                .maxRetries(5)
                .callbacks(CallbackRegistry.ofAsync(
                        failure -> CompletableFuture.failedFuture(new IllegalStateException("alerting down"))))
                .build();
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<Object> result = service.execute(policy, () -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(new IOException("down"));
        });

        Throwable thrown = catchThrowable(() -> result.get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));
        assertThat(thrown.getCause()).isInstanceOf(IllegalStateException.class).hasMessage("alerting down");
        assertThat(attempts).hasValue(1);
    }

    @Test
    @DisplayName("Should complete with the last exception as value when the policy returns failures")
    void shouldReturnFailureAsValue() {
        RetryPolicy<Object> policy = RetryPolicy.asyncBuilder()
                .maxRetries(1)
                .onExhaustion(ExhaustionAction.returnFailure())
                .build();
        IOException failure = new IOException("down");

        CompletableFuture<Object> result = service.execute(policy, () -> CompletableFuture.failedFuture(failure));

        assertThat(result).succeedsWithin(TIMEOUT).isSameAs(failure);
    }

    @Test
    @DisplayName("Should await the asynchronous fallback on exhaustion")
    void shouldApplyAsyncFallback() {
        RetryPolicy<String> policy = RetryPolicy.<String>asyncBuilder()
                .maxRetries(1)
                .onExhaustion(ExhaustionAction.asyncFallback(
                        failure -> CompletableFuture.supplyAsync(() -> "cached after " + failure.getMessage())))
                .build();

        CompletableFuture<String> result = service.execute(policy,
                () -> CompletableFuture.failedFuture(new IOException("down")));

        assertThat(result).succeedsWithin(TIMEOUT).isEqualTo("cached after down");
    }

    @Test
    @DisplayName("Should stop during a backoff delay when the future is cancelled, without applying the fallback")
    void shouldCancelPendingDelay() throws Exception {
        // Given
        AtomicInteger attempts = new AtomicInteger();
        AtomicInteger fallbacks = new AtomicInteger();
        RetryPolicy<String> policy = RetryPolicy.<String>asyncBuilder()
                .maxRetries(3)
                .baseDelay(Duration.ofMinutes(10))
                .onExhaustion(ExhaustionAction.asyncFallback(failure -> {
                    fallbacks.incrementAndGet();
                    return CompletableFuture.completedFuture("fallback");
                }))
                .build();
        CompletableFuture<String> result = service.execute(policy, () -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(new IOException("down"));
        });

        // When
        boolean cancelled = result.cancel(true);

        // Then
        assertThat(cancelled).isTrue();
        assertThat(result).isCancelled();
        TimeUnit.MILLISECONDS.sleep(50);
        assertThat(attempts).hasValue(1);
        assertThat(fallbacks).hasValue(0);
    }

    @Test
    @DisplayName("Should run many immediate retries without growing the stack")
    void shouldHandleLongRunsOfImmediateRetries() {
        RetryPolicy<Object> policy = RetryPolicy.asyncBuilder()
                .maxRetries(2_000)
                .onExhaustion(ExhaustionAction.returnFailure())
                .build();
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<Object> result = service.execute(policy, () -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(new IOException("down"));
        });

        assertThat(result).succeedsWithin(Duration.ofSeconds(30)).isInstanceOf(IOException.class);
        assertThat(attempts).hasValue(2_001);
    }

    @Test
    @DisplayName("Should reject a blocking policy before the first attempt")
    void shouldRejectBlockingPolicy() {
        RetryPolicy<String> policy = RetryPolicy.<String>builder().build();
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> service.execute(policy, () -> {
            attempts.incrementAndGet();
            return CompletableFuture.completedFuture("x");
        })).isInstanceOf(RetryConfigurationException.class);
        assertThatThrownBy(() -> service.bind(policy)).isInstanceOf(RetryConfigurationException.class);
        assertThat(attempts).hasValue(0);
    }

    @Test
    @DisplayName("Should forward the argument on every attempt of a wrapped function")
    void shouldForwardArgumentThroughWrappedFunction() {
        RetryPolicy<Integer> policy = RetryPolicy.<Integer>asyncBuilder().maxRetries(1).build();
        List<String> seen = Collections.synchronizedList(new ArrayList<>());

        CompletableFuture<Integer> result = service.wrap(policy, (String text) -> {
            seen.add(text);
            return seen.size() == 1
                    ? CompletableFuture.<Integer>failedFuture(new IOException("flaky"))
                    : CompletableFuture.completedFuture(text.length());
        }).apply("retry");

        assertThat(result).succeedsWithin(TIMEOUT).isEqualTo(5);
        assertThat(seen).containsExactly("retry", "retry");
    }

    @Test
    @DisplayName("Should forward both arguments through a wrapped two-argument function")
    void shouldForwardArgumentsThroughWrappedBiFunction() {
        RetryPolicy<String> policy = RetryPolicy.<String>asyncBuilder().maxRetries(1).build();
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = service.wrap(policy, (String key, Integer version) ->
                attempts.incrementAndGet() == 1
                        ? CompletableFuture.<String>failedFuture(new IOException("flaky"))
                        : CompletableFuture.completedFuture(key + ":" + version)).apply("config", 7);

        assertThat(result).succeedsWithin(TIMEOUT).isEqualTo("config:7");
        assertThat(attempts).hasValue(2);
    }

    @Test
    @DisplayName("Should leave an injected scheduler running on shutdown")
    void shouldNotShutDownInjectedScheduler() {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            AsyncRetryExecutionServiceImpl injected =
                    new AsyncRetryExecutionServiceImpl(scheduler, new ThreadLocalRandomSource());

            injected.shutdown(1);

            assertThat(scheduler.isShutdown()).isFalse();
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should fail delayed retries once its own scheduler is shut down")
    void shouldRejectRetriesAfterShutdown() {
        // Given
        service.shutdown(1);
        RetryPolicy<Object> policy = RetryPolicy.asyncBuilder()
                .maxRetries(1)
                .baseDelay(Duration.ofMillis(10))
                .build();

        // When
        CompletableFuture<Object> result = service.execute(policy,
                () -> CompletableFuture.failedFuture(new IOException("down")));

        // Then
        Throwable thrown = catchThrowable(() -> result.get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS));
        assertThat(thrown).hasCauseInstanceOf(RejectedExecutionException.class);
    }
}
