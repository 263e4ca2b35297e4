package com.sailfish.retry.service.impl;

import com.sailfish.retry.AsyncRetryableOperation;
import com.sailfish.retry.RetryableBiFunction;
import com.sailfish.retry.RetryableFunction;
import com.sailfish.retry.backoff.BackoffStrategy;
import com.sailfish.retry.backoff.RandomSource;
import com.sailfish.retry.backoff.ThreadLocalRandomSource;
import com.sailfish.retry.callback.AsyncFailureCallback;
import com.sailfish.retry.callback.CallbackEntry;
import com.sailfish.retry.callback.CallbackRegistry;
import com.sailfish.retry.model.AttemptState;
import com.sailfish.retry.model.AttemptStatus;
import com.sailfish.retry.policy.ExecutionMode;
import com.sailfish.retry.policy.PolicyValidator;
import com.sailfish.retry.policy.RetryPolicy;
import com.sailfish.retry.service.AsyncRetrier;
import com.sailfish.retry.service.AsyncRetryExecutionService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Default implementation of the AsyncRetryExecutionService.
 * Each execution is a chain of stages: the operation's stage, then the failure callbacks one after
 * another, then a timer on the scheduler that starts the next attempt. The scheduler thread only
 * starts attempts; it never waits.
 * <p>
 * Assumes dependency injection for the scheduler; without one the service creates and owns a
 * single daemon thread scheduler.
 */
public class AsyncRetryExecutionServiceImpl implements AsyncRetryExecutionService {

    private static final Logger log = LoggerFactory.getLogger(AsyncRetryExecutionServiceImpl.class);

    public static final long DEFAULT_SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final RandomSource randomSource;
    private final ExhaustionResolver exhaustionResolver;

    public AsyncRetryExecutionServiceImpl() {
        this(Executors.newSingleThreadScheduledExecutor(new RetryThreadFactory()), true,
                new ThreadLocalRandomSource(), new ExhaustionResolver());
    }

    /**
     * Creates a service on an externally managed scheduler, which {@link #shutdown(long)} leaves running.
     */
    public AsyncRetryExecutionServiceImpl(ScheduledExecutorService scheduler, RandomSource randomSource) {
        this(scheduler, false, randomSource, new ExhaustionResolver());
    }

    private AsyncRetryExecutionServiceImpl(ScheduledExecutorService scheduler,
                                           boolean ownsScheduler,
                                           RandomSource randomSource,
                                           ExhaustionResolver exhaustionResolver) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.ownsScheduler = ownsScheduler;
        this.randomSource = Objects.requireNonNull(randomSource, "randomSource cannot be null");
        this.exhaustionResolver = Objects.requireNonNull(exhaustionResolver, "exhaustionResolver cannot be null");
        log.info("AsyncRetryExecutionService initialized (owns scheduler: {}).", ownsScheduler);
    }

    @PostConstruct
    public void start() {
        log.info("AsyncRetryExecutionService started and ready to accept operations.");
        if (scheduler.isShutdown() || scheduler.isTerminated()) {
            log.error("FATAL: Retry scheduler is not operational on startup!");
        }
    }

    @Override
    public <R> CompletableFuture<R> execute(RetryPolicy<R> policy, AsyncRetryableOperation<? extends R> operation) {
        Objects.requireNonNull(operation, "operation cannot be null");
        return execute(OperationNames.nameOf(operation), policy, operation);
    }

    @Override
    public <R> CompletableFuture<R> execute(String operationName, RetryPolicy<R> policy,
                                            AsyncRetryableOperation<? extends R> operation) {
        Objects.requireNonNull(operationName, "operationName cannot be null");
        Objects.requireNonNull(policy, "policy cannot be null");
        Objects.requireNonNull(operation, "operation cannot be null");
        Invocation<R> invocation = new Invocation<>(operationName, policy, operation);
        invocation.attempt();
        return invocation.result;
    }

    @Override
    public <R> Supplier<CompletableFuture<R>> wrap(RetryPolicy<R> policy, AsyncRetryableOperation<? extends R> operation) {
        requireAsync(policy);
        Objects.requireNonNull(operation, "operation cannot be null");
        String name = OperationNames.nameOf(operation);
        return () -> execute(name, policy, operation);
    }

    @Override
    public <A, R> Function<A, CompletableFuture<R>> wrap(
            RetryPolicy<R> policy, RetryableFunction<? super A, ? extends CompletionStage<? extends R>> function) {
        requireAsync(policy);
        Objects.requireNonNull(function, "function cannot be null");
        String name = OperationNames.nameOf(function);
        return argument -> execute(name, policy, () -> function.apply(argument));
    }

    @Override
    public <A, B, R> BiFunction<A, B, CompletableFuture<R>> wrap(
            RetryPolicy<R> policy,
            RetryableBiFunction<? super A, ? super B, ? extends CompletionStage<? extends R>> function) {
        requireAsync(policy);
        Objects.requireNonNull(function, "function cannot be null");
        String name = OperationNames.nameOf(function);
        return (first, second) -> execute(name, policy, () -> function.apply(first, second));
    }

    @Override
    public <R> AsyncRetrier<R> bind(RetryPolicy<R> policy) {
        return new AsyncRetrier<>(this, policy);
    }

    @PreDestroy
    public void stop() {
        shutdown(DEFAULT_SHUTDOWN_TIMEOUT_SECONDS);
    }

    @Override
    public void shutdown(long timeoutSeconds) {
        if (!ownsScheduler) {
            log.debug("Scheduler is managed externally; leaving it running.");
            return;
        }
        log.info("Shutting down retry scheduler...");
        scheduler.shutdown(); // Pending delayed attempts still run by default
        try {
            if (!scheduler.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Retry scheduler did not terminate in {} seconds.", timeoutSeconds);
                List<Runnable> dropped = scheduler.shutdownNow();
                log.warn("Forcefully shutting down retry scheduler. {} pending attempts were dropped.", dropped.size());
                if (!scheduler.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                    log.error("Retry scheduler did not terminate even after forceful shutdown.");
                }
            } else {
                log.info("Retry scheduler terminated gracefully.");
            }
        } catch (InterruptedException ie) {
            log.warn("Retry scheduler shutdown interrupted. Forcing shutdown now.");
            scheduler.shutdownNow();
            // Preserve interrupt status
            Thread.currentThread().interrupt();
        }
    }

    private static void requireAsync(RetryPolicy<?> policy) {
        Objects.requireNonNull(policy, "policy cannot be null");
        PolicyValidator.requireMode(policy, ExecutionMode.SUSPENDING);
    }

    /**
     * One execution: its private attempt state and the future handed to the caller.
     */
    private final class Invocation<R> {

        private final RetryPolicy<R> policy;
        private final AsyncRetryableOperation<? extends R> operation;
        private final CallbackRegistry<AsyncFailureCallback> callbacks;
        private final BackoffStrategy backoff;
        private final AttemptState state;
        private final CompletableFuture<R> result = new CompletableFuture<>();
        private volatile Future<?> pendingAttempt;

        Invocation(String operationName, RetryPolicy<R> policy, AsyncRetryableOperation<? extends R> operation) {
            this.policy = policy;
            this.operation = operation;
            this.callbacks = policy.asyncCallbacks();
            this.backoff = BackoffStrategy.forPolicy(policy, randomSource);
            this.state = new AttemptState(operationName);
            result.whenComplete((value, error) -> {
                if (result.isCancelled()) {
                    onCancelled();
                }
            });
        }

        void attempt() {
            if (result.isDone()) {
                return;
            }
            state.setStatus(AttemptStatus.ATTEMPTING);
            log.debug("Attempt {} of [{}]", state.getFailedAttempts() + 1, state.getOperationName());
            CompletionStage<? extends R> stage;
            try {
                stage = operation.execute();
                if (stage == null) {
                    throw new NullPointerException("operation returned a null stage");
                }
            } catch (Exception e) {
                stage = CompletableFuture.failedFuture(e);
            } catch (Throwable t) {
                // Errors never qualify; on a scheduler thread they would otherwise end up in an unread future
                state.setStatus(AttemptStatus.FAILED);
                result.completeExceptionally(t);
                return;
            }
            stage.whenComplete((value, error) -> {
                if (error == null) {
                    onSuccess(value);
                } else {
                    onFailure(Futures.unwrap(error));
                }
            });
        }

        private void onSuccess(R value) {
            if (result.isDone()) {
                return;
            }
            state.setStatus(AttemptStatus.SUCCEEDED);
            result.complete(value);
        }

        private void onFailure(Throwable error) {
            if (result.isDone()) {
                return;
            }
            if (!policy.qualifies(error)) {
                result.completeExceptionally(error);
                return;
            }
            Exception failure = (Exception) error;
            int failedAttempts = state.recordFailure(failure);
            boolean lastAttempt = policy.isExhausted(failedAttempts);

            state.setStatus(AttemptStatus.DISPATCHING);
            dispatch(failure, lastAttempt).whenComplete((ignored, callbackError) -> {
                if (callbackError != null) {
                    result.completeExceptionally(Futures.unwrap(callbackError));
                    return;
                }
                if (result.isDone()) {
                    return;
                }
                log.warn("{}. attempt: caught error in [{}]: {}", failedAttempts, state.getOperationName(), failure.toString());
                try {
                    if (lastAttempt) {
                        forward(exhaustionResolver.resolveAsync(policy, state));
                    } else {
                        scheduleNext(backoff.delayBeforeRetry(failedAttempts));
                    }
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            });
        }

        private CompletableFuture<Void> dispatch(Exception failure, boolean lastAttempt) {
            CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
            for (CallbackEntry<AsyncFailureCallback> entry : callbacks.select(failure, lastAttempt)) {
                chain = chain.thenCompose(ignored -> invoke(entry, failure));
            }
            return chain;
        }

        private CompletableFuture<Void> invoke(CallbackEntry<AsyncFailureCallback> entry, Exception failure) {
            log.debug("Running failure callback registered for {}", entry.getFailureType().getSimpleName());
            try {
                CompletionStage<?> stage = entry.getCallback().onFailure(failure);
                if (stage == null) {
                    return CompletableFuture.completedFuture(null);
                }
                return stage.toCompletableFuture().thenApply(ignored -> null);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        private void scheduleNext(Duration delay) {
            state.setStatus(AttemptStatus.WAITING);
            try {
                if (delay.isZero()) {
                    // Hand off instead of recursing, so long runs of immediate retries keep a flat stack
                    pendingAttempt = scheduler.submit(this::attempt);
                } else {
                    log.debug("Retrying [{}] in {}", state.getOperationName(), delay);
                    pendingAttempt = scheduler.schedule(this::attempt, delay.toNanos(), TimeUnit.NANOSECONDS);
                }
            } catch (RejectedExecutionException e) {
                log.error("Retry scheduler rejected the next attempt of [{}]", state.getOperationName(), e);
                result.completeExceptionally(e);
                return;
            }
            if (result.isCancelled()) {
                pendingAttempt.cancel(false);
            }
        }

        private void forward(CompletableFuture<R> outcome) {
            outcome.whenComplete((value, error) -> {
                if (error != null) {
                    result.completeExceptionally(Futures.unwrap(error));
                } else {
                    result.complete(value);
                }
            });
        }

        private void onCancelled() {
            state.setStatus(AttemptStatus.CANCELLED);
            Future<?> pending = pendingAttempt;
            if (pending != null) {
                pending.cancel(false);
            }
            log.debug("[{}] cancelled after {} failed attempts", state.getOperationName(), state.getFailedAttempts());
        }
    }

    private static final class RetryThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "retry-scheduler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
