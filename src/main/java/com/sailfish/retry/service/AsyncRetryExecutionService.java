package com.sailfish.retry.service;

import com.sailfish.retry.AsyncRetryableOperation;
import com.sailfish.retry.RetryableBiFunction;
import com.sailfish.retry.RetryableFunction;
import com.sailfish.retry.policy.RetryPolicy;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Service interface for executing asynchronous operations with retries.
 * Backoff delays are timers on a scheduler; no thread is held while waiting.
 */
public interface AsyncRetryExecutionService {

    /**
     * Executes an asynchronous operation, retrying qualifying failures according to the policy.
     * <p>
     * Failures never escape this method: the returned future completes exceptionally with the
     * original exception instead. Cancelling the future stops the execution; a pending delay is
     * cancelled and the exhaustion action is not applied.
     *
     * @param policy    An asynchronous retry policy.
     * @param operation The operation to execute.
     * @param <R>       The result type.
     * @return A future completing with the operation's or the exhaustion action's result.
     * @throws com.sailfish.retry.policy.RetryConfigurationException if the policy is not an asynchronous one.
     */
    <R> CompletableFuture<R> execute(RetryPolicy<R> policy, AsyncRetryableOperation<? extends R> operation);

    /**
     * Same as {@link #execute(RetryPolicy, AsyncRetryableOperation)}, naming the operation in log messages.
     */
    <R> CompletableFuture<R> execute(String operationName, RetryPolicy<R> policy,
                                     AsyncRetryableOperation<? extends R> operation);

    <R> Supplier<CompletableFuture<R>> wrap(RetryPolicy<R> policy, AsyncRetryableOperation<? extends R> operation);

    <A, R> Function<A, CompletableFuture<R>> wrap(
            RetryPolicy<R> policy, RetryableFunction<? super A, ? extends CompletionStage<? extends R>> function);

    <A, B, R> BiFunction<A, B, CompletableFuture<R>> wrap(
            RetryPolicy<R> policy,
            RetryableBiFunction<? super A, ? super B, ? extends CompletionStage<? extends R>> function);

    /**
     * Binds a policy to this service for repeated use.
     */
    <R> AsyncRetrier<R> bind(RetryPolicy<R> policy);

    /**
     * Initiates a graceful shutdown of the scheduler owned by this service.
     * Should be called during application shutdown.
     *
     * @param timeoutSeconds Time to wait for pending attempts before forceful shutdown.
     */
    void shutdown(long timeoutSeconds);
}
