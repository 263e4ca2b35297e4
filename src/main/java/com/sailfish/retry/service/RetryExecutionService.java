package com.sailfish.retry.service;

import com.sailfish.retry.RetryableBiFunction;
import com.sailfish.retry.RetryableFunction;
import com.sailfish.retry.RetryableOperation;
import com.sailfish.retry.policy.RetryPolicy;

/**
 * Service interface for executing operations with retries on the calling thread.
 * Attempts, callbacks and backoff delays all run on the caller's thread; delays block it.
 */
public interface RetryExecutionService {

    /**
     * Executes an operation, retrying qualifying failures according to the policy.
     *
     * @param policy    A blocking retry policy.
     * @param operation The operation to execute.
     * @param <R>       The result type.
     * @return The operation's result, or the exhaustion action's result once attempts are used up.
     * @throws Exception the operation's non-qualifying exception, the last qualifying exception when
     *                   the policy re-raises, or an exception thrown by a callback or fallback.
     * @throws InterruptedException if the thread is interrupted during a backoff delay.
     * @throws com.sailfish.retry.policy.RetryConfigurationException if the policy is not a blocking one.
     */
    <R> R execute(RetryPolicy<R> policy, RetryableOperation<? extends R> operation) throws Exception;

    /**
     * Same as {@link #execute(RetryPolicy, RetryableOperation)}, naming the operation in log messages.
     */
    <R> R execute(String operationName, RetryPolicy<R> policy, RetryableOperation<? extends R> operation) throws Exception;

    /**
     * Returns an operation that executes the given one under the policy on every invocation.
     */
    <R> RetryableOperation<R> wrap(RetryPolicy<R> policy, RetryableOperation<? extends R> operation);

    /**
     * Returns a function that forwards its argument to the given one and retries it under the policy.
     */
    <A, R> RetryableFunction<A, R> wrap(RetryPolicy<R> policy, RetryableFunction<? super A, ? extends R> function);

    /**
     * Returns a function that forwards both arguments to the given one and retries it under the policy.
     */
    <A, B, R> RetryableBiFunction<A, B, R> wrap(RetryPolicy<R> policy,
                                                RetryableBiFunction<? super A, ? super B, ? extends R> function);

    /**
     * Binds a policy to this service for repeated use.
     */
    <R> Retrier<R> bind(RetryPolicy<R> policy);
}
