package com.sailfish.retry.service;

import com.sailfish.retry.AsyncRetryableOperation;
import com.sailfish.retry.RetryableFunction;
import com.sailfish.retry.policy.ExecutionMode;
import com.sailfish.retry.policy.PolicyValidator;
import com.sailfish.retry.policy.RetryPolicy;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * An asynchronous retry policy bound to a service, invoked with different operations over time.
 *
 * @param <R> The result type.
 */
public final class AsyncRetrier<R> {

    private final AsyncRetryExecutionService service;
    private final RetryPolicy<R> policy;

    public AsyncRetrier(AsyncRetryExecutionService service, RetryPolicy<R> policy) {
        this.service = Objects.requireNonNull(service, "service cannot be null");
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        PolicyValidator.requireMode(policy, ExecutionMode.SUSPENDING);
    }

    public CompletableFuture<R> call(AsyncRetryableOperation<? extends R> operation) {
        return service.execute(policy, operation);
    }

    public CompletableFuture<R> call(String operationName, AsyncRetryableOperation<? extends R> operation) {
        return service.execute(operationName, policy, operation);
    }

    public <A> CompletableFuture<R> call(RetryableFunction<? super A, ? extends CompletionStage<? extends R>> function,
                                         A argument) {
        return service.<A, R>wrap(policy, function).apply(argument);
    }

    public RetryPolicy<R> getPolicy() { return policy; }
}
