package com.sailfish.retry.service;

import com.sailfish.retry.RetryableFunction;
import com.sailfish.retry.RetryableOperation;
import com.sailfish.retry.policy.ExecutionMode;
import com.sailfish.retry.policy.PolicyValidator;
import com.sailfish.retry.policy.RetryPolicy;

import java.util.Objects;

/**
 * A blocking retry policy bound to a service, invoked with different operations over time.
 *
 * @param <R> The result type.
 */
public final class Retrier<R> {

    private final RetryExecutionService service;
    private final RetryPolicy<R> policy;

    public Retrier(RetryExecutionService service, RetryPolicy<R> policy) {
        this.service = Objects.requireNonNull(service, "service cannot be null");
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        PolicyValidator.requireMode(policy, ExecutionMode.BLOCKING);
    }

    public R call(RetryableOperation<? extends R> operation) throws Exception {
        return service.execute(policy, operation);
    }

    public R call(String operationName, RetryableOperation<? extends R> operation) throws Exception {
        return service.execute(operationName, policy, operation);
    }

    public <A> R call(RetryableFunction<? super A, ? extends R> function, A argument) throws Exception {
        return service.<A, R>wrap(policy, function).apply(argument);
    }

    public RetryPolicy<R> getPolicy() { return policy; }
}
