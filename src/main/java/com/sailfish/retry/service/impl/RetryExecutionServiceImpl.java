package com.sailfish.retry.service.impl;

import com.sailfish.retry.RetryableBiFunction;
import com.sailfish.retry.RetryableFunction;
import com.sailfish.retry.RetryableOperation;
import com.sailfish.retry.backoff.BackoffStrategy;
import com.sailfish.retry.backoff.RandomSource;
import com.sailfish.retry.backoff.ThreadLocalRandomSource;
import com.sailfish.retry.callback.CallbackEntry;
import com.sailfish.retry.callback.CallbackRegistry;
import com.sailfish.retry.callback.FailureCallback;
import com.sailfish.retry.model.AttemptState;
import com.sailfish.retry.model.AttemptStatus;
import com.sailfish.retry.policy.ExecutionMode;
import com.sailfish.retry.policy.PolicyValidator;
import com.sailfish.retry.policy.RetryPolicy;
import com.sailfish.retry.service.Retrier;
import com.sailfish.retry.service.RetryExecutionService;
import com.sailfish.retry.service.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Default implementation of the RetryExecutionService.
 * Runs the attempt loop on the calling thread: invoke, and on a qualifying failure run the
 * matching callbacks, then either resolve exhaustion or sleep for the backoff delay and loop.
 * Holds no per-execution state, so one instance can serve any number of threads.
 */
public class RetryExecutionServiceImpl implements RetryExecutionService {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutionServiceImpl.class);

    private final Sleeper sleeper;
    private final RandomSource randomSource;
    private final ExhaustionResolver exhaustionResolver;

    public RetryExecutionServiceImpl() {
        this(new ThreadSleeper(), new ThreadLocalRandomSource());
    }

    public RetryExecutionServiceImpl(Sleeper sleeper, RandomSource randomSource) {
        this(sleeper, randomSource, new ExhaustionResolver());
    }

    public RetryExecutionServiceImpl(Sleeper sleeper, RandomSource randomSource, ExhaustionResolver exhaustionResolver) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
        this.randomSource = Objects.requireNonNull(randomSource, "randomSource cannot be null");
        this.exhaustionResolver = Objects.requireNonNull(exhaustionResolver, "exhaustionResolver cannot be null");
    }

    @Override
    public <R> R execute(RetryPolicy<R> policy, RetryableOperation<? extends R> operation) throws Exception {
        Objects.requireNonNull(operation, "operation cannot be null");
        return execute(OperationNames.nameOf(operation), policy, operation);
    }

    @Override
    public <R> R execute(String operationName, RetryPolicy<R> policy, RetryableOperation<? extends R> operation)
            throws Exception {
        Objects.requireNonNull(operationName, "operationName cannot be null");
        Objects.requireNonNull(policy, "policy cannot be null");
        Objects.requireNonNull(operation, "operation cannot be null");
        CallbackRegistry<FailureCallback> callbacks = policy.blockingCallbacks();
        BackoffStrategy backoff = BackoffStrategy.forPolicy(policy, randomSource);
        AttemptState state = new AttemptState(operationName);

        while (true) {
            state.setStatus(AttemptStatus.ATTEMPTING);
            log.debug("Attempt {} of [{}]", state.getFailedAttempts() + 1, operationName);
            try {
                R result = operation.execute();
                state.setStatus(AttemptStatus.SUCCEEDED);
                if (state.getFailedAttempts() > 0) {
                    log.debug("[{}] succeeded after {} failed attempts", operationName, state.getFailedAttempts());
                }
                return result;
            } catch (Exception e) {
                if (!policy.qualifies(e)) {
                    throw e;
                }
                int failedAttempts = state.recordFailure(e);
                boolean lastAttempt = policy.isExhausted(failedAttempts);

                state.setStatus(AttemptStatus.DISPATCHING);
                dispatch(callbacks, e, lastAttempt);
                log.warn("{}. attempt: caught error in [{}]: {}", failedAttempts, operationName, e.toString());

                if (lastAttempt) {
                    return exhaustionResolver.resolve(policy, state);
                }
                state.setStatus(AttemptStatus.WAITING);
                waitBeforeRetry(state, backoff.delayBeforeRetry(failedAttempts));
            }
        }
    }

    private void dispatch(CallbackRegistry<FailureCallback> callbacks, Exception failure, boolean lastAttempt)
            throws Exception {
        for (CallbackEntry<FailureCallback> entry : callbacks.select(failure, lastAttempt)) {
            log.debug("Running failure callback registered for {}", entry.getFailureType().getSimpleName());
            entry.getCallback().onFailure(failure);
        }
    }

    private void waitBeforeRetry(AttemptState state, Duration delay) throws InterruptedException {
        if (delay.isZero()) {
            return;
        }
        log.debug("Retrying [{}] in {}", state.getOperationName(), delay);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            state.setStatus(AttemptStatus.CANCELLED);
            log.debug("[{}] interrupted during retry delay", state.getOperationName());
            // Preserve interrupt status
            Thread.currentThread().interrupt();
            throw ie;
        }
    }

    @Override
    public <R> RetryableOperation<R> wrap(RetryPolicy<R> policy, RetryableOperation<? extends R> operation) {
        requireBlocking(policy);
        Objects.requireNonNull(operation, "operation cannot be null");
        String name = OperationNames.nameOf(operation);
        return () -> execute(name, policy, operation);
    }

    @Override
    public <A, R> RetryableFunction<A, R> wrap(RetryPolicy<R> policy, RetryableFunction<? super A, ? extends R> function) {
        requireBlocking(policy);
        Objects.requireNonNull(function, "function cannot be null");
        String name = OperationNames.nameOf(function);
        return argument -> execute(name, policy, () -> function.apply(argument));
    }

    @Override
    public <A, B, R> RetryableBiFunction<A, B, R> wrap(RetryPolicy<R> policy,
                                                       RetryableBiFunction<? super A, ? super B, ? extends R> function) {
        requireBlocking(policy);
        Objects.requireNonNull(function, "function cannot be null");
        String name = OperationNames.nameOf(function);
        return (first, second) -> execute(name, policy, () -> function.apply(first, second));
    }

    @Override
    public <R> Retrier<R> bind(RetryPolicy<R> policy) {
        return new Retrier<>(this, policy);
    }

    private static void requireBlocking(RetryPolicy<?> policy) {
        Objects.requireNonNull(policy, "policy cannot be null");
        PolicyValidator.requireMode(policy, ExecutionMode.BLOCKING);
    }
}
