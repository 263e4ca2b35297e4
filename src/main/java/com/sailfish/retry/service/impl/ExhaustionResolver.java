package com.sailfish.retry.service.impl;

import com.sailfish.retry.model.AttemptState;
import com.sailfish.retry.model.AttemptStatus;
import com.sailfish.retry.policy.ExhaustionAction;
import com.sailfish.retry.policy.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Decides the outcome of an execution whose attempt budget is used up, according to the
 * policy's {@link ExhaustionAction}. A failing fallback propagates as is; nothing is retried.
 */
public class ExhaustionResolver {

    private static final Logger log = LoggerFactory.getLogger(ExhaustionResolver.class);

    /**
     * Resolves a blocking execution.
     *
     * @return The value to return to the caller.
     * @throws Exception the last failure when the policy re-raises, or the fallback's exception.
     */
    public <R> R resolve(RetryPolicy<R> policy, AttemptState state) throws Exception {
        Exception failure = markExhausted(state);
        ExhaustionAction<? extends R> action = policy.getExhaustionAction();
        switch (action.getKind()) {
            case RERAISE:
                throw failure;
            case RETURN_FAILURE:
                return failureAsResult(failure);
            case FALLBACK:
                log.debug("Applying fallback for [{}]", state.getOperationName());
                return action.getFallback().apply(failure);
            default:
                // Unreachable: PolicyValidator.validateMode rejects an asynchronous fallback on a blocking policy
                throw new IllegalStateException("Unsupported exhaustion action for blocking execution: " + action);
        }
    }

    /**
     * Resolves an asynchronous execution. Never throws; failures complete the returned future.
     */
    public <R> CompletableFuture<R> resolveAsync(RetryPolicy<R> policy, AttemptState state) {
        Exception failure = markExhausted(state);
        ExhaustionAction<? extends R> action = policy.getExhaustionAction();
        CompletableFuture<R> outcome = new CompletableFuture<>();
        try {
            switch (action.getKind()) {
                case RERAISE:
                    outcome.completeExceptionally(failure);
                    break;
                case RETURN_FAILURE:
                    outcome.complete(failureAsResult(failure));
                    break;
                case ASYNC_FALLBACK:
                    log.debug("Applying asynchronous fallback for [{}]", state.getOperationName());
                    CompletionStage<? extends R> stage = action.getAsyncFallback().apply(failure);
                    if (stage == null) {
                        throw new NullPointerException("asynchronous fallback returned a null stage");
                    }
                    stage.whenComplete((value, error) -> {
                        if (error != null) {
                            outcome.completeExceptionally(Futures.unwrap(error));
                        } else {
                            outcome.complete(value);
                        }
                    });
                    break;
                default:
                    // Unreachable: PolicyValidator.validateMode rejects a blocking fallback on an asynchronous policy
                    throw new IllegalStateException("Unsupported exhaustion action for asynchronous execution: " + action);
            }
        } catch (RuntimeException e) {
            outcome.completeExceptionally(e);
        }
        return outcome;
    }

    private static Exception markExhausted(AttemptState state) {
        state.setStatus(AttemptStatus.EXHAUSTED);
        log.error("Exceeded {} attempts for [{}]", state.getFailedAttempts(), state.getOperationName());
        return state.getLastFailure();
    }

    // returnFailure() is an ExhaustionAction<Exception>, so R is a supertype of Exception here
    @SuppressWarnings("unchecked")
    private static <R> R failureAsResult(Exception failure) {
        return (R) failure;
    }
}
