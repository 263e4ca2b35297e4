package com.sailfish.retry.policy;

import com.sailfish.retry.callback.CallbackRegistry;

import java.time.Duration;
import java.util.Collection;

/**
 * Checks retry parameters for internal consistency. Runs once, when a policy or strategy is built.
 * Every violation is reported as a {@link RetryConfigurationException}.
 */
public final class PolicyValidator {

    private PolicyValidator() {
    }

    /**
     * Validates every parameter of a policy.
     */
    static void validate(ExecutionMode mode,
                         Collection<Class<? extends Exception>> retryOn,
                         int maxRetries,
                         Duration baseDelay,
                         boolean exponential,
                         Duration maxDelay,
                         Jitter jitter,
                         ExhaustionAction<?> exhaustionAction,
                         CallbackRegistry<?> callbacks) {
        if (retryOn.isEmpty()) {
            throw new RetryConfigurationException("at least one exception type to retry on is required");
        }
        validateMaxRetries(maxRetries);
        validateBackoff(baseDelay, exponential, maxDelay, jitter);
        validateMode(mode, exhaustionAction, callbacks);
    }

    public static void validateMaxRetries(int maxRetries) {
        if (maxRetries < RetryPolicy.UNLIMITED_RETRIES) {
            throw new RetryConfigurationException(
                    "maxRetries must be >= 0, or " + RetryPolicy.UNLIMITED_RETRIES + " for unlimited; got " + maxRetries);
        }
    }

    /**
     * Validates backoff parameters.
     * With exponential growth the base delay must be positive and a set cap must exceed it.
     * Without it the base delay must be non-negative and no cap may be set.
     * The jitter's extreme must not exceed the base delay in either case.
     *
     * @param baseDelay   Delay before the first retry.
     * @param exponential Whether the delay doubles with every retry.
     * @param maxDelay    Optional cap; null or {@link Duration#ZERO} when unset.
     * @param jitter      Variation added to each delay.
     */
    public static void validateBackoff(Duration baseDelay, boolean exponential, Duration maxDelay, Jitter jitter) {
        boolean capped = maxDelay != null && !maxDelay.isZero();
        if (maxDelay != null && maxDelay.isNegative()) {
            throw new RetryConfigurationException("maxDelay must not be negative, got " + maxDelay);
        }
        if (exponential) {
            if (baseDelay.isNegative() || baseDelay.isZero()) {
                throw new RetryConfigurationException("with exponential backoff baseDelay must be greater than 0");
            }
            if (capped && maxDelay.compareTo(baseDelay) <= 0) {
                throw new RetryConfigurationException(
                        "maxDelay " + maxDelay + " must be greater than baseDelay " + baseDelay);
            }
        } else {
            if (baseDelay.isNegative()) {
                throw new RetryConfigurationException("baseDelay must be >= 0, got " + baseDelay);
            }
            if (capped) {
                throw new RetryConfigurationException("maxDelay does not make sense without exponential backoff");
            }
        }
        if (!jitter.isNone() && jitter.extreme().compareTo(baseDelay) > 0) {
            throw new RetryConfigurationException(
                    "jitter extreme " + jitter.extreme() + " must be <= baseDelay " + baseDelay);
        }
    }

    /**
     * Validates that callbacks and fallback are invocable in the policy's execution mode.
     */
    public static void validateMode(ExecutionMode mode, ExhaustionAction<?> exhaustionAction, CallbackRegistry<?> callbacks) {
        if (callbacks.getMode() != mode) {
            throw new RetryConfigurationException(
                    "callbacks are " + callbacks.getMode() + " but the policy is " + mode);
        }
        ExecutionMode fallbackMode = exhaustionAction.requiredMode();
        if (fallbackMode != null && fallbackMode != mode) {
            throw new RetryConfigurationException(
                    "exhaustion fallback is " + fallbackMode + " but the policy is " + mode);
        }
    }

    /**
     * Rejects a policy handed to an executor of the other mode, before any attempt is made.
     */
    public static void requireMode(RetryPolicy<?> policy, ExecutionMode expected) {
        if (policy.getMode() != expected) {
            throw new RetryConfigurationException(
                    "policy is " + policy.getMode() + " but the executor is " + expected);
        }
    }
}
