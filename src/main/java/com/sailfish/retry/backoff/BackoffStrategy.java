package com.sailfish.retry.backoff;

import com.sailfish.retry.policy.RetryPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Defines how long to wait before each retry of a failed operation.
 */
public interface BackoffStrategy {

    /**
     * Calculates the delay before a retry.
     *
     * @param retryNumber 1 for the first retry (i.e. before the second attempt), 2 for the next, and so on.
     * @return A non-negative delay. {@link Duration#ZERO} means retry immediately.
     */
    Duration delayBeforeRetry(int retryNumber);

    /**
     * Creates the strategy described by a policy's backoff parameters.
     *
     * @param policy The policy whose base delay, growth, jitter and cap are used.
     * @param random Source for jitter.
     */
    static BackoffStrategy forPolicy(RetryPolicy<?> policy, RandomSource random) {
        Objects.requireNonNull(policy, "policy cannot be null");
        if (policy.isExponential()) {
            return new ExponentialBackoffStrategy(policy.getBaseDelay(), policy.getJitter(),
                    policy.getMaxDelay().orElse(null), random);
        }
        return new FixedBackoffStrategy(policy.getBaseDelay(), policy.getJitter(), random);
    }
}
