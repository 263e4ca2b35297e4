package com.sailfish.retry.backoff;

import com.sailfish.retry.policy.Jitter;
import com.sailfish.retry.policy.PolicyValidator;

import java.time.Duration;
import java.util.Objects;

/**
 * The same base delay before every retry, optionally jittered.
 */
public class FixedBackoffStrategy implements BackoffStrategy {

    private final Duration delay;
    private final Jitter jitter;
    private final RandomSource random;

    public FixedBackoffStrategy(Duration delay) {
        this(delay, Jitter.none(), new ThreadLocalRandomSource());
    }

    public FixedBackoffStrategy(Duration delay, Jitter jitter, RandomSource random) {
        this.delay = Objects.requireNonNull(delay, "delay cannot be null");
        this.jitter = Objects.requireNonNull(jitter, "jitter cannot be null");
        this.random = Objects.requireNonNull(random, "random cannot be null");
        PolicyValidator.validateBackoff(delay, false, null, jitter);
    }

    @Override
    public Duration delayBeforeRetry(int retryNumber) {
        Duration result = delay.plus(jitter.sample(random));
        return result.isNegative() ? Duration.ZERO : result;
    }

    public Duration getDelay() { return delay; }
    public Jitter getJitter() { return jitter; }
}
