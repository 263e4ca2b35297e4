package com.sailfish.retry.backoff;

import com.sailfish.retry.policy.Jitter;
import com.sailfish.retry.policy.PolicyValidator;

import java.time.Duration;
import java.util.Objects;

/**
 * A backoff strategy doubling the delay before each retry, with optional jitter and cap.
 * Delay before retry {@code n} is {@code baseDelay * 2^(n-1)}, plus jitter, then capped at {@code maxDelay}.
 */
public class ExponentialBackoffStrategy implements BackoffStrategy {

    private final Duration baseDelay;
    private final Jitter jitter;
    private final Duration maxDelay; // Optional: null when uncapped
    private final RandomSource random;

    /**
     * Creates an uncapped, unjittered strategy.
     *
     * @param baseDelay Delay before the first retry. Must be positive.
     */
    public ExponentialBackoffStrategy(Duration baseDelay) {
        this(baseDelay, Jitter.none(), null, new ThreadLocalRandomSource());
    }

    /**
     * Creates a configurable ExponentialBackoffStrategy.
     *
     * @param baseDelay Delay before the first retry. Must be positive.
     * @param jitter Variation added to every computed delay. Its extreme must not exceed {@code baseDelay}.
     * @param maxDelay Optional cap. Set to null or Duration.ZERO to disable, otherwise must exceed {@code baseDelay}.
     * @param random Source for jitter.
     */
    public ExponentialBackoffStrategy(Duration baseDelay, Jitter jitter, Duration maxDelay, RandomSource random) {
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay cannot be null");
        this.jitter = Objects.requireNonNull(jitter, "jitter cannot be null");
        this.random = Objects.requireNonNull(random, "random cannot be null");
        PolicyValidator.validateBackoff(baseDelay, true, maxDelay, jitter);
        this.maxDelay = (maxDelay != null && !maxDelay.isZero()) ? maxDelay : null;
    }

    @Override
    public Duration delayBeforeRetry(int retryNumber) {
        if (retryNumber < 1) {
            throw new IllegalArgumentException("retryNumber must be >= 1, got " + retryNumber);
        }
        long delayNanos = saturatedAdd(grownNanos(retryNumber - 1), jitter.sample(random).toNanos());

        if (maxDelay != null && delayNanos > maxDelay.toNanos()) {
            delayNanos = maxDelay.toNanos();
        }
        return delayNanos <= 0 ? Duration.ZERO : Duration.ofNanos(delayNanos);
    }

    // base << doublings, saturating at Long.MAX_VALUE
    private long grownNanos(int doublings) {
        long base = baseDelay.toNanos();
        if (doublings >= Long.numberOfLeadingZeros(base)) {
            return Long.MAX_VALUE;
        }
        return base << doublings;
    }

    private static long saturatedAdd(long a, long b) {
        long sum = a + b;
        if (((a ^ sum) & (b ^ sum)) < 0) {
            return a > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
        return sum;
    }

    public Duration getBaseDelay() { return baseDelay; }
    public Jitter getJitter() { return jitter; }
    public Duration getMaxDelay() { return maxDelay; }
}
