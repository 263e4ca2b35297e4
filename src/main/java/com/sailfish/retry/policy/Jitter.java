package com.sailfish.retry.policy;

import com.sailfish.retry.backoff.RandomSource;

import java.time.Duration;
import java.util.Objects;

/**
 * Random variation added to a computed backoff delay.
 * Either a symmetric magnitude {@code j} (variation drawn from {@code [-j, +j]})
 * or an explicit {@code [min, max]} range.
 */
public final class Jitter {

    private static final Jitter NONE = new Jitter(Duration.ZERO, Duration.ZERO, false);

    private final Duration min;
    private final Duration max;
    private final boolean range;

    private Jitter(Duration min, Duration max, boolean range) {
        this.min = min;
        this.max = max;
        this.range = range;
    }

    public static Jitter none() {
        return NONE;
    }

    /**
     * Creates a symmetric jitter.
     *
     * @param magnitude Maximum deviation in either direction. Must be non-negative.
     */
    public static Jitter of(Duration magnitude) {
        Objects.requireNonNull(magnitude, "magnitude cannot be null");
        if (magnitude.isNegative()) {
            throw new RetryConfigurationException("jitter magnitude must be non-negative, got " + magnitude);
        }
        if (magnitude.isZero()) {
            return NONE;
        }
        return new Jitter(magnitude.negated(), magnitude, false);
    }

    /**
     * Creates a jitter drawn from an explicit range. Bounds may be negative.
     *
     * @param min Lower bound of the added variation.
     * @param max Upper bound of the added variation. Must not be below {@code min}.
     */
    public static Jitter between(Duration min, Duration max) {
        Objects.requireNonNull(min, "min cannot be null");
        Objects.requireNonNull(max, "max cannot be null");
        if (min.compareTo(max) > 0) {
            throw new RetryConfigurationException("jitter range min " + min + " is greater than max " + max);
        }
        return new Jitter(min, max, true);
    }

    public boolean isNone() {
        return min.isZero() && max.isZero();
    }

    public boolean isRange() {
        return range;
    }

    /**
     * The larger absolute bound; validated against the base delay.
     */
    public Duration extreme() {
        Duration low = min.abs();
        Duration high = max.abs();
        return low.compareTo(high) >= 0 ? low : high;
    }

    /**
     * Draws one variation uniformly from this jitter's bounds.
     */
    public Duration sample(RandomSource random) {
        if (isNone()) {
            return Duration.ZERO;
        }
        double nanos = random.uniform(min.toNanos(), max.toNanos());
        return Duration.ofNanos(Math.round(nanos));
    }

    public Duration getMin() { return min; }
    public Duration getMax() { return max; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Jitter that = (Jitter) o;
        return range == that.range && min.equals(that.min) && max.equals(that.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max, range);
    }

    @Override
    public String toString() {
        if (isNone()) {
            return "Jitter{none}";
        }
        return range ? "Jitter{range=[" + min + ", " + max + "]}" : "Jitter{magnitude=" + max + "}";
    }
}
