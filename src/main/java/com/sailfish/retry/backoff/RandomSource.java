package com.sailfish.retry.backoff;

/**
 * Source of uniformly distributed values, used only for jitter.
 */
@FunctionalInterface
public interface RandomSource {

    /**
     * Returns a value drawn uniformly from {@code [min, max]}.
     */
    double uniform(double min, double max);
}
