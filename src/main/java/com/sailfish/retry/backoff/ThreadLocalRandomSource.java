package com.sailfish.retry.backoff;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Default {@link RandomSource} backed by {@link ThreadLocalRandom}, safe for concurrent executions.
 */
public class ThreadLocalRandomSource implements RandomSource {

    @Override
    public double uniform(double min, double max) {
        if (min >= max) {
            return min;
        }
        return ThreadLocalRandom.current().nextDouble(min, max);
    }
}
