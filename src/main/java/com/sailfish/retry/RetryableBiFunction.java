package com.sailfish.retry;

/**
 * A two-argument operation that can be retried on failure.
 *
 * @param <A> The first argument type.
 * @param <B> The second argument type.
 * @param <T> The result type.
 */
@FunctionalInterface
public interface RetryableBiFunction<A, B, T> {

    T apply(A first, B second) throws Exception;
}
