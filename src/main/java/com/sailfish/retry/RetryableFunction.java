package com.sailfish.retry;

/**
 * A one-argument operation that can be retried on failure.
 *
 * @param <A> The argument type.
 * @param <T> The result type.
 */
@FunctionalInterface
public interface RetryableFunction<A, T> {

    T apply(A argument) throws Exception;
}
