package com.sailfish.retry;

/**
 * Represents an operation that can be retried on failure.
 * Implementations should contain the actual business logic and be safe to invoke more than once.
 *
 * @param <T> The type of the operation's result.
 */
@FunctionalInterface
public interface RetryableOperation<T> {

    /**
     * Executes the operation logic.
     *
     * @return The operation's result.
     * @throws Exception if the operation fails.
     */
    T execute() throws Exception;
}
