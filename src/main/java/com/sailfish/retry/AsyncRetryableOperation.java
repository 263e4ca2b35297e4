package com.sailfish.retry;

import java.util.concurrent.CompletionStage;

/**
 * Represents an asynchronous operation that can be retried on failure.
 * A stage completed exceptionally, an exception thrown before a stage is returned,
 * and a {@code null} stage all count as a failed attempt.
 *
 * @param <T> The type of the operation's result.
 */
@FunctionalInterface
public interface AsyncRetryableOperation<T> {

    /**
     * Starts the operation.
     *
     * @return A stage completing with the operation's result.
     * @throws Exception if the operation fails before producing a stage.
     */
    CompletionStage<? extends T> execute() throws Exception;
}
