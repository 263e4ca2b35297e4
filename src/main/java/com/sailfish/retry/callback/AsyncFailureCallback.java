package com.sailfish.retry.callback;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous counterpart of {@link FailureCallback}. The next callback, or the backoff delay,
 * starts only after the returned stage completes; a failed stage ends the retry loop.
 */
@FunctionalInterface
public interface AsyncFailureCallback {

    /**
     * @return A stage signalling completion of the side effect, or {@code null} if it already completed.
     */
    CompletionStage<?> onFailure(Exception failure);
}
