package com.sailfish.retry.service.impl;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

final class Futures {

    private Futures() {
    }

    /**
     * Strips the wrappers {@link java.util.concurrent.CompletableFuture} adds around a stage's failure.
     */
    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
               && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
