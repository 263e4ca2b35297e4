package com.sailfish.retry.policy;

/**
 * The way an operation, its callbacks and its fallback are invoked.
 */
public enum ExecutionMode {
    /**
     * Invoked on the calling thread; delays block that thread.
     */
    BLOCKING,
    /**
     * Invoked through {@link java.util.concurrent.CompletionStage}s; delays are timers
     * that never occupy a thread.
     */
    SUSPENDING
}
