package com.sailfish.retry.model;

/**
 * Represents the states an execution passes through while its operation is retried.
 */
public enum AttemptStatus {
    /**
     * The operation is being invoked.
     */
    ATTEMPTING,
    /**
     * The last attempt failed with a qualifying exception.
     */
    FAILED,
    /**
     * Failure callbacks are running.
     */
    DISPATCHING,
    /**
     * Waiting for the backoff delay before the next attempt.
     */
    WAITING,
    /**
     * The operation succeeded. Terminal.
     */
    SUCCEEDED,
    /**
     * The attempt budget is used up and the exhaustion action decided the outcome. Terminal.
     */
    EXHAUSTED,
    /**
     * The execution was cancelled or interrupted before it finished. Terminal.
     */
    CANCELLED
}
