package com.sailfish.retry.model;

import java.util.Objects;

/**
 * Per-execution retry state. Created when an execution starts, owned by that execution
 * only and discarded when it finishes.
 */
public class AttemptState {

    private final String operationName;
    private volatile AttemptStatus status = AttemptStatus.ATTEMPTING;
    private volatile int failedAttempts;
    private volatile Exception lastFailure;

    public AttemptState(String operationName) {
        this.operationName = Objects.requireNonNull(operationName, "operationName cannot be null");
    }

    /**
     * Records a qualifying failure and moves to {@link AttemptStatus#FAILED}.
     *
     * @return The number of failed attempts so far, including this one.
     */
    public int recordFailure(Exception failure) {
        this.lastFailure = Objects.requireNonNull(failure, "failure cannot be null");
        this.status = AttemptStatus.FAILED;
        return ++failedAttempts;
    }

    public boolean isTerminal() {
        return status == AttemptStatus.SUCCEEDED
               || status == AttemptStatus.EXHAUSTED
               || status == AttemptStatus.CANCELLED;
    }

    public String getOperationName() {
        return operationName;
    }

    public AttemptStatus getStatus() {
        return status;
    }

    public void setStatus(AttemptStatus status) {
        this.status = Objects.requireNonNull(status, "status cannot be null");
    }

    /**
     * The attempt index: number of qualifying failures caught so far.
     */
    public int getFailedAttempts() {
        return failedAttempts;
    }

    public Exception getLastFailure() {
        return lastFailure;
    }

    @Override
    public String toString() {
        return "AttemptState{" +
               "operationName='" + operationName + '\'' +
               ", status=" + status +
               ", failedAttempts=" + failedAttempts +
               ", lastFailure=" + lastFailure +
               '}';
    }
}
