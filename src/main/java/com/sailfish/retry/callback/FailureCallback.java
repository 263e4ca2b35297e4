package com.sailfish.retry.callback;

/**
 * Blocking callback invoked when an attempt fails with a matching exception.
 * Exists for side effects only (logging, alerting, metrics). An exception thrown here
 * ends the retry loop and propagates to the caller.
 */
@FunctionalInterface
public interface FailureCallback {

    void onFailure(Exception failure) throws Exception;
}
