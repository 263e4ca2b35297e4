package com.sailfish.retry.policy;

/**
 * Thrown when retry parameters are inconsistent with each other.
 * Raised while a policy or callback registry is being built, never while an operation runs.
 */
public class RetryConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new RetryConfigurationException with the specified detail message.
     *
     * @param message the detail message
     */
    public RetryConfigurationException(String message) {
        super(message);
    }
}
