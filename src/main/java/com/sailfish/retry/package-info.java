/**
 * Provides core classes and interfaces for the retry component.
 * This includes the retryable operation contracts, retry policies, backoff strategies,
 * failure callbacks and the blocking and asynchronous execution services.
 */
package com.sailfish.retry;
