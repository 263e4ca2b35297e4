/**
 * Contains the backoff strategies computing the delay before each retry,
 * such as {@link com.sailfish.retry.backoff.BackoffStrategy} and its fixed and
 * exponential implementations, and the random source used for jitter.
 */
package com.sailfish.retry.backoff;
