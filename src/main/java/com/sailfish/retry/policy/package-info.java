/**
 * Contains the immutable {@link com.sailfish.retry.policy.RetryPolicy} and its parts:
 * jitter, exhaustion handling, execution mode and the configuration validator
 * that rejects inconsistent policies before anything is executed.
 */
package com.sailfish.retry.policy;
