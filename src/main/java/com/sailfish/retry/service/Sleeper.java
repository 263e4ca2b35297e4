package com.sailfish.retry.service;

import java.time.Duration;

/**
 * Blocks the calling thread for a backoff delay.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;
}
