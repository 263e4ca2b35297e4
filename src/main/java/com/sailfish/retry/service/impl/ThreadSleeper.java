package com.sailfish.retry.service.impl;

import com.sailfish.retry.service.Sleeper;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Default {@link Sleeper} blocking with {@link Thread#sleep}.
 */
public final class ThreadSleeper implements Sleeper {

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        long nanos = Math.max(0, duration.toNanos());
        if (nanos > 0) TimeUnit.NANOSECONDS.sleep(nanos);
    }
}
