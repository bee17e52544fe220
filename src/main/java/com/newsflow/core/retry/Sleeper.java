package com.newsflow.core.retry;

import java.time.Duration;

/**
 * Blocks the calling thread between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
