package com.newsflow.core.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded retry with exponential backoff for a single node.
 *
 * @param maxAttempts     total attempts including the first one (at least 1)
 * @param initialInterval wait before the second attempt
 * @param backoffFactor   multiplier applied to the wait after each failure (at least 1.0)
 * @param jitter          when true, a uniform random 0-1 s is added to every wait
 */
public record RetryPolicy(int maxAttempts, Duration initialInterval, double backoffFactor, boolean jitter) {

    /** One attempt, no retry. */
    public static final RetryPolicy NONE = new RetryPolicy(1, Duration.ZERO, 1.0, false);

    public RetryPolicy {
        Objects.requireNonNull(initialInterval, "initialInterval must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (initialInterval.isNegative()) {
            throw new IllegalArgumentException("initialInterval must not be negative");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be >= 1.0, got " + backoffFactor);
        }
    }

    public static RetryPolicy of(int maxAttempts, Duration initialInterval, double backoffFactor) {
        return new RetryPolicy(maxAttempts, initialInterval, backoffFactor, false);
    }

    /**
     * Wait after the given failed attempt (1-based), before jitter:
     * {@code initialInterval * backoffFactor^(attempt-1)}.
     */
    public Duration backoffAfter(int failedAttempt) {
        double millis = initialInterval.toMillis() * Math.pow(backoffFactor, failedAttempt - 1);
        return Duration.ofMillis(Math.round(millis));
    }
}
