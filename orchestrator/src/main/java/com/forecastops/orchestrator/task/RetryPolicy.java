package com.forecastops.orchestrator.task;

import java.time.Duration;

/**
 * Bounded exponential backoff for retryable task failures.
 *
 * @param maxAttempts    total attempts including the first one
 * @param initialBackoff pause before the second attempt
 * @param multiplier     growth factor applied to each following pause
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier) {

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1.0");
    }

    /** Pause before attempt number {@code attempt + 1}, where attempt starts at 1. */
    public Duration backoffAfter(int attempt) {
        double factor = Math.pow(multiplier, attempt - 1);
        return Duration.ofMillis((long) (initialBackoff.toMillis() * factor));
    }
}
