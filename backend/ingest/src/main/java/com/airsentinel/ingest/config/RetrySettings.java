package com.airsentinel.ingest.config;

import java.time.Duration;

/**
 * Backoff for transient provider failures. {@code maxAttempts} counts the first call.
 */
public record RetrySettings(
        int maxAttempts,
        Duration initialBackoff,
        Duration maxBackoff,
        double multiplier
) {
    public static RetrySettings defaults() {
        return new RetrySettings(4, Duration.ofMillis(500), Duration.ofSeconds(10), 2.0);
    }
}
