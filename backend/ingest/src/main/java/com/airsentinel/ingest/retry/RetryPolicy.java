package com.airsentinel.ingest.retry;

import com.airsentinel.ingest.config.RetrySettings;
import com.airsentinel.ingest.error.TransientProviderException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Bounded retry with exponential backoff around provider calls. Only
 * {@link TransientProviderException} is retried; anything else propagates from the first attempt.
 * When attempts run out the last transient failure is rethrown as is.
 */
public final class RetryPolicy {
    private static final Logger LOGGER = Logger.getLogger(RetryPolicy.class.getName());

    private final Retry retry;

    public RetryPolicy(String name, RetrySettings settings) {
        Objects.requireNonNull(settings, "settings is required");
        if (settings.maxAttempts() < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (settings.multiplier() < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        // waits: initial, initial*m, initial*m^2 ... capped at maxBackoff
        IntervalFunction backoff = IntervalFunction.ofExponentialBackoff(
                Objects.requireNonNull(settings.initialBackoff(), "initialBackoff is required"),
                settings.multiplier(),
                Objects.requireNonNull(settings.maxBackoff(), "maxBackoff is required")
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.maxAttempts())
                .intervalFunction(backoff)
                .retryExceptions(TransientProviderException.class)
                .build();
        this.retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event -> LOGGER.fine(() -> event.getName() + " attempt "
                + event.getNumberOfRetryAttempts() + " failed, retrying in " + event.getWaitInterval().toMillis()
                + "ms: " + event.getLastThrowable().getMessage()));
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy("no-retry", new RetrySettings(1, Duration.ofMillis(1), Duration.ofMillis(1), 1.0));
    }

    public <T> T execute(Supplier<T> action) {
        return Retry.decorateSupplier(retry, action).get();
    }

    public int maxAttempts() {
        return retry.getRetryConfig().getMaxAttempts();
    }

    public Retry retry() {
        return retry;
    }
}
