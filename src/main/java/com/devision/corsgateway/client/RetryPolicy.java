package com.devision.corsgateway.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff for {@link GatewayClient}.
 *
 * @param maxAttempts total attempts including the first one
 * @param baseDelay   delay before the first retry
 * @param multiplier  factor applied to the delay after each retry
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, double multiplier) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofSeconds(1), 2.0);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        Objects.requireNonNull(baseDelay, "baseDelay");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0);
    }

    /**
     * Delay to wait after the given failed attempt (1-based) before the next one.
     */
    public Duration delayBeforeRetry(int failedAttempt) {
        if (failedAttempt < 1) {
            return Duration.ZERO;
        }
        double factor = Math.pow(multiplier, failedAttempt - 1);
        return Duration.ofMillis(Math.round(baseDelay.toMillis() * factor));
    }

    public boolean canRetryAfter(int failedAttempt) {
        return failedAttempt < maxAttempts;
    }
}
