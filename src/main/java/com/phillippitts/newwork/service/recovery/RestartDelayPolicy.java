package com.phillippitts.newwork.service.recovery;

import com.phillippitts.newwork.config.properties.RecoveryProperties;

import java.time.Duration;
import java.util.Objects;

/**
 * Delay to wait before the n-th automatic restart inside one recovery budget window.
 *
 * <p>{@code FIXED} always returns the base delay. {@code EXPONENTIAL} returns
 * {@code base * multiplier^(attempt-1)}, capped at {@code maxDelay}.
 */
public final class RestartDelayPolicy {

    private final RecoveryProperties.BackoffMode mode;
    private final Duration baseDelay;
    private final double multiplier;
    private final Duration maxDelay;

    public RestartDelayPolicy(RecoveryProperties.BackoffMode mode, Duration baseDelay,
                              double multiplier, Duration maxDelay) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, got: " + multiplier);
        }
        this.multiplier = multiplier;
    }

    public static RestartDelayPolicy fixed(Duration delay) {
        return new RestartDelayPolicy(RecoveryProperties.BackoffMode.FIXED, delay, 1.0, delay);
    }

    public static RestartDelayPolicy from(RecoveryProperties.Backoff backoff) {
        return new RestartDelayPolicy(backoff.getMode(), backoff.getBaseDelay(),
                backoff.getMultiplier(), backoff.getMaxDelay());
    }

    /**
     * @param attempt 1-based restart attempt number within the current window
     */
    public Duration delayFor(int attempt) {
        if (mode == RecoveryProperties.BackoffMode.FIXED || attempt <= 1) {
            return baseDelay;
        }
        double millis = baseDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        if (Double.isInfinite(millis) || millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    public RecoveryProperties.BackoffMode getMode() {
        return mode;
    }
}
