package com.phillippitts.newwork.exception;

import java.time.Duration;

/**
 * Thrown when a freshly spawned backend never answered its health endpoint.
 */
public class StartupTimeoutException extends BackendStartException {

    private final int attempts;
    private final Duration waited;

    public StartupTimeoutException(int attempts, Duration waited) {
        super("Backend failed to become healthy after " + attempts + " checks (" + waited.toMillis() + "ms)");
        this.attempts = attempts;
        this.waited = waited;
    }

    public int getAttempts() {
        return attempts;
    }

    public Duration getWaited() {
        return waited;
    }
}
