package com.phillippitts.newwork.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of the backend's health, produced on every observed transition.
 *
 * @param state               lifecycle state at the time of the observation
 * @param timestamp           when the observation was made
 * @param latency             round-trip time of the health check that produced it (may be null)
 * @param errorMessage        diagnostic message for failed or error states (may be null)
 * @param consecutiveFailures failed health checks in a row at the time of the observation
 */
public record HealthStatus(
        BackendState state,
        Instant timestamp,
        Duration latency,
        String errorMessage,
        int consecutiveFailures
) {

    public HealthStatus {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        if (consecutiveFailures < 0) {
            throw new IllegalArgumentException(
                    "consecutiveFailures must be >= 0, got: " + consecutiveFailures);
        }
    }

    /** Status without latency or error detail, stamped now. */
    public static HealthStatus of(BackendState state, int consecutiveFailures) {
        return new HealthStatus(state, Instant.now(), null, null, consecutiveFailures);
    }

    public static HealthStatus running(Duration latency) {
        return new HealthStatus(BackendState.RUNNING, Instant.now(), latency, null, 0);
    }

    public static HealthStatus unresponsive(int consecutiveFailures) {
        return new HealthStatus(BackendState.UNRESPONSIVE, Instant.now(), null,
                "Health check failed", consecutiveFailures);
    }

    public static HealthStatus error(String errorMessage, int consecutiveFailures) {
        return new HealthStatus(BackendState.ERROR, Instant.now(), null, errorMessage, consecutiveFailures);
    }

    public boolean isHealthy() {
        return state == BackendState.RUNNING;
    }
}
