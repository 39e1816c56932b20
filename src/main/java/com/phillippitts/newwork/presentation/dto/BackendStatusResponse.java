package com.phillippitts.newwork.presentation.dto;

import com.phillippitts.newwork.domain.HealthStatus;

import java.time.Instant;

/**
 * Backend status as shown to the UI.
 */
public record BackendStatusResponse(
        String state,
        Instant since,
        Long latencyMs,
        String errorMessage,
        int consecutiveFailures,
        boolean running,
        boolean recovering,
        int remainingRecoveryAttempts
) {
    public static BackendStatusResponse of(HealthStatus status, boolean running, boolean recovering, int remaining) {
        return new BackendStatusResponse(
                status.state().name(),
                status.timestamp(),
                status.latency() == null ? null : status.latency().toMillis(),
                status.errorMessage(),
                status.consecutiveFailures(),
                running,
                recovering,
                remaining);
    }
}
