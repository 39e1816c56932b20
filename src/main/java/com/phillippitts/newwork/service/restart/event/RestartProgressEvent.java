package com.phillippitts.newwork.service.restart.event;

import com.phillippitts.newwork.service.restart.RestartPhase;

import java.time.Instant;
import java.util.Objects;

/**
 * Progress of a graceful system restart.
 *
 * @param phase        current phase
 * @param progress     fraction complete, 0.0 to 1.0
 * @param message      user-facing description of the phase
 * @param errorMessage failure detail, only for {@link RestartPhase#FAILED}
 * @param timestamp    when the phase was entered
 */
public record RestartProgressEvent(
        RestartPhase phase,
        double progress,
        String message,
        String errorMessage,
        Instant timestamp
) {
    public RestartProgressEvent {
        Objects.requireNonNull(phase, "phase");
        if (progress < 0.0 || progress > 1.0) {
            throw new IllegalArgumentException("progress must be within [0, 1], got: " + progress);
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public RestartProgressEvent(RestartPhase phase, double progress, String message) {
        this(phase, progress, message, null, Instant.now());
    }
}
