package com.phillippitts.newwork.service.recovery.event;

import com.phillippitts.newwork.domain.RecoveryAttempt;

import java.util.Objects;

/**
 * Published for every recovery attempt appended to history, including the in-progress marker.
 *
 * @param attempt the recorded attempt
 */
public record RecoveryAttemptEvent(RecoveryAttempt attempt) {
    public RecoveryAttemptEvent {
        Objects.requireNonNull(attempt, "attempt");
    }
}
