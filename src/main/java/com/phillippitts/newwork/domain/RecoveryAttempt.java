package com.phillippitts.newwork.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of one recovery dispatch and its result.
 *
 * @param error       the fault that triggered the dispatch
 * @param result      outcome of the dispatch
 * @param actionTaken short description of what was done, shown to the user
 * @param timestamp   when the outcome was recorded
 */
public record RecoveryAttempt(
        ErrorRecord error,
        RecoveryResult result,
        String actionTaken,
        Instant timestamp
) {

    public RecoveryAttempt {
        Objects.requireNonNull(error, "error must not be null");
        Objects.requireNonNull(result, "result must not be null");
        Objects.requireNonNull(actionTaken, "actionTaken must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public static RecoveryAttempt of(ErrorRecord error, RecoveryResult result, String actionTaken) {
        return new RecoveryAttempt(error, result, actionTaken, Instant.now());
    }
}
