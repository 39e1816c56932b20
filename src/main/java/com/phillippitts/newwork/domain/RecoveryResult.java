package com.phillippitts.newwork.domain;

/**
 * Outcome of a recovery dispatch.
 */
public enum RecoveryResult {
    SUCCESS,
    /** Another recovery was already running; nothing was done. */
    IN_PROGRESS,
    FAILED_RETRYABLE,
    FAILED_PERMANENT,
    /** Automatic recovery is exhausted or not applicable; the UI must prompt the user. */
    USER_ACTION_REQUIRED
}
