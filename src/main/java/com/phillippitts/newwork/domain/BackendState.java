package com.phillippitts.newwork.domain;

/**
 * Lifecycle states of the embedded backend process.
 *
 * <pre>
 * STOPPED -(start)-> STARTING -(health OK)-> RUNNING -(N failed checks)-> UNRESPONSIVE
 * UNRESPONSIVE -(auto-restart)-> RESTARTING -(health OK)-> RUNNING
 * RESTARTING -(limit reached or start failed)-> ERROR
 * any -(explicit stop)-> STOPPED
 * </pre>
 *
 * <p>{@link #ERROR} is sticky: only a user-initiated restart leaves it.
 */
public enum BackendState {
    STOPPED,
    STARTING,
    RUNNING,
    UNRESPONSIVE,
    RESTARTING,
    ERROR
}
