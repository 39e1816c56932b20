package com.phillippitts.newwork.util;

import java.time.Duration;

/**
 * Standard timeout values for backend process and thread management.
 *
 * <p>The graceful stop window for a running backend is configurable
 * ({@code backend.graceful-stop-timeout}); the values here cover cleanup paths that are not.
 *
 * @see com.phillippitts.newwork.service.backend.BackendProcessSupervisor
 */
public final class ProcessTimeouts {

    /**
     * Timeout for output logger threads to drain buffered output after the process exits.
     */
    public static final Duration OUTPUT_DRAIN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for graceful termination of a backend that never became healthy.
     *
     * <p>Shorter than the configurable stop timeout: a process that failed startup has no
     * in-flight work worth waiting for.
     */
    public static final Duration ABANDON_GRACE_TIMEOUT = Duration.ofMillis(500);

    /**
     * Wait after {@link Process#destroyForcibly()} before the handle is given up on. A backend
     * still alive after this is logged and left to the OS.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofSeconds(1);

    private ProcessTimeouts() {
    }
}
