package com.phillippitts.newwork.service.restart;

/**
 * Whole-system restart, the escalation path when backend-only recovery is not enough.
 */
public interface SystemRestartCoordinator {

    /**
     * Runs all restart phases and blocks until they complete or one fails.
     *
     * @return true if the backend is healthy afterwards; false if a phase failed or a restart
     *         was already running
     */
    boolean performGracefulRestart();

    /**
     * Restarts only the backend and waits for it to answer healthy.
     *
     * @return true if healthy afterwards
     */
    boolean quickRestartBackend();

    boolean isRestarting();

    /** Phase of the current or most recent restart; IDLE before the first one. */
    RestartPhase getCurrentPhase();
}
