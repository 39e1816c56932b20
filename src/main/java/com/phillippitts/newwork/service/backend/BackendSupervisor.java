package com.phillippitts.newwork.service.backend;

import com.phillippitts.newwork.domain.HealthStatus;

import java.time.Duration;

/**
 * Lifecycle of the local backend process: spawn, readiness, periodic health monitoring,
 * termination and restart.
 *
 * <p>Status changes are published as
 * {@link com.phillippitts.newwork.service.backend.event.BackendHealthEvent}s; crashes and
 * threshold crossings as {@link com.phillippitts.newwork.service.backend.event.BackendFaultEvent}s.
 */
public interface BackendSupervisor {

    /**
     * Starts the backend and blocks until it answers healthy. No-op if already running.
     *
     * @throws com.phillippitts.newwork.exception.ExecutableNotFoundException if the executable is missing
     * @throws com.phillippitts.newwork.exception.StartupTimeoutException if readiness polling is exhausted
     * @throws com.phillippitts.newwork.exception.BackendStartException if the process cannot be spawned
     *         or exits during startup
     */
    void startProcess();

    /** Stops the backend (graceful, then forced). No-op if not running. */
    void stopProcess();

    /** Restarts with the configured {@code backend.restart-delay}. */
    void restartProcess();

    /** Stops, waits {@code delay}, starts. Failures of the start step propagate. */
    void restartProcess(Duration delay);

    /** One bounded health probe; never throws. */
    boolean checkHealth();

    /** Most recently emitted status. */
    HealthStatus currentStatus();

    /** True while a process handle exists. */
    boolean isRunning();

    /** Moves to ERROR with {@code message}; used when automatic recovery gives up. */
    void markFailed(String message);
}
