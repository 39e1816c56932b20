package com.phillippitts.newwork.service.backend;

import java.time.Duration;

/**
 * Single liveness probe against the backend.
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * Performs one best-effort check.
     *
     * <p>Implementations must not throw and must return within roughly {@code timeout};
     * an overrunning check is abandoned and reported as unhealthy.
     *
     * @param timeout upper bound for the check
     * @return true if the backend answered healthy
     */
    boolean isHealthy(Duration timeout);
}
