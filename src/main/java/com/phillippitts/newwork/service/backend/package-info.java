/**
 * Backend process supervision: executable resolution per platform, spawn and readiness
 * polling, periodic health monitoring, crash detection and restart.
 *
 * <p>{@link com.phillippitts.newwork.service.backend.BackendSupervisor} is the seam the
 * recovery layer depends on; {@link com.phillippitts.newwork.service.backend.BackendProcessSupervisor}
 * is the only production implementation.
 */
package com.phillippitts.newwork.service.backend;
