/**
 * Error intake and automatic recovery.
 *
 * <p>{@link com.phillippitts.newwork.service.recovery.ErrorRecoveryOrchestrator} receives
 * faults from the UI (via the REST API) and from the backend supervisor (via
 * {@link com.phillippitts.newwork.service.backend.event.BackendFaultEvent}), dispatches a
 * recovery strategy per {@link com.phillippitts.newwork.domain.ErrorCategory}, and bounds
 * automatic restarts with a sliding-window
 * {@link com.phillippitts.newwork.service.recovery.RestartLimiter}.
 */
package com.phillippitts.newwork.service.recovery;
