/**
 * Immutable domain model shared by the supervisor, the recovery orchestrator and the
 * presentation layer.
 *
 * <ul>
 *   <li>{@link com.phillippitts.newwork.domain.HealthStatus} - one observation of the backend's state</li>
 *   <li>{@link com.phillippitts.newwork.domain.ErrorRecord} - a classified fault
 *       ({@link com.phillippitts.newwork.domain.ErrorCategory},
 *       {@link com.phillippitts.newwork.domain.ErrorSeverity})</li>
 *   <li>{@link com.phillippitts.newwork.domain.RecoveryAttempt} - outcome of one recovery dispatch</li>
 * </ul>
 *
 * <p>All types are records or enums; consumers receive new values rather than shared mutable state.
 */
package com.phillippitts.newwork.domain;
