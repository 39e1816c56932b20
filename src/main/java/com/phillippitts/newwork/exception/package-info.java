/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.newwork.exception.NewWorkException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.newwork.exception.BackendStartException} - The backend could
 *       not be started (spawn failure, exited during startup)
 *     <ul>
 *       <li>{@link com.phillippitts.newwork.exception.ExecutableNotFoundException} - nothing
 *           to launch at the resolved path</li>
 *       <li>{@link com.phillippitts.newwork.exception.StartupTimeoutException} - spawned but
 *           never became healthy</li>
 *     </ul>
 *   </li>
 *   <li>{@link com.phillippitts.newwork.exception.BackendCrashException} - unexpected exit,
 *       carries the exit code</li>
 *   <li>{@link com.phillippitts.newwork.exception.RestartLimitExceededException} - automatic
 *       restarts exhausted; the user has to act</li>
 *   <li>{@link com.phillippitts.newwork.exception.SystemRestartException} - a graceful system
 *       restart phase failed or timed out</li>
 * </ul>
 *
 * <p>All exceptions are unchecked. Lifecycle failures are thrown to the direct caller;
 * steady-state faults travel as {@link com.phillippitts.newwork.domain.ErrorRecord}s instead.
 * REST mapping lives in {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.newwork.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.newwork.exception;
