/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.newwork.exception.ExecutableNotFoundException} → 503 Service Unavailable</li>
 *   <li>{@link com.phillippitts.newwork.exception.BackendStartException} → 503 Service Unavailable (retry)</li>
 *   <li>invalid request body → 400 Bad Request</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "StartupTimeoutException",
 *   "message": "Backend failed to start",
 *   "details": "Please retry in a few seconds",
 *   "timestamp": "2026-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.newwork.presentation.exception;
