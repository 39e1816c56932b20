package com.phillippitts.newwork.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable, classified fault report routed through the recovery orchestrator.
 *
 * <p>Prefer the category factories ({@link #api}, {@link #backend}, {@link #render},
 * {@link #runtime}); they apply the default severity and recoverability of each category.
 *
 * @param id               unique id for correlating logs and UI prompts
 * @param category         origin of the fault
 * @param severity         how serious the fault is
 * @param message          human-readable description
 * @param technicalDetails short diagnostic detail such as "HTTP 503" or "Exit code: 1" (may be null)
 * @param recoverable      whether automatic recovery may be attempted
 * @param cause            wrapped exception (may be null)
 * @param timestamp        when the fault was recorded
 */
public record ErrorRecord(
        String id,
        ErrorCategory category,
        ErrorSeverity severity,
        String message,
        String technicalDetails,
        boolean recoverable,
        Throwable cause,
        Instant timestamp
) {

    public ErrorRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    /**
     * Transport-level failure against the backend API.
     *
     * <p>Client errors (4xx other than 408) are not recoverable: restarting the backend
     * cannot fix a bad request. Missing status codes (connection refused, timeouts) are.
     *
     * @param statusCode HTTP status, or null when no response was received
     */
    public static ErrorRecord api(String message, Integer statusCode, Throwable cause) {
        boolean recoverable = statusCode == null || statusCode >= 500 || statusCode == 408;
        ErrorSeverity severity = statusCode != null && statusCode == 408
                ? ErrorSeverity.INFO
                : ErrorSeverity.WARNING;
        return create(ErrorCategory.API, severity, message,
                statusCode != null ? "HTTP " + statusCode : null, recoverable, cause);
    }

    public static ErrorRecord backend(String message, Integer exitCode, Throwable cause) {
        return backend(message, exitCode, cause, true);
    }

    public static ErrorRecord backend(String message, Integer exitCode, Throwable cause, boolean recoverable) {
        return create(ErrorCategory.BACKEND, ErrorSeverity.WARNING, message,
                exitCode != null ? "Exit code: " + exitCode : null, recoverable, cause);
    }

    /** Rendering faults always reach the user-visible fallback, never a silent retry. */
    public static ErrorRecord render(String message, Throwable cause) {
        return create(ErrorCategory.RENDER, ErrorSeverity.WARNING, message, null, true, cause);
    }

    /**
     * Application-logic fault. Critical runtime faults are not auto-recoverable and escalate
     * to a full restart recommendation.
     */
    public static ErrorRecord runtime(String message, boolean critical, Throwable cause) {
        ErrorSeverity severity = critical ? ErrorSeverity.CRITICAL : ErrorSeverity.WARNING;
        return create(ErrorCategory.RUNTIME, severity, message, null, !critical, cause);
    }

    private static ErrorRecord create(ErrorCategory category, ErrorSeverity severity, String message,
                                      String technicalDetails, boolean recoverable, Throwable cause) {
        return new ErrorRecord(UUID.randomUUID().toString(), category, severity, message,
                technicalDetails, recoverable, cause, Instant.now());
    }

    /** Sentence suitable for showing to the user; never contains technical detail. */
    public String userMessage() {
        return switch (category) {
            case API -> "There is a problem connecting to the local service. Please try again shortly.";
            case BACKEND -> "The local service ran into a problem. Attempting to restart it.";
            case RENDER -> "Something went wrong while displaying this screen.";
            case RUNTIME -> severity == ErrorSeverity.CRITICAL
                    ? "A serious error occurred. Please restart the application."
                    : "An unexpected error occurred.";
        };
    }
}
