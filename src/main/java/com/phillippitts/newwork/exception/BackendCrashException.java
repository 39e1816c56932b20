package com.phillippitts.newwork.exception;

/**
 * Describes an unexpected termination of the backend process.
 *
 * <p>Never thrown across the monitor boundary: the supervisor wraps it in a
 * BACKEND {@link com.phillippitts.newwork.domain.ErrorRecord} and hands it to the orchestrator.
 */
public class BackendCrashException extends NewWorkException {

    private final int exitCode;

    public BackendCrashException(int exitCode) {
        super("Backend process terminated unexpectedly (exitCode=" + exitCode + ")");
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
