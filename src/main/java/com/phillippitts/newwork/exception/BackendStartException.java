package com.phillippitts.newwork.exception;

/**
 * Thrown when the embedded backend cannot be brought to a running state.
 * Subclasses narrow down why; this type is used directly for spawn I/O failures and
 * for a child that exits while it is still being polled for readiness.
 */
public class BackendStartException extends NewWorkException {

    private final Integer exitCode;

    public BackendStartException(String message) {
        super(message);
        this.exitCode = null;
    }

    public BackendStartException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = null;
    }

    public BackendStartException(String message, int exitCode) {
        super(message + " (exitCode=" + exitCode + ")");
        this.exitCode = exitCode;
    }

    /** Exit code of the child if it terminated during startup, otherwise null. */
    public Integer getExitCode() {
        return exitCode;
    }
}
