package com.phillippitts.newwork.exception;

/**
 * Raised when a phase of a graceful system restart fails or overruns its timeout.
 */
public class SystemRestartException extends NewWorkException {

    private final String phase;

    public SystemRestartException(String phase, String message) {
        super("System restart failed during " + phase + ": " + message);
        this.phase = phase;
    }

    public SystemRestartException(String phase, String message, Throwable cause) {
        super("System restart failed during " + phase + ": " + message, cause);
        this.phase = phase;
    }

    public String getPhase() {
        return phase;
    }
}
