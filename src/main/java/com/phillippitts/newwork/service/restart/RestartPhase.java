package com.phillippitts.newwork.service.restart;

/**
 * Phases of a graceful system restart, in execution order. COMPLETED and FAILED are terminal.
 */
public enum RestartPhase {
    IDLE,
    PREPARING,
    SHUTTING_DOWN,
    RESTARTING,
    RECOVERING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
