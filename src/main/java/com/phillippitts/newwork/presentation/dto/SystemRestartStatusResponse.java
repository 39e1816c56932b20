package com.phillippitts.newwork.presentation.dto;

import com.phillippitts.newwork.service.restart.RestartPhase;

/**
 * Progress of the full system restart, polled by the restart dialog.
 *
 * @param phase      current or last phase
 * @param restarting whether a restart is running now
 * @param finished   whether the last restart reached COMPLETED or FAILED
 */
public record SystemRestartStatusResponse(String phase, boolean restarting, boolean finished) {

    public static SystemRestartStatusResponse of(RestartPhase phase, boolean restarting) {
        return new SystemRestartStatusResponse(phase.name(), restarting, phase.isTerminal());
    }
}
