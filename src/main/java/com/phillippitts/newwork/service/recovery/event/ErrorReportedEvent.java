package com.phillippitts.newwork.service.recovery.event;

import com.phillippitts.newwork.domain.ErrorRecord;

import java.util.Objects;

/**
 * Published for every error accepted by the orchestrator, before any recovery runs.
 *
 * @param error the reported error
 */
public record ErrorReportedEvent(ErrorRecord error) {
    public ErrorReportedEvent {
        Objects.requireNonNull(error, "error");
    }
}
