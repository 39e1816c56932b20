package com.phillippitts.newwork.service.backend.event;

import com.phillippitts.newwork.domain.ErrorRecord;

import java.util.Objects;

/**
 * Published when the backend crashes, fails to start, or crosses the consecutive health
 * failure threshold. Consumed by the recovery orchestrator.
 *
 * @param error the fault, category BACKEND
 */
public record BackendFaultEvent(ErrorRecord error) {
    public BackendFaultEvent {
        Objects.requireNonNull(error, "error");
    }
}
