package com.phillippitts.newwork.service.backend.event;

import com.phillippitts.newwork.domain.HealthStatus;

import java.util.Objects;

/**
 * Published on every status the supervisor emits, in emission order.
 *
 * @param status the new backend status
 */
public record BackendHealthEvent(HealthStatus status) {
    public BackendHealthEvent {
        Objects.requireNonNull(status, "status");
    }
}
