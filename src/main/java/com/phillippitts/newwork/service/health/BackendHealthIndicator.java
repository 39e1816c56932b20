package com.phillippitts.newwork.service.health;

import com.phillippitts.newwork.domain.HealthStatus;
import com.phillippitts.newwork.service.backend.BackendSupervisor;
import com.phillippitts.newwork.service.recovery.ErrorRecoveryOrchestrator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the supervised backend process.
 *
 * <ul>
 *   <li>UP: backend RUNNING</li>
 *   <li>DEGRADED: backend STARTING, RESTARTING or UNRESPONSIVE</li>
 *   <li>DOWN: backend STOPPED or in ERROR</li>
 * </ul>
 *
 * <p>Reads the last emitted status only; never probes the backend. Exposed via
 * /actuator/health.
 */
@Component
public class BackendHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final BackendSupervisor supervisor;
    private final ErrorRecoveryOrchestrator orchestrator;

    public BackendHealthIndicator(BackendSupervisor supervisor, ErrorRecoveryOrchestrator orchestrator) {
        this.supervisor = supervisor;
        this.orchestrator = orchestrator;
    }

    @Override
    public Health health() {
        HealthStatus status = supervisor.currentStatus();
        Health.Builder builder = switch (status.state()) {
            case RUNNING -> Health.up();
            case STARTING, RESTARTING, UNRESPONSIVE -> Health.status(DEGRADED);
            case STOPPED, ERROR -> Health.down();
        };
        builder.withDetail("state", status.state().name())
                .withDetail("since", status.timestamp().toString())
                .withDetail("consecutiveFailures", status.consecutiveFailures())
                .withDetail("recovering", orchestrator.isRecovering())
                .withDetail("remainingRecoveryAttempts", orchestrator.remainingRecoveryAttempts());
        if (status.latency() != null) {
            builder.withDetail("latencyMs", status.latency().toMillis());
        }
        if (status.errorMessage() != null) {
            builder.withDetail("error", status.errorMessage());
        }
        return builder.build();
    }
}
