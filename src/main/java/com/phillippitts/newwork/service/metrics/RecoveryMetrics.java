package com.phillippitts.newwork.service.metrics;

import com.phillippitts.newwork.domain.BackendState;
import com.phillippitts.newwork.domain.ErrorCategory;
import com.phillippitts.newwork.domain.ErrorSeverity;
import com.phillippitts.newwork.domain.RecoveryResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;

/**
 * Metrics for backend supervision and error recovery.
 *
 * <ul>
 *   <li>{@code newwork.errors}: reported errors per category and severity</li>
 *   <li>{@code newwork.recovery.attempts}: recovery outcomes per category and result</li>
 *   <li>{@code newwork.backend.status}: emitted backend statuses per state</li>
 *   <li>{@code newwork.backend.health.latency}: successful health check round trips</li>
 *   <li>{@code newwork.system.restarts}: finished graceful restarts per outcome</li>
 * </ul>
 */
@Component
public class RecoveryMetrics {

    private static final String METRIC_PREFIX = "newwork";

    private final MeterRegistry registry;

    public RecoveryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementError(ErrorCategory category, ErrorSeverity severity) {
        Counter.builder(METRIC_PREFIX + ".errors")
                .description("Number of reported errors")
                .tag("category", tag(category))
                .tag("severity", tag(severity))
                .register(registry)
                .increment();
    }

    public void incrementRecovery(ErrorCategory category, RecoveryResult result) {
        Counter.builder(METRIC_PREFIX + ".recovery.attempts")
                .description("Number of recovery attempts by outcome")
                .tag("category", tag(category))
                .tag("result", tag(result))
                .register(registry)
                .increment();
    }

    public void incrementBackendStatus(BackendState state) {
        Counter.builder(METRIC_PREFIX + ".backend.status")
                .description("Number of backend status emissions")
                .tag("state", tag(state))
                .register(registry)
                .increment();
    }

    public void recordHealthLatency(Duration latency) {
        Timer.builder(METRIC_PREFIX + ".backend.health.latency")
                .description("Round trip of successful backend health checks")
                .register(registry)
                .record(latency);
    }

    public void incrementSystemRestart(boolean success) {
        Counter.builder(METRIC_PREFIX + ".system.restarts")
                .description("Number of finished graceful system restarts")
                .tag("outcome", success ? "completed" : "failed")
                .register(registry)
                .increment();
    }

    private static String tag(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
