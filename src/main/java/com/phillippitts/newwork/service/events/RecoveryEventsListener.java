package com.phillippitts.newwork.service.events;

import com.phillippitts.newwork.domain.BackendState;
import com.phillippitts.newwork.domain.ErrorRecord;
import com.phillippitts.newwork.domain.HealthStatus;
import com.phillippitts.newwork.domain.RecoveryAttempt;
import com.phillippitts.newwork.domain.RecoveryResult;
import com.phillippitts.newwork.service.backend.event.BackendHealthEvent;
import com.phillippitts.newwork.service.metrics.RecoveryMetrics;
import com.phillippitts.newwork.service.recovery.event.ErrorReportedEvent;
import com.phillippitts.newwork.service.recovery.event.RecoveryAttemptEvent;
import com.phillippitts.newwork.service.restart.RestartPhase;
import com.phillippitts.newwork.service.restart.event.RestartProgressEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns backend and recovery events into metrics and user-facing log lines. User-facing
 * messages are throttled per key to avoid log spam.
 */
@Component
class RecoveryEventsListener {
    private static final Logger LOG = LogManager.getLogger(RecoveryEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final RecoveryMetrics metrics;

    RecoveryEventsListener(RecoveryMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onBackendHealth(BackendHealthEvent e) {
        HealthStatus status = e.status();
        metrics.incrementBackendStatus(status.state());
        if (status.state() == BackendState.RUNNING && status.latency() != null) {
            metrics.recordHealthLatency(status.latency());
        }
        if (status.state() == BackendState.ERROR && shouldLog("backend-error")) {
            LOG.warn("Backend unavailable: {}", status.errorMessage());
        }
    }

    @EventListener
    void onErrorReported(ErrorReportedEvent e) {
        ErrorRecord error = e.error();
        metrics.incrementError(error.category(), error.severity());
        if (shouldLog("error-" + error.category())) {
            LOG.warn("User notice: {}", error.userMessage());
        }
    }

    @EventListener
    void onRecoveryAttempt(RecoveryAttemptEvent e) {
        RecoveryAttempt attempt = e.attempt();
        if (attempt.result() == RecoveryResult.IN_PROGRESS) {
            return;
        }
        metrics.incrementRecovery(attempt.error().category(), attempt.result());
        if (attempt.result() == RecoveryResult.USER_ACTION_REQUIRED && shouldLog("user-action-" + attempt.error().category())) {
            LOG.warn("Action required: {}", attempt.actionTaken());
        }
    }

    @EventListener
    void onRestartProgress(RestartProgressEvent e) {
        if (e.phase() == RestartPhase.FAILED) {
            metrics.incrementSystemRestart(false);
            LOG.error("System restart failed: {}", e.errorMessage());
        } else if (e.phase() == RestartPhase.COMPLETED) {
            metrics.incrementSystemRestart(true);
            LOG.info("System restart completed");
        } else {
            LOG.info("System restart: {} ({}%)", e.message(), Math.round(e.progress() * 100));
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
