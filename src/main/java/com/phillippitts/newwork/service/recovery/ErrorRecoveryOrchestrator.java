package com.phillippitts.newwork.service.recovery;

import com.phillippitts.newwork.config.properties.RecoveryProperties;
import com.phillippitts.newwork.domain.ErrorCategory;
import com.phillippitts.newwork.domain.ErrorRecord;
import com.phillippitts.newwork.domain.ErrorSeverity;
import com.phillippitts.newwork.domain.RecoveryAttempt;
import com.phillippitts.newwork.domain.RecoveryResult;
import com.phillippitts.newwork.exception.BackendStartException;
import com.phillippitts.newwork.exception.ExecutableNotFoundException;
import com.phillippitts.newwork.exception.RestartLimitExceededException;
import com.phillippitts.newwork.service.backend.BackendSupervisor;
import com.phillippitts.newwork.service.backend.event.BackendFaultEvent;
import com.phillippitts.newwork.service.recovery.event.ErrorReportedEvent;
import com.phillippitts.newwork.service.recovery.event.RecoveryAttemptEvent;
import com.phillippitts.newwork.service.restart.SystemRestartCoordinator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Central error intake and recovery dispatcher.
 *
 * <p>Every reported error is appended to a bounded history and announced as an
 * {@link ErrorReportedEvent}. Recoverable errors are dispatched by category:
 * <ul>
 *   <li>API: if the backend still answers, the caller falls back to cached data; otherwise the
 *       error escalates to a backend restart</li>
 *   <li>BACKEND: restart the backend; a restart that throws is retried while the
 *       {@link RestartLimiter} allows</li>
 *   <li>RENDER: the UI shows a fallback view, so the user must act</li>
 *   <li>RUNTIME: non-critical errors are left to the failing component; critical ones are
 *       not recoverable and recommend a full system restart</li>
 * </ul>
 *
 * <p><b>Single-flight:</b> at most one recovery runs at a time. A concurrent request returns
 * {@link RecoveryResult#IN_PROGRESS} immediately and starts nothing.
 *
 * <p><b>Retry budget:</b> every attempt counts against the sliding-window limiter. Once it is
 * exhausted, recovery stops and the user is asked to restart manually. The supervisor is marked
 * failed only when the refused recovery needed a backend restart. {@link #restartBackendManually()} resets the budget.
 */
@Service
public class ErrorRecoveryOrchestrator {

    private static final Logger LOG = LogManager.getLogger(ErrorRecoveryOrchestrator.class);

    static final String MDC_ERROR_ID = "errorId";
    static final String MDC_CATEGORY = "recoveryCategory";

    private final BackendSupervisor supervisor;
    private final RestartLimiter limiter;
    private final RestartDelayPolicy delayPolicy;
    private final ApplicationEventPublisher publisher;
    private final Supplier<SystemRestartCoordinator> restartCoordinator;
    private final int errorHistoryCapacity;
    private final int recoveryHistoryCapacity;

    private final Deque<ErrorRecord> errorHistory = new ArrayDeque<>();
    private final Deque<RecoveryAttempt> recoveryHistory = new ArrayDeque<>();
    private final AtomicBoolean recovering = new AtomicBoolean(false);

    @Autowired
    public ErrorRecoveryOrchestrator(BackendSupervisor supervisor,
                                     RestartLimiter limiter,
                                     RestartDelayPolicy delayPolicy,
                                     RecoveryProperties props,
                                     ApplicationEventPublisher publisher,
                                     ObjectProvider<SystemRestartCoordinator> restartCoordinator) {
        this(supervisor, limiter, delayPolicy, props, publisher, (Supplier<SystemRestartCoordinator>)
                restartCoordinator::getIfAvailable);
    }

    public ErrorRecoveryOrchestrator(BackendSupervisor supervisor,
                                     RestartLimiter limiter,
                                     RestartDelayPolicy delayPolicy,
                                     RecoveryProperties props,
                                     ApplicationEventPublisher publisher,
                                     Supplier<SystemRestartCoordinator> restartCoordinator) {
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        this.delayPolicy = Objects.requireNonNull(delayPolicy, "delayPolicy");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.restartCoordinator = Objects.requireNonNull(restartCoordinator, "restartCoordinator");
        this.errorHistoryCapacity = props.getErrorHistoryCapacity();
        this.recoveryHistoryCapacity = props.getRecoveryHistoryCapacity();
    }

    /**
     * Records an error and, if recoverable, attempts recovery on the calling thread.
     *
     * @return outcome of the recovery; {@link RecoveryResult#FAILED_PERMANENT} for
     *         non-recoverable errors, critical ones included
     */
    public RecoveryResult reportError(ErrorRecord error) {
        Objects.requireNonNull(error, "error");
        LOG.warn("Error reported: id={}, category={}, severity={}, recoverable={}, message={}",
                error.id(), error.category(), error.severity(), error.recoverable(), error.message());
        appendBounded(errorHistory, error, errorHistoryCapacity);
        publisher.publishEvent(new ErrorReportedEvent(error));

        if (!error.recoverable()) {
            if (error.severity() == ErrorSeverity.CRITICAL) {
                LOG.error("Critical error {} is not recoverable; full system restart recommended", error.id());
                record(error, RecoveryResult.USER_ACTION_REQUIRED, "Full system restart recommended");
                return RecoveryResult.FAILED_PERMANENT;
            }
            LOG.warn("Error {} is not recoverable; no automatic recovery", error.id());
            return RecoveryResult.FAILED_PERMANENT;
        }
        return attemptRecovery(error);
    }

    /**
     * Runs the recovery strategy for {@code error}'s category.
     */
    public RecoveryResult attemptRecovery(ErrorRecord error) {
        Objects.requireNonNull(error, "error");
        if (!recovering.compareAndSet(false, true)) {
            LOG.info("Recovery already in progress; not starting another for {} error {}",
                    error.category(), error.id());
            return RecoveryResult.IN_PROGRESS;
        }
        ThreadContext.put(MDC_ERROR_ID, error.id());
        ThreadContext.put(MDC_CATEGORY, error.category().name());
        try {
            try {
                limiter.acquire();
            } catch (RestartLimitExceededException limit) {
                return giveUp(error, "", limit, restartRefused(error));
            }
            record(error, RecoveryResult.IN_PROGRESS, plannedAction(error));
            return switch (error.category()) {
                case API -> recoverApi(error);
                case BACKEND -> restartBackend(error);
                case RENDER -> record(error, RecoveryResult.USER_ACTION_REQUIRED, "Show fallback view with retry option");
                case RUNTIME -> recoverRuntime(error);
            };
        } catch (RuntimeException e) {
            LOG.error("Recovery for error {} failed: {}", error.id(), e.toString(), e);
            return record(error, RecoveryResult.FAILED_RETRYABLE, "Recovery failed: " + e.getMessage());
        } finally {
            ThreadContext.remove(MDC_ERROR_ID);
            ThreadContext.remove(MDC_CATEGORY);
            recovering.set(false);
        }
    }

    /**
     * Backend faults (crash, failed start, unresponsive) arrive here from the supervisor.
     */
    @EventListener
    @Async("recoveryExecutor")
    public void onBackendFault(BackendFaultEvent event) {
        reportError(event.error());
    }

    /**
     * User-initiated restart. Resets the retry budget first, so it works after automatic
     * recovery gave up.
     *
     * @throws BackendStartException if the backend cannot be started
     */
    public void restartBackendManually() {
        LOG.info("Manual backend restart requested; resetting recovery limiter");
        limiter.reset();
        supervisor.restartProcess();
    }

    /**
     * Escalates to a full system restart.
     *
     * @return true if the restart completed and the backend is healthy
     */
    public boolean triggerSystemRestart() {
        SystemRestartCoordinator coordinator = restartCoordinator.get();
        if (coordinator == null) {
            LOG.warn("System restart requested but no coordinator is available");
            return false;
        }
        LOG.warn("Triggering full system restart");
        boolean ok = coordinator.performGracefulRestart();
        if (ok) {
            limiter.reset();
        }
        return ok;
    }

    public List<ErrorRecord> errorHistory() {
        synchronized (errorHistory) {
            return List.copyOf(errorHistory);
        }
    }

    public List<RecoveryAttempt> recoveryHistory() {
        synchronized (recoveryHistory) {
            return List.copyOf(recoveryHistory);
        }
    }

    /** Errors of {@code category} reported within the last {@code window}. */
    public long recentErrorCount(ErrorCategory category, Duration window) {
        Instant cutoff = Instant.now().minus(window);
        synchronized (errorHistory) {
            return errorHistory.stream()
                    .filter(e -> e.category() == category && e.timestamp().isAfter(cutoff))
                    .count();
        }
    }

    public boolean isRecovering() {
        return recovering.get();
    }

    /** Restores the full automatic-recovery budget without restarting anything. */
    public void resetRecoveryLimiter() {
        limiter.reset();
        LOG.info("Recovery limiter reset");
    }

    public int remainingRecoveryAttempts() {
        return limiter.remainingAttempts();
    }

    public void clearHistory() {
        synchronized (errorHistory) {
            errorHistory.clear();
        }
        synchronized (recoveryHistory) {
            recoveryHistory.clear();
        }
        LOG.info("Error and recovery history cleared");
    }

    private RecoveryResult recoverApi(ErrorRecord error) {
        if (supervisor.checkHealth()) {
            LOG.info("Backend healthy; API error {} handled by cached-data fallback", error.id());
            return record(error, RecoveryResult.FAILED_RETRYABLE, "Backend healthy; fall back to locally cached data");
        }
        LOG.warn("Backend not responding; escalating API error {} to backend restart", error.id());
        return restartBackend(error);
    }

    private RecoveryResult restartBackend(ErrorRecord error) {
        int attempt = limiter.attemptsInWindow();
        while (true) {
            Duration delay = delayPolicy.delayFor(attempt);
            try {
                supervisor.restartProcess(delay);
                if (supervisor.checkHealth()) {
                    LOG.info("Backend restarted successfully (attempt {})", attempt);
                    return record(error, RecoveryResult.SUCCESS, "Backend restarted");
                }
                // the health monitor reports it again if it stays down
                LOG.warn("Backend restarted but did not answer its health check (attempt {})", attempt);
                return record(error, RecoveryResult.FAILED_RETRYABLE, "Backend restarted but not responding");
            } catch (ExecutableNotFoundException e) {
                LOG.error("Backend executable missing; restart cannot succeed: {}", e.getMessage());
                supervisor.markFailed("Backend executable missing; reinstall the application");
                return record(error, RecoveryResult.FAILED_PERMANENT, "Backend executable missing; reinstall required");
            } catch (BackendStartException e) {
                LOG.warn("Backend restart attempt {} failed: {}", attempt, e.getMessage());
            }
            try {
                limiter.acquire();
            } catch (RestartLimitExceededException limit) {
                return giveUp(error, "Backend restart failed; ", limit, true);
            }
            attempt = limiter.attemptsInWindow();
        }
    }

    private RecoveryResult recoverRuntime(ErrorRecord error) {
        if (error.severity() == ErrorSeverity.CRITICAL) {
            LOG.error("Critical runtime error {}; full system restart recommended", error.id());
            return record(error, RecoveryResult.USER_ACTION_REQUIRED, "Full system restart recommended");
        }
        return record(error, RecoveryResult.SUCCESS, "Component reload left to the failing component");
    }

    /**
     * True when the denied recovery would have had to restart the backend. A healthy backend
     * behind an API error never needs one.
     */
    private boolean restartRefused(ErrorRecord error) {
        if (error.category() == ErrorCategory.BACKEND) {
            return true;
        }
        return error.category() == ErrorCategory.API && !supervisor.checkHealth();
    }

    private RecoveryResult giveUp(ErrorRecord error, String prefix, RestartLimitExceededException limit,
                                  boolean restartRefused) {
        LOG.error("Giving up on error {}: {}", error.id(), limit.getMessage());
        if (restartRefused) {
            supervisor.markFailed(limit.getMessage());
        }
        return record(error, RecoveryResult.USER_ACTION_REQUIRED, prefix + limit.getMessage());
    }

    private static String plannedAction(ErrorRecord error) {
        return switch (error.category()) {
            case API -> "Checking backend health";
            case BACKEND -> "Restarting backend";
            case RENDER -> "Showing fallback view";
            case RUNTIME -> "Evaluating runtime error";
        };
    }

    private RecoveryResult record(ErrorRecord error, RecoveryResult result, String action) {
        RecoveryAttempt attempt = RecoveryAttempt.of(error, result, action);
        appendBounded(recoveryHistory, attempt, recoveryHistoryCapacity);
        LOG.info("Recovery {} for error {}: {}", result, error.id(), action);
        publisher.publishEvent(new RecoveryAttemptEvent(attempt));
        return result;
    }

    private static <T> void appendBounded(Deque<T> history, T item, int capacity) {
        synchronized (history) {
            history.addLast(item);
            while (history.size() > capacity) {
                history.removeFirst();
            }
        }
    }
}
