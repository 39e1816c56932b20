package com.phillippitts.newwork.service.restart;

import com.phillippitts.newwork.config.properties.RecoveryProperties;
import com.phillippitts.newwork.exception.BackendStartException;
import com.phillippitts.newwork.exception.SystemRestartException;
import com.phillippitts.newwork.service.backend.BackendSupervisor;
import com.phillippitts.newwork.service.restart.event.RestartProgressEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Phased restart of the backend with progress reporting.
 *
 * <p>Phases run in order on {@code systemRestartExecutor}, each bounded by
 * {@code recovery.system-restart.phase-timeout}:
 * <ol>
 *   <li>PREPARING: announce the restart so listeners can persist state</li>
 *   <li>SHUTTING_DOWN: stop the backend, then pause briefly for the port to be released</li>
 *   <li>RESTARTING: start the backend and wait for it to answer healthy</li>
 *   <li>RECOVERING: confirm the supervisor reports a healthy status</li>
 * </ol>
 * A {@link RestartProgressEvent} is published on entry to every phase, then COMPLETED or FAILED.
 * Only one restart runs at a time.
 */
@Service
public class GracefulSystemRestartCoordinator implements SystemRestartCoordinator {

    private static final Logger LOG = LogManager.getLogger(GracefulSystemRestartCoordinator.class);

    private final BackendSupervisor supervisor;
    private final RecoveryProperties.SystemRestart props;
    private final Executor executor;
    private final ApplicationEventPublisher publisher;
    private final AtomicBoolean restarting = new AtomicBoolean(false);

    private volatile RestartPhase currentPhase = RestartPhase.IDLE;

    public GracefulSystemRestartCoordinator(BackendSupervisor supervisor,
                                            RecoveryProperties recoveryProperties,
                                            @Qualifier("systemRestartExecutor") Executor executor,
                                            ApplicationEventPublisher publisher) {
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");
        this.props = Objects.requireNonNull(recoveryProperties, "recoveryProperties").getSystemRestart();
        this.executor = Objects.requireNonNull(executor, "executor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    @Override
    public boolean performGracefulRestart() {
        if (!restarting.compareAndSet(false, true)) {
            LOG.warn("System restart already in progress; ignoring request");
            return false;
        }
        double progress = 0.0;
        try {
            LOG.warn("Starting graceful system restart");
            progress = 0.1;
            runPhase(RestartPhase.PREPARING, progress, "Preparing for restart...", this::prepare);
            progress = 0.3;
            runPhase(RestartPhase.SHUTTING_DOWN, progress, "Stopping backend...", this::shutdown);
            progress = 0.6;
            runPhase(RestartPhase.RESTARTING, progress, "Starting backend...", this::restart);
            progress = 0.9;
            runPhase(RestartPhase.RECOVERING, progress, "Verifying system health...", this::verify);
            report(new RestartProgressEvent(RestartPhase.COMPLETED, 1.0, "Restart completed"));
            LOG.info("Graceful system restart completed");
            return true;
        } catch (SystemRestartException e) {
            LOG.error("Graceful system restart failed: {}", e.getMessage());
            report(new RestartProgressEvent(RestartPhase.FAILED, progress, "Restart failed", e.getMessage(), null));
            return false;
        } finally {
            restarting.set(false);
        }
    }

    @Override
    public boolean quickRestartBackend() {
        if (!restarting.compareAndSet(false, true)) {
            LOG.warn("System restart already in progress; ignoring quick restart");
            return false;
        }
        try {
            LOG.info("Quick backend restart requested");
            supervisor.restartProcess();
            return waitForHealthy();
        } catch (BackendStartException e) {
            LOG.error("Quick backend restart failed: {}", e.getMessage());
            return false;
        } finally {
            restarting.set(false);
        }
    }

    @Override
    public boolean isRestarting() {
        return restarting.get();
    }

    @Override
    public RestartPhase getCurrentPhase() {
        return currentPhase;
    }

    private void prepare() {
        // listeners of the PREPARING event persist their own state synchronously
        LOG.info("Restart prepared; backend status before restart: {}", supervisor.currentStatus().state());
    }

    private void shutdown() {
        supervisor.stopProcess();
        sleep(props.getShutdownPause());
    }

    private void restart() {
        supervisor.startProcess();
        if (!waitForHealthy()) {
            throw new SystemRestartException(RestartPhase.RESTARTING.name(),
                    "backend did not become healthy after " + props.getHealthWaitAttempts() + " checks");
        }
    }

    private void verify() {
        if (!supervisor.currentStatus().isHealthy()) {
            throw new SystemRestartException(RestartPhase.RECOVERING.name(),
                    "backend status is " + supervisor.currentStatus().state());
        }
    }

    private boolean waitForHealthy() {
        for (int i = 0; i < props.getHealthWaitAttempts(); i++) {
            if (supervisor.checkHealth()) {
                return true;
            }
            sleep(props.getHealthWaitInterval());
        }
        return false;
    }

    private void runPhase(RestartPhase phase, double progress, String message, Runnable action) {
        report(new RestartProgressEvent(phase, progress, message));
        Duration timeout = props.getPhaseTimeout();
        CompletableFuture<Void> future = CompletableFuture.runAsync(action, executor);
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SystemRestartException(phase.name(), "timed out after " + timeout.toSeconds() + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof SystemRestartException sre) {
                throw sre;
            }
            throw new SystemRestartException(phase.name(), String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SystemRestartException(phase.name(), "interrupted", e);
        }
    }

    private void report(RestartProgressEvent event) {
        currentPhase = event.phase();
        LOG.debug("System restart phase {} ({}%)", event.phase(), Math.round(event.progress() * 100));
        publisher.publishEvent(event);
    }

    private static void sleep(Duration d) {
        if (d.isZero() || d.isNegative()) {
            return;
        }
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SystemRestartException("wait", "interrupted", e);
        }
    }
}
