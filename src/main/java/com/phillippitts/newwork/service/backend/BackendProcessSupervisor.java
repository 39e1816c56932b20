package com.phillippitts.newwork.service.backend;

import com.phillippitts.newwork.config.properties.BackendProperties;
import com.phillippitts.newwork.domain.BackendState;
import com.phillippitts.newwork.domain.ErrorRecord;
import com.phillippitts.newwork.domain.HealthStatus;
import com.phillippitts.newwork.exception.BackendCrashException;
import com.phillippitts.newwork.exception.BackendStartException;
import com.phillippitts.newwork.exception.ExecutableNotFoundException;
import com.phillippitts.newwork.exception.StartupTimeoutException;
import com.phillippitts.newwork.service.backend.event.BackendFaultEvent;
import com.phillippitts.newwork.service.backend.event.BackendHealthEvent;
import com.phillippitts.newwork.util.ProcessTimeouts;
import com.phillippitts.newwork.util.TimeUtils;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Supervises the bundled backend executable as a child process.
 *
 * <p><b>Lifecycle:</b> {@link #startProcess()} resolves the executable, spawns it with
 * {@code --host}/{@code --port}, polls the health endpoint until it answers, then schedules a
 * fixed-rate health monitor. {@link #stopProcess()} cancels the monitor and terminates the
 * process (graceful, then forced). Start, stop, restart and crash handling are serialized by a
 * single lifecycle lock.
 *
 * <p><b>Crash detection:</b> every spawned process gets an exit observer
 * ({@link Process#onExit()}). An exit the supervisor did not request moves the status to
 * {@link BackendState#ERROR} and publishes a {@link BackendFaultEvent}.
 *
 * <p><b>Health monitoring:</b> each tick probes outside the lock. A success resets the failure
 * counter and emits RUNNING with the measured latency; a failure emits UNRESPONSIVE, and
 * crossing {@code backend.max-consecutive-failures} publishes exactly one fault until the
 * counter resets. The monitor is active if and only if a process handle exists.
 *
 * <p><b>Thread safety:</b> public methods may be called from any thread.
 *
 * @see HealthProbe
 * @see com.phillippitts.newwork.service.recovery.ErrorRecoveryOrchestrator
 */
@Component
public class BackendProcessSupervisor implements BackendSupervisor, AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(BackendProcessSupervisor.class);

    private static final int STARTUP_LOG_EVERY = 5;

    private final BackendProperties props;
    private final BackendExecutableLocator locator;
    private final ProcessFactory processFactory;
    private final HealthProbe healthProbe;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher publisher;

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    private volatile BackendHandle handle;
    private volatile HealthStatus status = HealthStatus.of(BackendState.STOPPED, 0);
    private volatile ScheduledFuture<?> monitorTask;

    @Autowired
    public BackendProcessSupervisor(BackendProperties props,
                                    BackendExecutableLocator locator,
                                    HealthProbe healthProbe,
                                    @Qualifier("healthMonitorScheduler") TaskScheduler scheduler,
                                    ApplicationEventPublisher publisher) {
        this(props, locator, new DefaultProcessFactory(), healthProbe, scheduler, publisher);
    }

    // Visible for tests: allows injecting a fake ProcessFactory
    BackendProcessSupervisor(BackendProperties props,
                             BackendExecutableLocator locator,
                             ProcessFactory processFactory,
                             HealthProbe healthProbe,
                             TaskScheduler scheduler,
                             ApplicationEventPublisher publisher) {
        this.props = Objects.requireNonNull(props, "props");
        this.locator = Objects.requireNonNull(locator, "locator");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.healthProbe = Objects.requireNonNull(healthProbe, "healthProbe");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    @Override
    public void startProcess() {
        lifecycleLock.lock();
        try {
            if (handle != null) {
                LOG.info("Backend already running ({})", handle);
                return;
            }
            Path executable = locator.resolve();
            if (!Files.exists(executable)) {
                LOG.error("Backend executable not found at {}", executable);
                throw new ExecutableNotFoundException(executable);
            }

            consecutiveFailures.set(0);
            emit(HealthStatus.of(BackendState.STARTING, 0));
            BackendHandle started = spawn(executable);
            handle = started;
            try {
                awaitReady(started);
            } catch (BackendStartException e) {
                abandon(started, e);
                throw e;
            }

            consecutiveFailures.set(0);
            emit(HealthStatus.running(null));
            startHealthMonitor();
            LOG.info("Backend started on http://{}:{} ({})", started.host(), started.port(), started);
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public void stopProcess() {
        lifecycleLock.lock();
        try {
            stopHealthMonitor();
            BackendHandle current = handle;
            if (current == null) {
                if (status.state() != BackendState.STOPPED) {
                    LOG.info("Clearing backend {} state on stop; no process is running", status.state());
                    consecutiveFailures.set(0);
                    emit(HealthStatus.of(BackendState.STOPPED, 0));
                } else {
                    LOG.debug("Backend not running; nothing to stop");
                }
                return;
            }
            LOG.info("Stopping backend ({})", current);
            current.markIntentionalStop();
            try {
                terminate(current.process(), props.getGracefulStopTimeout());
            } catch (RuntimeException e) {
                LOG.warn("Error while stopping backend: {}", e.toString());
            } finally {
                handle = null;
                current.joinOutput(ProcessTimeouts.OUTPUT_DRAIN_TIMEOUT);
                consecutiveFailures.set(0);
                emit(HealthStatus.of(BackendState.STOPPED, 0));
            }
            LOG.info("Backend stopped");
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public void restartProcess() {
        restartProcess(props.getRestartDelay());
    }

    @Override
    public void restartProcess(Duration delay) {
        Objects.requireNonNull(delay, "delay");
        lifecycleLock.lock();
        try {
            LOG.warn("Restarting backend (delay={}ms)", delay.toMillis());
            emit(HealthStatus.of(BackendState.RESTARTING, consecutiveFailures.get()));
            stopProcess();
            pause(delay, "restart delay");
            startProcess();
        } finally {
            lifecycleLock.unlock();
        }
    }

    @Override
    public boolean checkHealth() {
        try {
            return healthProbe.isHealthy(props.getHealthCheckTimeout());
        } catch (RuntimeException e) {
            LOG.debug("Health probe threw: {}", e.toString());
            return false;
        }
    }

    @Override
    public HealthStatus currentStatus() {
        return status;
    }

    @Override
    public boolean isRunning() {
        return handle != null;
    }

    @Override
    public void markFailed(String message) {
        lifecycleLock.lock();
        try {
            LOG.error("Backend marked failed: {}", message);
            emit(HealthStatus.error(message, consecutiveFailures.get()));
        } finally {
            lifecycleLock.unlock();
        }
    }

    /** Stops the backend; invoked by Spring on context shutdown. */
    @Override
    public void close() {
        stopProcess();
    }

    /**
     * One monitor tick. Never throws, so the scheduled task is never suppressed.
     */
    void performHealthCheck() {
        try {
            BackendHandle observed = handle;
            if (observed == null || !isMonitoredState(status.state())) {
                return;
            }
            long startNanos = System.nanoTime();
            boolean healthy = checkHealth();
            Duration latency = TimeUtils.elapsed(startNanos);

            ErrorRecord fault = null;
            lifecycleLock.lock();
            try {
                // stopped, restarted or crashed while the probe was in flight
                if (handle != observed || !isMonitoredState(status.state())) {
                    return;
                }
                if (healthy) {
                    int previous = consecutiveFailures.getAndSet(0);
                    if (previous > 0) {
                        LOG.info("Backend healthy again after {} failed health checks", previous);
                    }
                    emit(HealthStatus.running(latency));
                } else {
                    int failures = consecutiveFailures.incrementAndGet();
                    int threshold = props.getMaxConsecutiveFailures();
                    LOG.warn("Backend health check failed ({}/{})", failures, threshold);
                    emit(HealthStatus.unresponsive(failures));
                    if (failures == threshold) {
                        LOG.error("Backend unresponsive after {} consecutive failed health checks", failures);
                        fault = ErrorRecord.backend(
                                "Backend unresponsive after " + failures + " failed health checks", null, null);
                    }
                }
            } finally {
                lifecycleLock.unlock();
            }
            if (fault != null) {
                publisher.publishEvent(new BackendFaultEvent(fault));
            }
        } catch (RuntimeException e) {
            LOG.error("Health check tick failed: {}", e.toString(), e);
        }
    }

    // Visible for tests
    boolean isHealthMonitorActive() {
        ScheduledFuture<?> task = monitorTask;
        return task != null && !task.isCancelled();
    }

    private BackendHandle spawn(Path executable) {
        List<String> command = List.of(
                executable.toString(),
                "--host", props.getHost(),
                "--port", String.valueOf(props.getPort()));
        LOG.info("Starting backend: {}", command);
        Process process;
        try {
            process = processFactory.start(command, executable.getParent());
        } catch (IOException e) {
            BackendStartException failure =
                    new BackendStartException("Failed to spawn backend " + executable + ": " + e.getMessage(), e);
            emit(HealthStatus.error(failure.getMessage(), 0));
            throw failure;
        }
        BackendHandle spawned = new BackendHandle(process, executable, props.getHost(), props.getPort());
        spawned.attachOutputLoggers(
                ProcessOutputLogger.start(process.getInputStream(), "backend-out", Level.INFO),
                ProcessOutputLogger.start(process.getErrorStream(), "backend-err", Level.WARN));
        // Runs on a JDK process-reaper thread
        process.onExit().thenRun(() -> onProcessExit(spawned));
        return spawned;
    }

    private void awaitReady(BackendHandle starting) {
        BackendProperties.Startup startup = props.getStartup();
        int maxAttempts = startup.getMaxAttempts();
        long startNanos = System.nanoTime();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Process process = starting.process();
            if (!process.isAlive()) {
                throw new BackendStartException("Backend exited during startup", exitCodeOf(process));
            }
            if (healthProbe.isHealthy(startup.getProbeTimeout())) {
                LOG.info("Backend healthy after {} attempt(s), {}ms", attempt, TimeUtils.elapsedMillis(startNanos));
                return;
            }
            if (attempt % STARTUP_LOG_EVERY == 1) {
                LOG.info("Waiting for backend... (attempt {}/{})", attempt, maxAttempts);
            }
            if (attempt < maxAttempts) {
                pause(startup.getPollInterval(), "startup polling");
            }
        }
        throw new StartupTimeoutException(maxAttempts, TimeUtils.elapsed(startNanos));
    }

    private void abandon(BackendHandle failed, BackendStartException cause) {
        LOG.error("Backend failed to start: {}", cause.getMessage());
        failed.markIntentionalStop();
        try {
            terminate(failed.process(), ProcessTimeouts.ABANDON_GRACE_TIMEOUT);
        } catch (RuntimeException e) {
            LOG.warn("Error while killing failed backend: {}", e.toString());
        }
        handle = null;
        failed.joinOutput(ProcessTimeouts.OUTPUT_DRAIN_TIMEOUT);
        emit(HealthStatus.error(cause.getMessage(), 0));
    }

    private void onProcessExit(BackendHandle exited) {
        int exitCode = exitCodeOf(exited.process());
        if (exited.isIntentionalStop()) {
            LOG.info("Backend exited with code {} after stop request", exitCode);
            return;
        }
        ErrorRecord fault;
        lifecycleLock.lock();
        try {
            if (handle != exited || exited.isIntentionalStop()) {
                LOG.debug("Ignoring exit of superseded backend ({}), code {}", exited, exitCode);
                return;
            }
            LOG.error("Backend exited unexpectedly with code {} ({})", exitCode, exited);
            stopHealthMonitor();
            handle = null;
            BackendCrashException crash = new BackendCrashException(exitCode);
            emit(HealthStatus.error(crash.getMessage(), consecutiveFailures.get()));
            fault = ErrorRecord.backend(crash.getMessage(), exitCode, crash);
        } finally {
            lifecycleLock.unlock();
        }
        exited.joinOutput(ProcessTimeouts.OUTPUT_DRAIN_TIMEOUT);
        publisher.publishEvent(new BackendFaultEvent(fault));
    }

    private void startHealthMonitor() {
        stopHealthMonitor();
        Duration interval = props.getHealthCheckInterval();
        monitorTask = scheduler.scheduleAtFixedRate(this::performHealthCheck, Instant.now().plus(interval), interval);
        LOG.debug("Health monitor scheduled every {}ms", interval.toMillis());
    }

    private void stopHealthMonitor() {
        ScheduledFuture<?> task = monitorTask;
        monitorTask = null;
        if (task != null) {
            task.cancel(false);
            LOG.debug("Health monitor cancelled");
        }
    }

    private void emit(HealthStatus next) {
        status = next;
        LOG.debug("Backend status -> {} (failures={})", next.state(), next.consecutiveFailures());
        publisher.publishEvent(new BackendHealthEvent(next));
    }

    private static boolean isMonitoredState(BackendState state) {
        return state == BackendState.RUNNING || state == BackendState.UNRESPONSIVE;
    }

    /**
     * Terminates the process: {@link Process#destroy()}, wait up to {@code grace}, then
     * {@link Process#destroyForcibly()}.
     */
    private static void terminate(Process process, Duration grace) {
        if (!process.isAlive()) {
            return;
        }
        try {
            process.destroy();
            if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Backend did not exit within {}ms; forcing termination", grace.toMillis());
                process.destroyForcibly();
                if (!process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                    LOG.warn("Backend still alive after forced termination");
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while stopping backend; forcing termination");
            process.destroyForcibly();
        }
    }

    private static void pause(Duration delay, String what) {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new BackendStartException("Interrupted during " + what, ie);
        }
    }

    private static int exitCodeOf(Process process) {
        try {
            return process.exitValue();
        } catch (IllegalThreadStateException e) {
            return -1;
        }
    }
}
