package com.phillippitts.newwork.service.backend;

import com.phillippitts.newwork.config.properties.BackendProperties;
import com.phillippitts.newwork.config.properties.RecoveryProperties;
import com.phillippitts.newwork.domain.BackendState;
import com.phillippitts.newwork.domain.ErrorRecord;
import com.phillippitts.newwork.domain.RecoveryAttempt;
import com.phillippitts.newwork.domain.RecoveryResult;
import com.phillippitts.newwork.service.backend.BackendTestDoubles.ScriptedHealthProbe;
import com.phillippitts.newwork.service.backend.BackendTestDoubles.StubProcessFactory;
import com.phillippitts.newwork.service.backend.event.BackendFaultEvent;
import com.phillippitts.newwork.service.recovery.ErrorRecoveryOrchestrator;
import com.phillippitts.newwork.service.recovery.RestartDelayPolicy;
import com.phillippitts.newwork.service.recovery.RestartLimiter;
import com.phillippitts.newwork.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Supervisor and orchestrator wired together, with faults delivered synchronously the way
 * the {@code @EventListener} would deliver them.
 */
class BackendRecoveryScenarioTest {

    @TempDir
    Path installDir;

    private ThreadPoolTaskScheduler scheduler;
    private StubProcessFactory factory;
    private ScriptedHealthProbe probe;
    private EventCapturingPublisher publisher;
    private RestartLimiter limiter;
    private BackendProcessSupervisor supervisor;
    private ErrorRecoveryOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws IOException {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.initialize();
        BackendProperties props = BackendTestDoubles.fastProperties();
        factory = new StubProcessFactory();
        probe = new ScriptedHealthProbe(true);
        publisher = new EventCapturingPublisher();
        limiter = new RestartLimiter(3, Duration.ofMinutes(5));

        supervisor = new BackendProcessSupervisor(props, BackendTestDoubles.installedLocator(installDir),
                factory, probe, scheduler, publisher);
        orchestrator = new ErrorRecoveryOrchestrator(supervisor, limiter, RestartDelayPolicy.fixed(Duration.ZERO),
                new RecoveryProperties(), publisher, () -> null);
        publisher.forwardTo(event -> {
            if (event instanceof BackendFaultEvent fault) {
                orchestrator.onBackendFault(fault);
            }
        });
    }

    @AfterEach
    void tearDown() {
        supervisor.close();
        scheduler.shutdown();
    }

    @Test
    void unresponsiveBackendIsRestartedAndReturnsToRunning() {
        supervisor.startProcess();
        // the replacement process answers as soon as it is spawned
        factory.onStart(() -> probe.setHealthy(true));
        probe.setHealthy(false);

        for (int i = 0; i < 3; i++) {
            supervisor.performHealthCheck();
        }

        assertThat(publisher.states()).containsExactly(
                BackendState.STARTING, BackendState.RUNNING,
                BackendState.UNRESPONSIVE, BackendState.UNRESPONSIVE, BackendState.UNRESPONSIVE,
                BackendState.RESTARTING, BackendState.STOPPED, BackendState.STARTING, BackendState.RUNNING);
        assertThat(factory.started).hasSize(2);
        assertThat(orchestrator.recoveryHistory())
                .extracting(RecoveryAttempt::result)
                .containsExactly(RecoveryResult.IN_PROGRESS, RecoveryResult.SUCCESS);
        assertThat(limiter.attemptsInWindow()).isEqualTo(1);
    }

    @Test
    void failedRestartIsRetriedWithinBudget() {
        supervisor.startProcess();
        AtomicInteger spawns = new AtomicInteger(1);
        // first replacement never becomes healthy, the second one does
        factory.onStart(() -> probe.setHealthy(spawns.incrementAndGet() >= 3));
        probe.setHealthy(false);

        for (int i = 0; i < 3; i++) {
            supervisor.performHealthCheck();
        }

        assertThat(supervisor.currentStatus().state()).isEqualTo(BackendState.RUNNING);
        assertThat(factory.started).hasSize(3);
        assertThat(publisher.states()).containsSubsequence(
                BackendState.RESTARTING, BackendState.STARTING, BackendState.ERROR,
                BackendState.RESTARTING, BackendState.STARTING, BackendState.RUNNING);
        assertThat(limiter.attemptsInWindow()).isEqualTo(2);
        assertThat(orchestrator.recoveryHistory()).last()
                .extracting(RecoveryAttempt::result)
                .isEqualTo(RecoveryResult.SUCCESS);
    }

    @Test
    void exhaustedBudgetLeavesBackendInErrorUntilManualRestart() {
        supervisor.startProcess();
        factory.onStart(() -> probe.setHealthy(false));
        probe.setHealthy(false);

        for (int i = 0; i < 3; i++) {
            supervisor.performHealthCheck();
        }

        assertThat(factory.started).hasSize(4);
        assertThat(supervisor.currentStatus().state()).isEqualTo(BackendState.ERROR);
        assertThat(supervisor.currentStatus().errorMessage()).contains("manual restart required");
        assertThat(orchestrator.recoveryHistory()).last()
                .extracting(RecoveryAttempt::result)
                .isEqualTo(RecoveryResult.USER_ACTION_REQUIRED);

        factory.onStart(() -> probe.setHealthy(true));
        orchestrator.restartBackendManually();

        assertThat(supervisor.currentStatus().state()).isEqualTo(BackendState.RUNNING);
        assertThat(limiter.remainingAttempts()).isEqualTo(3);
    }

    @Test
    void exhaustedBudgetDoesNotFailHealthyBackendOnApiError() {
        supervisor.startProcess();
        for (int i = 0; i < 3; i++) {
            orchestrator.reportError(ErrorRecord.render("Widget failed", null));
        }

        RecoveryResult result = orchestrator.reportError(ErrorRecord.api("Bad gateway", 502, null));

        assertThat(result).isEqualTo(RecoveryResult.USER_ACTION_REQUIRED);
        assertThat(supervisor.currentStatus().state()).isEqualTo(BackendState.RUNNING);
        assertThat(factory.started).hasSize(1);

        // health monitoring still runs, so a later outage is noticed
        probe.setHealthy(false);
        for (int i = 0; i < 3; i++) {
            supervisor.performHealthCheck();
        }

        assertThat(publisher.states()).contains(BackendState.UNRESPONSIVE);
        assertThat(publisher.eventsOfType(BackendFaultEvent.class)).hasSize(1);
    }

    @Test
    void crashIsRecoveredByRestart() {
        supervisor.startProcess();

        factory.last().exit(139);

        assertThat(factory.started).hasSize(2);
        assertThat(supervisor.currentStatus().state()).isEqualTo(BackendState.RUNNING);
        assertThat(orchestrator.errorHistory()).singleElement()
                .satisfies(e -> assertThat(e.technicalDetails()).isEqualTo("Exit code: 139"));
    }
}
