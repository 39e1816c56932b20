package com.phillippitts.newwork.service.recovery;

import com.phillippitts.newwork.config.properties.RecoveryProperties;
import com.phillippitts.newwork.domain.BackendState;
import com.phillippitts.newwork.domain.ErrorCategory;
import com.phillippitts.newwork.domain.ErrorRecord;
import com.phillippitts.newwork.domain.RecoveryAttempt;
import com.phillippitts.newwork.domain.RecoveryResult;
import com.phillippitts.newwork.exception.ExecutableNotFoundException;
import com.phillippitts.newwork.exception.StartupTimeoutException;
import com.phillippitts.newwork.service.recovery.event.ErrorReportedEvent;
import com.phillippitts.newwork.service.recovery.event.RecoveryAttemptEvent;
import com.phillippitts.newwork.service.restart.RestartPhase;
import com.phillippitts.newwork.service.restart.SystemRestartCoordinator;
import com.phillippitts.newwork.testutil.EventCapturingPublisher;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorRecoveryOrchestratorTest {

    private RecoveryProperties props;
    private EventCapturingPublisher publisher;
    private RestartLimiter limiter;
    private RestartDelayPolicy delayPolicy;

    @BeforeEach
    void setUp() {
        props = new RecoveryProperties();
        publisher = new EventCapturingPublisher();
        limiter = new RestartLimiter(3, Duration.ofMinutes(5));
        delayPolicy = RestartDelayPolicy.fixed(Duration.ZERO);
    }

    private ErrorRecoveryOrchestrator orchestrator(FakeBackendSupervisor supervisor) {
        return orchestrator(supervisor, null);
    }

    private ErrorRecoveryOrchestrator orchestrator(FakeBackendSupervisor supervisor,
                                                   SystemRestartCoordinator coordinator) {
        return new ErrorRecoveryOrchestrator(supervisor, limiter, delayPolicy, props, publisher, () -> coordinator);
    }

    @Test
    void nonRecoverableErrorIsRecordedButNotRecovered() {
        FakeBackendSupervisor supervisor = new FakeBackendSupervisor(true);
        ErrorRecoveryOrchestrator orchestrator = orchestrator(supervisor);

        RecoveryResult result = orchestrator.reportError(ErrorRecord.api("Not found", 404, null));

        assertThat(result).isEqualTo(RecoveryResult.FAILED_PERMANENT);
        assertThat(orchestrator.errorHistory()).hasSize(1);
        assertThat(orchestrator.recoveryHistory()).isEmpty();
        assertThat(limiter.attemptsInWindow()).isZero();
        assertThat(publisher.eventsOfType(ErrorReportedEvent.class)).hasSize(1);
        assertThat(supervisor.restartCount()).isZero();
        assertThat(supervisor.healthCheckCount()).isZero();
        assertThat(supervisor.failures).isEmpty();
    }

    @Test
    void nonRecoverableCriticalErrorIsPermanentAndLeavesSupervisorAlone() {
        FakeBackendSupervisor supervisor = new FakeBackendSupervisor(true);
        ErrorRecoveryOrchestrator orchestrator = orchestrator(supervisor);

        RecoveryResult result = orchestrator.reportError(ErrorRecord.runtime("Out of memory", true, null));

        assertThat(result).isEqualTo(RecoveryResult.FAILED_PERMANENT);
        assertThat(orchestrator.recoveryHistory()).singleElement()
                .extracting(RecoveryAttempt::actionTaken)
                .asString()
                .contains("system restart");
        assertThat(limiter.attemptsInWindow()).isZero();
        assertThat(supervisor.restartCount()).isZero();
        assertThat(supervisor.healthCheckCount()).isZero();
        assertThat(supervisor.failures).isEmpty();
        assertThat(supervisor.currentStatus().state()).isEqualTo(BackendState.RUNNING);
    }

    @Test
    void apiErrorWithHealthyBackendFallsBackToCachedData() {
        FakeBackendSupervisor supervisor = new FakeBackendSupervisor(true);
        ErrorRecoveryOrchestrator orchestrator = orchestrator(supervisor);

        RecoveryResult result = orchestrator.reportError(ErrorRecord.api("Bad gateway", 502, null));

        assertThat(result).isEqualTo(RecoveryResult.FAILED_RETRYABLE);
        assertThat(supervisor.restartCount()).isZero();
        assertThat(orchestrator.recoveryHistory()).last()
                .extracting(RecoveryAttempt::actionTaken)
                .asString()
                .contains("cached data");
    }

    @Test
    void apiErrorWithUnresponsiveBackendEscalatesToRestart() {
        FakeBackendSupervisor supervisor = new FakeBackendSupervisor(false);
        ErrorRecoveryOrchestrator orchestrator = orchestrator(supervisor);

        RecoveryResult result = orchestrator.reportError(ErrorRecord.api("Connection refused", null, null));

        assertThat(result).isEqualTo(RecoveryResult.SUCCESS);
        assertThat(supervisor.restartCount()).isEqualTo(1);
    }

    @Test
    void backendErrorRestartsBackend() {
        FakeBackendSupervisor supervisor = new FakeBackendSupervisor(false);
        ErrorRecoveryOrchestrator orchestrator = orchestrator(supervisor);

        RecoveryResult result = orchestrator.reportError(ErrorRecord.backend("Crashed", 1, null));

        assertThat(result).isEqualTo(RecoveryResult.SUCCESS);
        assertThat(supervisor.restartCount()).isEqualTo(1);
        assertThat(orchestrator.recoveryHistory())
                .extracting(RecoveryAttempt::result)
                .containsExactly(RecoveryResult.IN_PROGRESS, RecoveryResult.SUCCESS);
        assertThat(publisher.eventsOfType(RecoveryAttemptEvent.class)).hasSize(2);
    }

    @Test
    void restartThatLeavesBackendUnhealthyIsRetryable() {
        FakeBackendSupervisor supervisor = new FakeBackendSupervisor(false);
        supervisor.setHealthyAfterRestart(false);
        ErrorRecoveryOrchestrator orchestrator = orchestrator(supervisor);

        RecoveryResult result = orchestrator.reportError(ErrorRecord.backend("Crashed", 1, null));

        assertThat(result).isEqualTo(RecoveryResult.FAILED_RETRYABLE);
        assertThat(supervisor.restartCount()).isEqualTo(1);
    }

    @Test
    void failedRestartIsRetriedWithBackoffWhileBudgetAllows() {
        delayPolicy = new RestartDelayPolicy(RecoveryProperties.BackoffMode.EXPONENTIAL,
                Duration.ofMillis(100), 2.0, Duration.ofSeconds(1));
        FakeBackendSupervisor supervisor = new FakeBackendSupervisor(false)
                .failNextRestartWith(new StartupTimeoutException(30, Duration.ofSeconds(15)));
        ErrorRecoveryOrchestrator orchestrator = orchestrator(supervisor);

        RecoveryResult result = orchestrator.reportError(ErrorRecord.backend("Crashed", 1, null));

        assertThat(result).isEqualTo(RecoveryResult.SUCCESS);
        assertThat(supervisor.restartDelays).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
        assertThat(limiter.attemptsInWindow()).isEqualTo(2);
    }

    @Test
    void exhaustedBudgetMarksBackendFailed() {
        limiter = new RestartLimiter(2, Duration.ofMinutes(5));
        FakeBackendSupervisor supervisor = new FakeBackendSupervisor(false)
                .failNextRestartWith(new StartupTimeoutException(30, Duration.ofSeconds(15)))
                .failNextRestartWith(new StartupTimeoutException(30, Duration.ofSeconds(15)));
        ErrorRecoveryOrchestrator orchestrator = orchestrator(supervisor);

        RecoveryResult result = orchestrator.reportError(ErrorRecord.backend("Crashed", 1, null));

        assertThat(result).isEqualTo(RecoveryResult.USER_ACTION_REQUIRED);
        assertThat(supervisor.restartCount()).isEqualTo(2);
        assertThat(supervisor.failures).singleElement().asString().contains("manual restart required");
    }

    @Test
    void deniedLimiterRequiresUserActionWithoutRestarting() {
        limiter = new RestartLimiter(1, Duration.ofMinutes(5));
        limiter.recordAttempt();
        FakeBackendSupervisor supervisor = new FakeBackendSupervisor(false);
        ErrorRecoveryOrchestrator orchestrator = orchestrator(supervisor);

        RecoveryResult result = orchestrator.reportError(ErrorRecord.backend("Crashed", 1, null));

        assertThat(result).isEqualTo(RecoveryResult.USER_ACTION_REQUIRED);
        assertThat(supervisor.restartCount()).isZero();
        assertThat(supervisor.failures).hasSize(1);
        assertThat(orchestrator.recoveryHistory()).singleElement()
                .extracting(RecoveryAttempt::actionTaken)
                .asString()
                .contains("automatic recovery resumes in");
    }

    @Test
    void deniedApiErrorOnHealthyBackendLeavesSupervisorRunning() {
        FakeBackendSupervisor supervisor = new FakeBackendSupervisor(true);
        ErrorRecoveryOrchestrator orchestrator = orchestrator(supervisor);
        for (int i = 0; i < 3; i++) {
            orchestrator.reportError(ErrorRecord.render("Widget failed", null));
        }

        RecoveryResult result = orchestrator.reportError(ErrorRecord.api("Bad gateway", 502, null));

        assertThat(result).isEqualTo(RecoveryResult.USER_ACTION_REQUIRED);
        assertThat(supervisor.failures).isEmpty();
        assertThat(supervisor.restartCount()).isZero();
        assertThat(supervisor.currentStatus().state()).isEqualTo(BackendState.RUNNING);
    }

    @Test
    void deniedApiErrorOnUnresponsiveBackendMarksItFailed() {
        limiter = new RestartLimiter(1, Duration.ofMinutes(5));
        limiter.recordAttempt();
        FakeBackendSupervisor supervisor = new FakeBackendSupervisor(false);
        ErrorRecoveryOrchestrator orchestrator = orchestrator(supervisor);

        RecoveryResult result = orchestrator.reportError(ErrorRecord.api("Connection refused", null, null));

        assertThat(result).isEqualTo(RecoveryResult.USER_ACTION_REQUIRED);
        assertThat(supervisor.restartCount()).isZero();
        assertThat(supervisor.failures).hasSize(1);
    }

    @Test
    void missingExecutableIsPermanent() {
        FakeBackendSupervisor supervisor = new FakeBackendSupervisor(false)
                .failNextRestartWith(new ExecutableNotFoundException(Path.of("/opt/newwork/backend/newwork-backend")));
        ErrorRecoveryOrchestrator orchestrator = orchestrator(supervisor);

        RecoveryResult result = orchestrator.reportError(ErrorRecord.backend("Crashed", 1, null));

        assertThat(result).isEqualTo(RecoveryResult.FAILED_PERMANENT);
        assertThat(supervisor.restartCount()).isEqualTo(1);
        assertThat(supervisor.failures).hasSize(1);
    }

    @Test
    void renderErrorRequiresUserAction() {
        ErrorRecoveryOrchestrator orchestrator = orchestrator(new FakeBackendSupervisor(true));

        assertThat(orchestrator.reportError(ErrorRecord.render("Widget failed", null)))
                .isEqualTo(RecoveryResult.USER_ACTION_REQUIRED);
    }

    @Test
    void runtimeErrorsDependOnCriticality() {
        FakeBackendSupervisor supervisor = new FakeBackendSupervisor(true);
        ErrorRecoveryOrchestrator orchestrator = orchestrator(supervisor);

        assertThat(orchestrator.reportError(ErrorRecord.runtime("Cache miss", false, null)))
                .isEqualTo(RecoveryResult.SUCCESS);
        assertThat(orchestrator.reportError(ErrorRecord.runtime("Out of memory", true, null)))
                .isEqualTo(RecoveryResult.FAILED_PERMANENT);
        assertThat(orchestrator.recoveryHistory()).last()
                .extracting(RecoveryAttempt::actionTaken)
                .asString()
                .contains("system restart");
        assertThat(supervisor.restartCount()).isZero();
    }

    @Test
    void concurrentRecoveryReturnsInProgressAndStartsNothing() throws Exception {
        FakeBackendSupervisor supervisor = new FakeBackendSupervisor(false);
        CountDownLatch gate = new CountDownLatch(1);
        supervisor.holdRestartsOn(gate);
        ErrorRecoveryOrchestrator orchestrator = orchestrator(supervisor);

        CompletableFuture<RecoveryResult> first = CompletableFuture.supplyAsync(
                () -> orchestrator.reportError(ErrorRecord.backend("Crashed", 1, null)));
        assertThat(supervisor.restartEntered.await(5, TimeUnit.SECONDS)).isTrue();

        RecoveryResult second = orchestrator.reportError(ErrorRecord.backend("Crashed again", 1, null));

        assertThat(second).isEqualTo(RecoveryResult.IN_PROGRESS);
        assertThat(orchestrator.isRecovering()).isTrue();
        assertThat(orchestrator.recoveryHistory())
                .extracting(RecoveryAttempt::result)
                .containsExactly(RecoveryResult.IN_PROGRESS);

        gate.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo(RecoveryResult.SUCCESS);
        assertThat(supervisor.restartCount()).isEqualTo(1);
        assertThat(orchestrator.recoveryHistory()).hasSize(2);
        assertThat(orchestrator.errorHistory()).hasSize(2);
        assertThat(orchestrator.isRecovering()).isFalse();
    }

    @Test
    void historiesAreBoundedOldestFirstOut() {
        props.setErrorHistoryCapacity(3);
        props.setRecoveryHistoryCapacity(2);
        limiter = new RestartLimiter(10, Duration.ofMinutes(5));
        ErrorRecoveryOrchestrator orchestrator = orchestrator(new FakeBackendSupervisor(true));

        for (int i = 1; i <= 5; i++) {
            orchestrator.reportError(ErrorRecord.render("render " + i, null));
        }

        List<ErrorRecord> errors = orchestrator.errorHistory();
        assertThat(errors).extracting(ErrorRecord::message).containsExactly("render 3", "render 4", "render 5");
        assertThat(orchestrator.recoveryHistory()).hasSize(2);
        assertThat(orchestrator.recentErrorCount(ErrorCategory.RENDER, Duration.ofMinutes(1))).isEqualTo(3);
        assertThat(orchestrator.recentErrorCount(ErrorCategory.API, Duration.ofMinutes(1))).isZero();

        orchestrator.clearHistory();
        assertThat(orchestrator.errorHistory()).isEmpty();
        assertThat(orchestrator.recoveryHistory()).isEmpty();
    }

    @Test
    void manualRestartResetsBudget() {
        limiter.recordAttempt();
        limiter.recordAttempt();
        limiter.recordAttempt();
        FakeBackendSupervisor supervisor = new FakeBackendSupervisor(false);
        ErrorRecoveryOrchestrator orchestrator = orchestrator(supervisor);

        orchestrator.restartBackendManually();

        assertThat(limiter.remainingAttempts()).isEqualTo(3);
        assertThat(supervisor.restartCount()).isEqualTo(1);
    }

    @Test
    void resetRecoveryLimiterRestoresBudgetWithoutRestarting() {
        limiter.recordAttempt();
        FakeBackendSupervisor supervisor = new FakeBackendSupervisor(true);
        ErrorRecoveryOrchestrator orchestrator = orchestrator(supervisor);

        orchestrator.resetRecoveryLimiter();

        assertThat(orchestrator.remainingRecoveryAttempts()).isEqualTo(3);
        assertThat(supervisor.restartCount()).isZero();
    }

    @Test
    void systemRestartDelegatesToCoordinatorWhenAvailable() {
        limiter.recordAttempt();
        StubCoordinator coordinator = new StubCoordinator(true);

        assertThat(orchestrator(new FakeBackendSupervisor(true), coordinator).triggerSystemRestart()).isTrue();
        assertThat(coordinator.calls).isEqualTo(1);
        assertThat(limiter.attemptsInWindow()).isZero();

        assertThat(orchestrator(new FakeBackendSupervisor(true)).triggerSystemRestart()).isFalse();
    }

    @Test
    void mdcIsClearedAfterRecovery() {
        ErrorRecoveryOrchestrator orchestrator = orchestrator(new FakeBackendSupervisor(true));

        orchestrator.reportError(ErrorRecord.render("boom", null));

        assertThat(ThreadContext.get(ErrorRecoveryOrchestrator.MDC_ERROR_ID)).isNull();
        assertThat(ThreadContext.get(ErrorRecoveryOrchestrator.MDC_CATEGORY)).isNull();
    }

    private static final class StubCoordinator implements SystemRestartCoordinator {
        private final boolean outcome;
        int calls;

        StubCoordinator(boolean outcome) {
            this.outcome = outcome;
        }

        @Override
        public boolean performGracefulRestart() {
            calls++;
            return outcome;
        }

        @Override
        public boolean quickRestartBackend() {
            return outcome;
        }

        @Override
        public boolean isRestarting() {
            return false;
        }

        @Override
        public RestartPhase getCurrentPhase() {
            return RestartPhase.IDLE;
        }
    }
}
