package com.phillippitts.newwork.exception;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void startFailuresShareOneBaseType() {
        assertThat(new ExecutableNotFoundException(Path.of("backend"))).isInstanceOf(BackendStartException.class);
        assertThat(new StartupTimeoutException(3, Duration.ofSeconds(1))).isInstanceOf(BackendStartException.class);
        assertThat(new BackendStartException("spawn failed")).isInstanceOf(NewWorkException.class);
    }

    @Test
    void allDomainExceptionsAreUnchecked() {
        assertThat(new NewWorkException("x")).isInstanceOf(RuntimeException.class);
        assertThat(new BackendCrashException(1)).isInstanceOf(NewWorkException.class);
        assertThat(new RestartLimitExceededException(3, Duration.ofMinutes(1))).isInstanceOf(NewWorkException.class);
        assertThat(new SystemRestartException("PREPARING", "x")).isInstanceOf(NewWorkException.class);
    }

    @Test
    void exitCodeIsCarriedOnlyWhenChildTerminated() {
        assertThat(new BackendStartException("Backend exited during startup", 2).getExitCode()).isEqualTo(2);
        assertThat(new BackendStartException("Failed to spawn backend").getExitCode()).isNull();
        assertThat(new BackendCrashException(139).getMessage()).contains("exitCode=139");
    }

    @Test
    void messagesNameTheFailure() {
        Path path = Path.of("/opt/newwork/backend/newwork-backend");
        ExecutableNotFoundException notFound = new ExecutableNotFoundException(path);
        StartupTimeoutException timeout = new StartupTimeoutException(30, Duration.ofMillis(15000));
        RestartLimitExceededException limit = new RestartLimitExceededException(3, Duration.ofSeconds(90));
        SystemRestartException restart = new SystemRestartException("RESTARTING", "timed out after 30s");

        assertThat(notFound.getExecutablePath()).isEqualTo(path);
        assertThat(notFound.getMessage()).contains(path.toString());
        assertThat(timeout.getMessage()).contains("30 checks").contains("15000ms");
        assertThat(timeout.getAttempts()).isEqualTo(30);
        assertThat(timeout.getWaited()).isEqualTo(Duration.ofMillis(15000));
        assertThat(limit.getMaxAttempts()).isEqualTo(3);
        assertThat(limit.getWaitTime()).isEqualTo(Duration.ofSeconds(90));
        assertThat(restart.getPhase()).isEqualTo("RESTARTING");
        assertThat(restart.getMessage()).isEqualTo("System restart failed during RESTARTING: timed out after 30s");
    }
}
