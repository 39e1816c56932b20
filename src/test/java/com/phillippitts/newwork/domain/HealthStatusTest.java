package com.phillippitts.newwork.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HealthStatusTest {

    @Test
    void onlyRunningIsHealthy() {
        assertThat(HealthStatus.running(Duration.ofMillis(3)).isHealthy()).isTrue();
        assertThat(HealthStatus.unresponsive(1).isHealthy()).isFalse();
        assertThat(HealthStatus.of(BackendState.STARTING, 0).isHealthy()).isFalse();
        assertThat(HealthStatus.error("crashed", 0).isHealthy()).isFalse();
    }

    @Test
    void unresponsiveCarriesFailureCount() {
        HealthStatus status = HealthStatus.unresponsive(2);

        assertThat(status.state()).isEqualTo(BackendState.UNRESPONSIVE);
        assertThat(status.consecutiveFailures()).isEqualTo(2);
        assertThat(status.errorMessage()).isNotBlank();
    }

    @Test
    void runningResetsFailureCount() {
        HealthStatus status = HealthStatus.running(Duration.ofMillis(8));

        assertThat(status.consecutiveFailures()).isZero();
        assertThat(status.latency()).isEqualTo(Duration.ofMillis(8));
    }

    @Test
    void rejectsNegativeFailureCount() {
        assertThatThrownBy(() -> new HealthStatus(BackendState.RUNNING, Instant.now(), null, null, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
