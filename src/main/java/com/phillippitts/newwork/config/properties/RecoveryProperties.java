package com.phillippitts.newwork.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the error-recovery orchestrator and restart limiter.
 */
@ConfigurationProperties(prefix = "recovery")
@Validated
public class RecoveryProperties {

    /** Automatic recoveries permitted within {@link #window}. */
    @Positive(message = "Max attempts must be positive")
    private int maxAttempts = 3;

    /** Sliding window for the recovery budget. */
    @NotNull
    private Duration window = Duration.ofMinutes(5);

    @Positive(message = "Error history capacity must be positive")
    private int errorHistoryCapacity = 100;

    @Positive(message = "Recovery history capacity must be positive")
    private int recoveryHistoryCapacity = 50;

    @Valid
    private Backoff backoff = new Backoff();

    @Valid
    private SystemRestart systemRestart = new SystemRestart();

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getWindow() {
        return window;
    }

    public void setWindow(Duration window) {
        this.window = window;
    }

    public int getErrorHistoryCapacity() {
        return errorHistoryCapacity;
    }

    public void setErrorHistoryCapacity(int errorHistoryCapacity) {
        this.errorHistoryCapacity = errorHistoryCapacity;
    }

    public int getRecoveryHistoryCapacity() {
        return recoveryHistoryCapacity;
    }

    public void setRecoveryHistoryCapacity(int recoveryHistoryCapacity) {
        this.recoveryHistoryCapacity = recoveryHistoryCapacity;
    }

    public Backoff getBackoff() {
        return backoff;
    }

    public void setBackoff(Backoff backoff) {
        this.backoff = backoff;
    }

    public SystemRestart getSystemRestart() {
        return systemRestart;
    }

    public void setSystemRestart(SystemRestart systemRestart) {
        this.systemRestart = systemRestart;
    }

    public enum BackoffMode { FIXED, EXPONENTIAL }

    /**
     * Delay applied between automatic restart attempts of the backend.
     */
    public static class Backoff {

        private BackoffMode mode = BackoffMode.FIXED;

        @NotNull
        private Duration baseDelay = Duration.ofSeconds(1);

        @DecimalMin(value = "1.0", message = "Backoff multiplier must be >= 1.0")
        private double multiplier = 2.0;

        @NotNull
        private Duration maxDelay = Duration.ofSeconds(30);

        public BackoffMode getMode() {
            return mode;
        }

        public void setMode(BackoffMode mode) {
            this.mode = mode;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }
    }

    /**
     * Phased full-system restart.
     */
    public static class SystemRestart {

        @NotNull
        private Duration phaseTimeout = Duration.ofSeconds(30);

        @Positive
        private int healthWaitAttempts = 10;

        @NotNull
        private Duration healthWaitInterval = Duration.ofMillis(500);

        @NotNull
        private Duration shutdownPause = Duration.ofMillis(500);

        public Duration getPhaseTimeout() {
            return phaseTimeout;
        }

        public void setPhaseTimeout(Duration phaseTimeout) {
            this.phaseTimeout = phaseTimeout;
        }

        public int getHealthWaitAttempts() {
            return healthWaitAttempts;
        }

        public void setHealthWaitAttempts(int healthWaitAttempts) {
            this.healthWaitAttempts = healthWaitAttempts;
        }

        public Duration getHealthWaitInterval() {
            return healthWaitInterval;
        }

        public void setHealthWaitInterval(Duration healthWaitInterval) {
            this.healthWaitInterval = healthWaitInterval;
        }

        public Duration getShutdownPause() {
            return shutdownPause;
        }

        public void setShutdownPause(Duration shutdownPause) {
            this.shutdownPause = shutdownPause;
        }
    }
}
