package com.phillippitts.newwork.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the embedded backend process and its health monitor.
 */
@ConfigurationProperties(prefix = "backend")
@Validated
public class BackendProperties {

    /** Start the backend when the application is ready. */
    private boolean autoStart = true;

    /** Loopback address the backend binds to. */
    @NotBlank(message = "Backend host must not be blank")
    private String host = "127.0.0.1";

    @Min(value = 1, message = "Backend port must be between 1 and 65535")
    @Max(value = 65535, message = "Backend port must be between 1 and 65535")
    private int port = 8000;

    /** Path of the liveness endpoint; a 200 response means healthy. */
    @NotBlank(message = "Health path must not be blank")
    private String healthPath = "/health";

    /** Executable base name; the platform table adds directory layout and suffix. */
    @NotBlank(message = "Executable name must not be blank")
    private String executableName = "newwork-backend";

    /**
     * Overrides the host application's install directory used to resolve the executable.
     * When blank, the directory of the running launcher is used.
     */
    private String installDir;

    @NotNull
    private Duration healthCheckInterval = Duration.ofSeconds(10);

    @NotNull
    private Duration healthCheckTimeout = Duration.ofSeconds(2);

    /** Failed checks in a row that mark the backend unresponsive and trigger one restart. */
    @Positive(message = "Max consecutive failures must be positive")
    private int maxConsecutiveFailures = 3;

    /** Grace period between the termination signal and a forced kill. */
    @NotNull
    private Duration gracefulStopTimeout = Duration.ofSeconds(3);

    /** Pause between stop and start during a restart. */
    @NotNull
    private Duration restartDelay = Duration.ofSeconds(1);

    @Valid
    private Startup startup = new Startup();

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getHealthPath() {
        return healthPath;
    }

    public void setHealthPath(String healthPath) {
        this.healthPath = healthPath;
    }

    public String getExecutableName() {
        return executableName;
    }

    public void setExecutableName(String executableName) {
        this.executableName = executableName;
    }

    public String getInstallDir() {
        return installDir;
    }

    public void setInstallDir(String installDir) {
        this.installDir = installDir;
    }

    public Duration getHealthCheckInterval() {
        return healthCheckInterval;
    }

    public void setHealthCheckInterval(Duration healthCheckInterval) {
        this.healthCheckInterval = healthCheckInterval;
    }

    public Duration getHealthCheckTimeout() {
        return healthCheckTimeout;
    }

    public void setHealthCheckTimeout(Duration healthCheckTimeout) {
        this.healthCheckTimeout = healthCheckTimeout;
    }

    public int getMaxConsecutiveFailures() {
        return maxConsecutiveFailures;
    }

    public void setMaxConsecutiveFailures(int maxConsecutiveFailures) {
        this.maxConsecutiveFailures = maxConsecutiveFailures;
    }

    public Duration getGracefulStopTimeout() {
        return gracefulStopTimeout;
    }

    public void setGracefulStopTimeout(Duration gracefulStopTimeout) {
        this.gracefulStopTimeout = gracefulStopTimeout;
    }

    public Duration getRestartDelay() {
        return restartDelay;
    }

    public void setRestartDelay(Duration restartDelay) {
        this.restartDelay = restartDelay;
    }

    public Startup getStartup() {
        return startup;
    }

    public void setStartup(Startup startup) {
        this.startup = startup;
    }

    /**
     * Readiness polling performed right after spawning the process.
     */
    public static class Startup {

        @Positive(message = "Startup max attempts must be positive")
        private int maxAttempts = 30;

        @NotNull
        private Duration pollInterval = Duration.ofMillis(500);

        @NotNull
        private Duration probeTimeout = Duration.ofSeconds(1);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getProbeTimeout() {
            return probeTimeout;
        }

        public void setProbeTimeout(Duration probeTimeout) {
            this.probeTimeout = probeTimeout;
        }
    }
}
