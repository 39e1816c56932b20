package com.phillippitts.newwork.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the health-monitor scheduler, the recovery executor and the
 * system-restart executor. Defaults are conservative: recovery is single-flight anyway, so
 * larger pools only help absorb bursts of fault events.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private HealthSchedulerProperties health = new HealthSchedulerProperties();
    private PoolProperties recovery = new PoolProperties(1, 2, 20, "recovery-");
    private PoolProperties restart = new PoolProperties(1, 1, 2, "system-restart-");

    public HealthSchedulerProperties getHealth() {
        return health;
    }

    public void setHealth(HealthSchedulerProperties health) {
        this.health = health;
    }

    public PoolProperties getRecovery() {
        return recovery;
    }

    public void setRecovery(PoolProperties recovery) {
        this.recovery = recovery;
    }

    public PoolProperties getRestart() {
        return restart;
    }

    public void setRestart(PoolProperties restart) {
        this.restart = restart;
    }

    /**
     * Scheduler driving the periodic health check. One thread is enough: ticks never overlap.
     */
    public static class HealthSchedulerProperties {
        private int poolSize = 1;
        private String threadNamePrefix = "backend-health-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Bounded executor configuration.
     */
    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
            this(1, 1, 10, "pool-");
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
