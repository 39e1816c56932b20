package com.phillippitts.newwork.config;

import com.phillippitts.newwork.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the threads the supervisor and recovery machinery run on.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Scheduler that drives the backend health-monitor loop.
     *
     * <p>Fixed-rate tasks on a {@link ThreadPoolTaskScheduler} never overlap, so an overrunning
     * health check delays the next tick instead of stacking up concurrent probes.
     *
     * @return scheduler for {@code BackendProcessSupervisor}
     */
    @Bean(name = "healthMonitorScheduler")
    public ThreadPoolTaskScheduler healthMonitorScheduler() {
        ThreadPoolProperties.HealthSchedulerProperties props = threadPoolProperties.getHealth();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Executor that runs recovery work triggered by backend fault events, keeping the
     * health-monitor thread and the process exit observer free.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and
     * queue are full the publishing thread runs the task, providing backpressure instead of
     * dropping fault events.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext from the publisher to the worker thread.
     *
     * @return executor referenced by {@code @Async("recoveryExecutor")}
     */
    @Bean(name = "recoveryExecutor")
    public ThreadPoolTaskExecutor recoveryExecutor() {
        return boundedExecutor(threadPoolProperties.getRecovery());
    }

    /**
     * Executor running the phases of a full system restart so each phase can be bounded
     * by a timeout.
     *
     * @return executor for {@code GracefulSystemRestartCoordinator}
     */
    @Bean(name = "systemRestartExecutor")
    public ThreadPoolTaskExecutor systemRestartExecutor() {
        return boundedExecutor(threadPoolProperties.getRestart());
    }

    private static ThreadPoolTaskExecutor boundedExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
