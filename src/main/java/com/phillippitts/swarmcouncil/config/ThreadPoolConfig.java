package com.phillippitts.swarmcouncil.config;

import com.phillippitts.swarmcouncil.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for provider construction, stage calls and health checks.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for provider construction, pool probes and cancellable stage calls.
     *
     * <p>Pool sizing configured via {@code threadpool.council.*} properties:
     * <ul>
     *   <li>Core pool: default 8, one per provider with headroom</li>
     *   <li>Max pool: default 16</li>
     *   <li>Queue: default 100 tasks</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. When the pool and queue are
     * full the submission fails; callers report it as a construction or stage failure so that
     * timeouts and cancellation stay in force.
     *
     * <p>MDC propagation: copies Log4j2 ThreadContext from the submitting thread so request,
     * council and workflow ids appear in provider logs.
     *
     * @return configured executor
     */
    @Bean(name = "councilExecutor")
    public ThreadPoolTaskExecutor councilExecutor() {
        ThreadPoolProperties.CouncilPoolProperties councilProps = threadPoolProperties.getCouncil();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(councilProps.getCorePoolSize());
        executor.setMaxPoolSize(councilProps.getMaxPoolSize());
        executor.setQueueCapacity(councilProps.getQueueCapacity());
        executor.setThreadNamePrefix(councilProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(councilProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler for the periodic provider health checks of every council.
     *
     * <p>Cancelled schedules are removed from the queue immediately so stopped councils leave
     * nothing behind.
     *
     * @return configured scheduler
     */
    @Bean(name = "healthScheduler")
    public ThreadPoolTaskScheduler healthScheduler() {
        ThreadPoolProperties.HealthPoolProperties healthProps = threadPoolProperties.getHealth();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(healthProps.getPoolSize());
        scheduler.setThreadNamePrefix(healthProps.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    /** Copies the submitting thread's ThreadContext into the worker for the task's duration. */
    static TaskDecorator mdcPropagating() {
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
