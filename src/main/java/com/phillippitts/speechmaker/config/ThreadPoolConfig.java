package com.phillippitts.speechmaker.config;

import com.phillippitts.speechmaker.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;

/**
 * Thread pools for conversion work.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 *
 * <p>When the pool and queue are full the submitting thread runs the task, which applies
 * backpressure instead of failing the session. Once the pool is shut down a submission is rejected
 * with {@link RejectedExecutionException} rather than dropped, so no caller waits on a task that
 * will never run.
 * All pools copy the Log4j2 ThreadContext (requestId, sessionId) from the submitting thread.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Chunk synthesis workers. Each task spawns one engine process, so this pool caps the number
     * of simultaneous synthesis processes across all sessions.
     *
     * @return executor for chunk synthesis
     */
    @Bean(name = "conversionExecutor")
    public ThreadPoolTaskExecutor conversionExecutor() {
        ThreadPoolProperties.ConversionPoolProperties props = threadPoolProperties.getConversion();
        return build(props.getCorePoolSize(), props.getMaxPoolSize(), props.getQueueCapacity(),
                props.getKeepAliveSeconds(), props.getThreadNamePrefix());
    }

    /**
     * Session control threads: one per running session, dispatching chunks and merging.
     *
     * @return executor for session control loops
     */
    @Bean(name = "sessionExecutor")
    public Executor sessionExecutor() {
        ThreadPoolProperties.SessionPoolProperties props = threadPoolProperties.getSession();
        return build(props.getCorePoolSize(), props.getMaxPoolSize(), props.getQueueCapacity(),
                props.getKeepAliveSeconds(), props.getThreadNamePrefix());
    }

    /**
     * Resource probes (voice listing, converter detection). Kept separate so a slow probe never
     * occupies a synthesis worker.
     *
     * @return executor for resource resolution
     */
    @Bean(name = "resourceExecutor")
    public Executor resourceExecutor() {
        ThreadPoolProperties.ResourcePoolProperties props = threadPoolProperties.getResource();
        return build(props.getCorePoolSize(), props.getMaxPoolSize(), props.getQueueCapacity(),
                props.getKeepAliveSeconds(), props.getThreadNamePrefix());
    }

    private static ThreadPoolTaskExecutor build(int core, int max, int queue, int keepAlive, String prefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.setKeepAliveSeconds(keepAlive);
        executor.setRejectedExecutionHandler(callerRunsUnlessShutdown());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    /**
     * Runs a rejected task on the submitting thread while the pool is live; throws once it is shut
     * down.
     */
    static RejectedExecutionHandler callerRunsUnlessShutdown() {
        return (task, pool) -> {
            if (pool.isShutdown()) {
                throw new RejectedExecutionException("Executor is shut down; task " + task + " rejected");
            }
            task.run();
        };
    }

    /**
     * Copies the submitting thread's ThreadContext onto the worker and restores the worker's own
     * context afterwards.
     */
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
