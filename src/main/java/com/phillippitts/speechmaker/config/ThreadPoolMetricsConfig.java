package com.phillippitts.speechmaker.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the chunk synthesis pool through Micrometer.
 *
 * <ul>
 *   <li>conversion.pool.size - current number of threads</li>
 *   <li>conversion.pool.active - threads synthesizing a chunk</li>
 *   <li>conversion.pool.queued - chunks waiting for a worker</li>
 *   <li>conversion.pool.completed - cumulative completed chunk tasks</li>
 * </ul>
 *
 * <p>Available via {@code GET /actuator/metrics/conversion.pool.active}. A health summary is
 * logged every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> conversionExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("conversionExecutor") ObjectProvider<ThreadPoolTaskExecutor> conversionExecutorProvider) {
        this.conversionExecutorProvider = conversionExecutorProvider;
    }

    @Bean
    public MeterBinder conversionExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = this.conversionExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("conversion.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the conversion pool")
                    .register(registry);

            Gauge.builder("conversion.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Threads actively synthesizing chunks")
                    .register(registry);

            Gauge.builder("conversion.pool.queued", executor, e -> e.getQueue().size())
                    .description("Chunk tasks waiting in the queue")
                    .register(registry);

            Gauge.builder("conversion.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed chunk tasks")
                    .register(registry);

            LOG.info("Conversion pool metrics registered: conversion.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = this.conversionExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Conversion pool health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
