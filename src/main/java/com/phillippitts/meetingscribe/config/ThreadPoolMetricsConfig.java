package com.phillippitts.meetingscribe.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes stream and gateway pool gauges via Micrometer:
 * {@code <pool>.pool.size}, {@code .active}, {@code .queued}, {@code .completed}.
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ThreadPoolTaskExecutor streamExecutor;
    private final ThreadPoolTaskExecutor gatewayExecutor;

    public ThreadPoolMetricsConfig(@Qualifier("streamExecutor") ThreadPoolTaskExecutor streamExecutor,
                                   @Qualifier("gatewayExecutor") ThreadPoolTaskExecutor gatewayExecutor) {
        this.streamExecutor = streamExecutor;
        this.gatewayExecutor = gatewayExecutor;
    }

    @Bean
    public MeterBinder executorPoolMetrics() {
        return registry -> {
            bind(registry, "stream", streamExecutor.getThreadPoolExecutor());
            bind(registry, "gateway", gatewayExecutor.getThreadPoolExecutor());
            LOG.info("Thread pool metrics registered: stream.pool.*, gateway.pool.*");
        };
    }

    private static void bind(MeterRegistry registry, String name, ThreadPoolExecutor executor) {
        Gauge.builder(name + ".pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the " + name + " pool")
                .register(registry);
        Gauge.builder(name + ".pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Threads actively executing " + name + " tasks")
                .register(registry);
        Gauge.builder(name + ".pool.queued", executor, e -> e.getQueue().size())
                .description("Tasks waiting in the " + name + " queue")
                .register(registry);
        Gauge.builder(name + ".pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative completed " + name + " tasks")
                .register(registry);
    }

    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        log("Stream", streamExecutor.getThreadPoolExecutor());
        log("Gateway", gatewayExecutor.getThreadPoolExecutor());
    }

    private static void log(String name, ThreadPoolExecutor executor) {
        LOG.info("{} Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                name,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
