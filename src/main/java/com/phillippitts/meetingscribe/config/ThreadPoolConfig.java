package com.phillippitts.meetingscribe.config;

import com.phillippitts.meetingscribe.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for stream mailbox draining and gateway calls.
 *
 * <p>Both pools use {@link ThreadPoolExecutor.AbortPolicy}: a saturated pool never runs work
 * on the submitting thread, so frame ingestion and gateway callbacks stay non-blocking. A
 * rejected mailbox drain is retried on the next post or sweep; a rejected gateway call
 * fails the packet or segment it was issued for.
 *
 * <p>MDC propagation: Log4j2 ThreadContext is copied from the submitting thread so that
 * gateway logs keep the session and stream ids of the stream that issued the request.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Pool on which {@code AudioStream} mailboxes are drained. A stream never occupies more
     * than one worker at a time.
     */
    @Bean(name = "streamExecutor")
    public ThreadPoolTaskExecutor streamExecutor() {
        return build(threadPoolProperties.getStream());
    }

    /**
     * Pool for voice-activity classification and recognition requests.
     */
    @Bean(name = "gatewayExecutor")
    public ThreadPoolTaskExecutor gatewayExecutor() {
        return build(threadPoolProperties.getGateway());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

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
