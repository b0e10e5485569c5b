package com.phillippitts.meetingscribe.config;

import com.phillippitts.meetingscribe.config.properties.ThreadPoolProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ThreadPoolMetricsConfigTest {

    private ThreadPoolTaskExecutor stream;
    private ThreadPoolTaskExecutor gateway;

    @BeforeEach
    void setUp() {
        ThreadPoolConfig pools = new ThreadPoolConfig(new ThreadPoolProperties());
        stream = pools.streamExecutor();
        gateway = pools.gatewayExecutor();
    }

    @AfterEach
    void tearDown() {
        stream.shutdown();
        gateway.shutdown();
    }

    @Test
    void registersGaugesForBothPools() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        new ThreadPoolMetricsConfig(stream, gateway).executorPoolMetrics().bindTo(registry);

        for (String pool : new String[]{"stream", "gateway"}) {
            assertThat(registry.get(pool + ".pool.size").gauge()).isNotNull();
            assertThat(registry.get(pool + ".pool.active").gauge()).isNotNull();
            assertThat(registry.get(pool + ".pool.queued").gauge().value()).isZero();
            assertThat(registry.get(pool + ".pool.completed").gauge()).isNotNull();
        }
    }

    @Test
    void logsPoolHealth() {
        assertThatCode(() -> new ThreadPoolMetricsConfig(stream, gateway).logThreadPoolHealth())
                .doesNotThrowAnyException();
    }
}
