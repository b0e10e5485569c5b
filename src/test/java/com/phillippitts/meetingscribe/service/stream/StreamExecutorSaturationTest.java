package com.phillippitts.meetingscribe.service.stream;

import com.phillippitts.meetingscribe.config.ThreadPoolConfig;
import com.phillippitts.meetingscribe.config.properties.SegmentationProperties;
import com.phillippitts.meetingscribe.config.properties.StreamProperties;
import com.phillippitts.meetingscribe.config.properties.ThreadPoolProperties;
import com.phillippitts.meetingscribe.service.gateway.VadGateway;
import com.phillippitts.meetingscribe.service.gateway.VadRequest;
import com.phillippitts.meetingscribe.service.gateway.VadResponse;
import com.phillippitts.meetingscribe.service.metrics.SegmentationMetrics;
import com.phillippitts.meetingscribe.service.metrics.SegmentationMetricsPublisher;
import com.phillippitts.meetingscribe.testutil.CapturingTranscriptSink;
import com.phillippitts.meetingscribe.testutil.MutableClock;
import com.phillippitts.meetingscribe.testutil.ScriptedRecognitionGateway;
import com.phillippitts.meetingscribe.testutil.ScriptedVadGateway;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.meetingscribe.testutil.AudioFixtures.PACKET;
import static com.phillippitts.meetingscribe.testutil.AudioFixtures.T0;
import static com.phillippitts.meetingscribe.testutil.AudioFixtures.constant;
import static com.phillippitts.meetingscribe.testutil.AudioFixtures.frame;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * A stream pool with one worker and a one-slot queue, both occupied, so every drain is rejected.
 */
class StreamExecutorSaturationTest {

    private final CountDownLatch unblock = new CountDownLatch(1);
    private final List<String> classifyingThreads = new CopyOnWriteArrayList<>();
    private ThreadPoolTaskExecutor streamExecutor;
    private SimpleMeterRegistry meterRegistry;
    private SegmentationEngine engine;

    @BeforeEach
    void setUp() throws InterruptedException {
        ThreadPoolProperties pools = new ThreadPoolProperties();
        pools.getStream().setCorePoolSize(1);
        pools.getStream().setMaxPoolSize(1);
        pools.getStream().setQueueCapacity(1);
        streamExecutor = new ThreadPoolConfig(pools).streamExecutor();

        CountDownLatch started = new CountDownLatch(1);
        streamExecutor.execute(() -> {
            started.countDown();
            awaitQuietly(unblock);
        });
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        streamExecutor.execute(() -> awaitQuietly(unblock));

        ScriptedVadGateway delegate = ScriptedVadGateway.nonZeroIsSpeech();
        VadGateway recordingVad = new VadGateway() {
            @Override
            public CompletableFuture<VadResponse> classify(VadRequest request) {
                classifyingThreads.add(Thread.currentThread().getName());
                return delegate.classify(request);
            }
        };
        meterRegistry = new SimpleMeterRegistry();
        SegmentationMetricsPublisher metrics = new SegmentationMetricsPublisher(new SegmentationMetrics(meterRegistry));
        SegmentationProperties props = SegmentationProperties.defaults();
        StreamProperties streams = new StreamProperties(StreamProperties.Mode.INDIVIDUAL, false);
        AudioStreamFactory factory = new AudioStreamFactory(props, streams, recordingVad,
                ScriptedRecognitionGateway.echoingIds(), new CapturingTranscriptSink(), metrics,
                new MutableClock(T0), streamExecutor);
        engine = new SegmentationEngine(new StreamRegistry(factory), streams, props, metrics);
        engine.startSession("busy");
    }

    @AfterEach
    void tearDown() {
        unblock.countDown();
        engine.endSession();
        streamExecutor.shutdown();
    }

    @Test
    void saturatedPoolNeverRunsSegmentationOnTheIngestingThread() {
        assertThat(engine.ingest(frame("alice", constant(100, PACKET), 1))).isTrue();
        engine.tick();

        assertThat(classifyingThreads).isEmpty();
        assertThat(engine.activeStreams()).singleElement()
                .satisfies(s -> assertThat(s.mailboxSize()).isEqualTo(2));
        assertThat(meterRegistry.find("meetingscribe.segmentation.drain.rejected").counter().count())
                .isGreaterThanOrEqualTo(1.0);
    }

    @Test
    void deferredDrainRunsOnPoolOnceTheSweepRetries() {
        engine.ingest(frame("alice", constant(100, PACKET), 1));
        engine.tick();

        unblock.countDown();
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            engine.tick();
            assertThat(classifyingThreads).hasSize(1);
        });

        assertThat(classifyingThreads).allSatisfy(name -> assertThat(name).startsWith("stream-"));
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(engine.activeStreams())
                .singleElement().satisfies(s -> assertThat(s.mailboxSize()).isZero()));
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
