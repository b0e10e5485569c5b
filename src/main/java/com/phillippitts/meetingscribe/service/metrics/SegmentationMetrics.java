package com.phillippitts.meetingscribe.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for the segmentation engine.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Packets dispatched for voice-activity classification</li>
 *   <li>Verdicts by outcome (speech, non_speech, timeout, evicted, failed, unmatched)</li>
 *   <li>Segments by boundary (target, silence, overflow) and discarded short utterances</li>
 *   <li>Released transcripts by outcome (delivered, gap, empty, unmatched) and recognition latency</li>
 *   <li>Mailbox messages dropped because a stream queue was full</li>
 *   <li>Drains deferred by a saturated stream executor, and frames received outside a session</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class SegmentationMetrics {

    static final String METRIC_PREFIX = "meetingscribe.segmentation";

    private final MeterRegistry registry;

    public SegmentationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementPackets() {
        Counter.builder(METRIC_PREFIX + ".packets")
                .description("Packets dispatched for voice-activity classification")
                .register(registry)
                .increment();
    }

    /**
     * @param outcome speech, non_speech, timeout, evicted, failed or unmatched
     */
    public void incrementVerdict(String outcome) {
        Counter.builder(METRIC_PREFIX + ".verdicts")
                .description("Voice-activity verdicts by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * @param boundary target, silence or overflow
     */
    public void incrementSegment(String boundary) {
        Counter.builder(METRIC_PREFIX + ".segments")
                .description("Segments dispatched for recognition by boundary")
                .tag("boundary", boundary)
                .register(registry)
                .increment();
    }

    public void incrementDiscarded() {
        Counter.builder(METRIC_PREFIX + ".discarded")
                .description("Utterances discarded as shorter than the minimum speech duration")
                .register(registry)
                .increment();
    }

    /**
     * @param outcome delivered, gap, empty or unmatched
     */
    public void incrementReleased(String outcome) {
        Counter.builder(METRIC_PREFIX + ".released")
                .description("Recognition results by release outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRecognitionLatency(Duration latency) {
        Timer.builder(METRIC_PREFIX + ".recognition.latency")
                .description("Time from segment dispatch to recognition reply")
                .register(registry)
                .record(latency);
    }

    /**
     * @param type simple name of the dropped message type
     */
    public void incrementDropped(String type) {
        Counter.builder(METRIC_PREFIX + ".dropped")
                .description("Stream messages dropped because the mailbox was full")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    public void incrementDrainRejected() {
        Counter.builder(METRIC_PREFIX + ".drain.rejected")
                .description("Mailbox drains rejected by a saturated stream executor and deferred")
                .register(registry)
                .increment();
    }

    public void incrementFramesWithoutSession() {
        Counter.builder(METRIC_PREFIX + ".frames.without.session")
                .description("Frames dropped because no session was active")
                .register(registry)
                .increment();
    }

    public void incrementHandlerErrors() {
        Counter.builder(METRIC_PREFIX + ".handler.errors")
                .description("Exceptions caught while a stream handled a message")
                .register(registry)
                .increment();
    }

    public void bindActiveStreams(Supplier<Number> activeStreams) {
        Gauge.builder(METRIC_PREFIX + ".streams.active", activeStreams)
                .description("Live audio streams")
                .register(registry);
    }
}
