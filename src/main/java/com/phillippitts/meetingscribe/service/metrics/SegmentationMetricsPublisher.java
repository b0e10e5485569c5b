package com.phillippitts.meetingscribe.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Null-safe front for {@link SegmentationMetrics}.
 *
 * <p>Streams record through this class so they can run without a meter registry
 * (tests, embedding without Spring): with null metrics every method is a no-op.
 */
@Component
public final class SegmentationMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(SegmentationMetricsPublisher.class);

    /**
     * Singleton no-op instance for tests and non-Spring construction.
     */
    public static final SegmentationMetricsPublisher NOOP = new SegmentationMetricsPublisher(null);

    private final SegmentationMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public SegmentationMetricsPublisher(SegmentationMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("SegmentationMetricsPublisher created without metrics (test mode)");
        }
    }

    public void packetDispatched() {
        if (metrics != null) {
            metrics.incrementPackets();
        }
    }

    public void verdict(String outcome) {
        if (metrics != null) {
            metrics.incrementVerdict(outcome);
        }
    }

    public void segment(String boundary) {
        if (metrics != null) {
            metrics.incrementSegment(boundary);
        }
    }

    public void utteranceDiscarded() {
        if (metrics != null) {
            metrics.incrementDiscarded();
        }
    }

    public void released(String outcome) {
        if (metrics != null) {
            metrics.incrementReleased(outcome);
        }
    }

    public void recognitionLatency(Duration latency) {
        if (metrics != null && latency != null) {
            metrics.recordRecognitionLatency(latency);
        }
    }

    public void messageDropped(String type) {
        if (metrics != null) {
            metrics.incrementDropped(type);
        }
    }

    public void drainRejected() {
        if (metrics != null) {
            metrics.incrementDrainRejected();
        }
    }

    public void frameWithoutSession() {
        if (metrics != null) {
            metrics.incrementFramesWithoutSession();
        }
    }

    public void handlerError() {
        if (metrics != null) {
            metrics.incrementHandlerErrors();
        }
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
