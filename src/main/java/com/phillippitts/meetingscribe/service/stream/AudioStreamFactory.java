package com.phillippitts.meetingscribe.service.stream;

import com.phillippitts.meetingscribe.config.properties.SegmentationProperties;
import com.phillippitts.meetingscribe.config.properties.StreamProperties;
import com.phillippitts.meetingscribe.service.gateway.RecognitionGateway;
import com.phillippitts.meetingscribe.service.gateway.VadGateway;
import com.phillippitts.meetingscribe.service.metrics.SegmentationMetricsPublisher;
import com.phillippitts.meetingscribe.service.output.TranscriptSink;
import com.phillippitts.meetingscribe.util.DiagnosticsThrottle;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Builds {@link AudioStream}s. Mixed and individual streams are the same type; only the
 * identity differs: the mixed sentinel has no fixed speaker and may ask for diarization,
 * an individual stream is its own speaker and is never diarized.
 */
public class AudioStreamFactory {

    private final SegmentationProperties segmentation;
    private final StreamProperties streams;
    private final VadGateway vadGateway;
    private final RecognitionGateway recognitionGateway;
    private final TranscriptSink sink;
    private final SegmentationMetricsPublisher metrics;
    private final Clock clock;
    private final Executor executor;
    private final DiagnosticsThrottle throttle = new DiagnosticsThrottle();

    public AudioStreamFactory(SegmentationProperties segmentation,
                              StreamProperties streams,
                              VadGateway vadGateway,
                              RecognitionGateway recognitionGateway,
                              TranscriptSink sink,
                              SegmentationMetricsPublisher metrics,
                              Clock clock,
                              Executor executor) {
        this.segmentation = segmentation;
        this.streams = streams;
        this.vadGateway = vadGateway;
        this.recognitionGateway = recognitionGateway;
        this.sink = sink;
        this.metrics = metrics;
        this.clock = clock;
        this.executor = executor;
    }

    public AudioStream create(String streamId, String sessionId) {
        return create(streamId, sessionId, ConversationContext.disabled());
    }

    /**
     * @param context conversation context of the stream's session, shared with its other streams
     */
    public AudioStream create(String streamId, String sessionId, ConversationContext context) {
        boolean mixed = StreamRegistry.MIXED_STREAM_ID.equals(streamId);
        return AudioStream.builder()
                .streamId(streamId)
                .speakerId(mixed ? null : streamId)
                .sessionId(sessionId)
                .diarization(mixed && streams.isDiarization())
                .properties(segmentation)
                .vadGateway(vadGateway)
                .recognitionGateway(recognitionGateway)
                .sink(sink)
                .metrics(metrics)
                .clock(clock)
                .executor(executor)
                .throttle(throttle)
                .context(context)
                .build();
    }
}
