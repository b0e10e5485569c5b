package com.phillippitts.meetingscribe.service.stream;

import com.phillippitts.meetingscribe.config.properties.SegmentationProperties;
import com.phillippitts.meetingscribe.config.properties.StreamProperties;
import com.phillippitts.meetingscribe.domain.AudioFrame;
import com.phillippitts.meetingscribe.exception.InvalidAudioException;
import com.phillippitts.meetingscribe.service.gateway.RecognitionResponse;
import com.phillippitts.meetingscribe.service.gateway.VadResponse;
import com.phillippitts.meetingscribe.service.metrics.SegmentationMetricsPublisher;
import com.phillippitts.meetingscribe.util.DiagnosticsThrottle;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for the platform, session and gateway collaborators.
 *
 * <p>Routes frames to streams: in mixed mode every frame goes to the sentinel stream
 * {@link StreamRegistry#MIXED_STREAM_ID}, created at session start; in individual mode each
 * participant gets its own stream on its first frame (frames without a participant go to
 * {@value #UNKNOWN_PARTICIPANT}). Frames arriving while no session is active are dropped.
 *
 * <p>Each session owns a {@link ConversationContext} that all of its streams feed and read.
 *
 * <p>Nothing here blocks on segmentation work: calls validate, enqueue and return.
 */
public class SegmentationEngine {

    private static final Logger LOG = LogManager.getLogger(SegmentationEngine.class);

    static final String UNKNOWN_PARTICIPANT = "unknown";

    private final StreamRegistry registry;
    private final StreamProperties streamProperties;
    private final int sampleRate;
    private final SegmentationMetricsPublisher metrics;
    private final DiagnosticsThrottle throttle = new DiagnosticsThrottle();
    private volatile Session session;

    public SegmentationEngine(StreamRegistry registry, StreamProperties streamProperties,
                              SegmentationProperties segmentationProperties) {
        this(registry, streamProperties, segmentationProperties, SegmentationMetricsPublisher.NOOP);
    }

    public SegmentationEngine(StreamRegistry registry, StreamProperties streamProperties,
                              SegmentationProperties segmentationProperties,
                              SegmentationMetricsPublisher metrics) {
        this.registry = registry;
        this.streamProperties = streamProperties;
        this.sampleRate = segmentationProperties.getSampleRate();
        this.metrics = metrics == null ? SegmentationMetricsPublisher.NOOP : metrics;
    }

    /**
     * Starts a session. A still-running session is ended first, and any stream left over
     * from an earlier one is released with its buffered audio.
     */
    public synchronized void startSession(String sessionId) {
        Session previous = session;
        if (previous != null) {
            LOG.warn("Session {} still active; ending it before starting {}", previous.id(), sessionId);
        }
        int stale = registry.releaseAll();
        if (previous == null && stale > 0) {
            LOG.warn("Released {} stream(s) left over outside a session", stale);
        }
        Session started = new Session(sessionId, new ConversationContext(streamProperties.getContextHistorySize()));
        session = started;
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext.put("sessionId", sessionId)) {
            LOG.info("Session started in {} mode", streamProperties.getMode());
            if (!streamProperties.isIndividual()) {
                registry.acquire(StreamRegistry.MIXED_STREAM_ID, sessionId, started.context());
            }
        }
    }

    /**
     * Ends the session and releases every stream; in-progress utterances are discarded.
     *
     * @return number of released streams
     */
    public synchronized int endSession() {
        Session ended = session;
        session = null;
        int released = registry.releaseAll();
        if (ended != null) {
            LOG.info("Session {} ended ({} stream(s) released)", ended.id(), released);
        }
        return released;
    }

    public int sampleRate() {
        return sampleRate;
    }

    public Optional<String> currentSession() {
        Session current = session;
        return current == null ? Optional.empty() : Optional.of(current.id());
    }

    /** Context of the active session, or empty outside a session. */
    public Optional<ConversationContext> currentContext() {
        Session current = session;
        return current == null ? Optional.empty() : Optional.of(current.context());
    }

    /**
     * Routes a frame to its stream.
     *
     * @return false if the frame was dropped (no active session, stream released concurrently
     *         or mailbox full)
     * @throws InvalidAudioException if the frame's sample rate is not the configured one
     */
    public boolean ingest(AudioFrame frame) {
        if (frame.sampleRate() != sampleRate) {
            throw new InvalidAudioException(frame.length() * 2,
                    "sample rate " + frame.sampleRate() + " Hz does not match configured " + sampleRate + " Hz");
        }
        Session current = session;
        if (current == null) {
            metrics.frameWithoutSession();
            if (throttle.shouldLog("no-session")) {
                LOG.warn("Dropping frame from {}: no active session", frame.participantId());
            }
            return false;
        }
        AudioStream stream = registry.acquire(route(frame), current.id(), current.context());
        if (session != current && stream.context() == current.context()) {
            // session ended while this frame was being routed
            registry.discard(stream);
            return false;
        }
        return stream.post(new StreamMessage.Frame(frame));
    }

    String route(AudioFrame frame) {
        if (!streamProperties.isIndividual()) {
            return StreamRegistry.MIXED_STREAM_ID;
        }
        String participant = frame.participantId();
        return participant == null || participant.isBlank() ? UNKNOWN_PARTICIPANT : participant;
    }

    /**
     * Delivers a voice-activity reply for a stream. Replies for released streams are dropped.
     */
    public boolean onVadResponse(String streamId, VadResponse response) {
        return registry.find(streamId)
                .map(stream -> stream.post(new StreamMessage.Verdict(response)))
                .orElseGet(() -> droppedAfterRelease(streamId, "verdict"));
    }

    /**
     * Delivers a recognition reply for a stream. Replies for released streams are dropped.
     */
    public boolean onRecognitionResponse(String streamId, RecognitionResponse response) {
        return registry.find(streamId)
                .map(stream -> stream.post(new StreamMessage.Recognition(response)))
                .orElseGet(() -> droppedAfterRelease(streamId, "recognition"));
    }

    private boolean droppedAfterRelease(String streamId, String kind) {
        LOG.debug("Dropping {} reply for inactive stream {}", kind, streamId);
        return false;
    }

    /**
     * Releases one stream (participant left).
     *
     * @return false if the stream was not live
     */
    public boolean releaseStream(String streamId) {
        return registry.release(streamId);
    }

    public List<StreamSnapshot> activeStreams() {
        return registry.snapshots();
    }

    private record Session(String id, ConversationContext context) {}

    /** Posts a timer tick to every live stream. */
    public void tick() {
        for (AudioStream stream : registry.streams()) {
            stream.postTick();
        }
    }
}
