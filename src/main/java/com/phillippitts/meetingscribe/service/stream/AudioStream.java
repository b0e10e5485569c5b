package com.phillippitts.meetingscribe.service.stream;

import com.phillippitts.meetingscribe.config.properties.SegmentationProperties;
import com.phillippitts.meetingscribe.domain.TranscriptionSegment;
import com.phillippitts.meetingscribe.service.gateway.RecognitionGateway;
import com.phillippitts.meetingscribe.service.gateway.RecognitionRequest;
import com.phillippitts.meetingscribe.service.gateway.RecognitionResponse;
import com.phillippitts.meetingscribe.service.gateway.VadGateway;
import com.phillippitts.meetingscribe.service.gateway.VadRequest;
import com.phillippitts.meetingscribe.service.gateway.VadResponse;
import com.phillippitts.meetingscribe.service.metrics.SegmentationMetricsPublisher;
import com.phillippitts.meetingscribe.service.output.TranscriptSink;
import com.phillippitts.meetingscribe.service.segmentation.AudioPacket;
import com.phillippitts.meetingscribe.service.segmentation.CorrelationTracker;
import com.phillippitts.meetingscribe.service.segmentation.FinalizedSegment;
import com.phillippitts.meetingscribe.service.segmentation.PacketAccumulator;
import com.phillippitts.meetingscribe.service.segmentation.ResolvedVerdict;
import com.phillippitts.meetingscribe.service.segmentation.SegmentDispatcher;
import com.phillippitts.meetingscribe.service.segmentation.SegmentSink;
import com.phillippitts.meetingscribe.service.segmentation.SpeechSegmentStateMachine;
import com.phillippitts.meetingscribe.util.DiagnosticsThrottle;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One independently processed audio channel: a mixed meeting stream or a single speaker.
 *
 * <p>All state (packet buffer, pending verdicts, speech buffer, reorder buffer) is mutated by
 * exactly one logical writer. Producers (frame ingestion, gateway callbacks, the timer sweep)
 * only {@link #post(StreamMessage)} messages into a bounded mailbox and return immediately.
 * The mailbox is drained by at most one executor task at a time, in posting order.
 *
 * <p>A drain the executor rejects is not run inline: the messages stay queued and the next
 * post or timer tick schedules the drain again.
 *
 * <p>Lifecycle: {@link #release()} waits for a running drain to finish its current message,
 * then discards all state. Afterwards every posted message is dropped and nothing more reaches
 * the {@link TranscriptSink}.
 */
public final class AudioStream {

    private static final Logger LOG = LogManager.getLogger(AudioStream.class);

    /** Messages handled per drain before yielding the worker to other streams. */
    static final int DRAIN_BATCH = 64;

    private final String streamId;
    private final String speakerId;
    private final String sessionId;
    private final int sampleRate;
    private final VadGateway vadGateway;
    private final RecognitionGateway recognitionGateway;
    private final TranscriptSink sink;
    private final SegmentationMetricsPublisher metrics;
    private final Clock clock;
    private final Executor executor;
    private final DiagnosticsThrottle throttle;
    private final ConversationContext context;

    private final PacketAccumulator accumulator;
    private final CorrelationTracker tracker;
    private final SpeechSegmentStateMachine stateMachine;
    private final SegmentDispatcher dispatcher;

    private final BlockingQueue<StreamMessage> mailbox;
    private final int mailboxCapacity;
    private final AtomicBoolean scheduled = new AtomicBoolean(false);
    private final AtomicBoolean tickPending = new AtomicBoolean(false);
    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean released;

    private volatile int outstandingVerdicts;
    private volatile int pendingRecognitions;
    private volatile int bufferedSpeechSamples;

    AudioStream(Builder b) {
        this.streamId = b.streamId;
        this.speakerId = b.speakerId;
        this.sessionId = b.sessionId;
        this.sampleRate = b.properties.getSampleRate();
        this.vadGateway = b.vadGateway;
        this.recognitionGateway = b.recognitionGateway;
        this.sink = b.sink;
        this.metrics = b.metrics == null ? SegmentationMetricsPublisher.NOOP : b.metrics;
        this.clock = b.clock;
        this.executor = b.executor;
        this.throttle = b.throttle == null ? new DiagnosticsThrottle() : b.throttle;
        this.context = b.context == null ? ConversationContext.disabled() : b.context;

        SegmentationProperties p = b.properties;
        this.accumulator = new PacketAccumulator(p.packetSamples(), sampleRate);
        this.tracker = new CorrelationTracker(p.getMaxOutstandingVerdicts(), p.verdictTimeout());
        this.stateMachine = new SpeechSegmentStateMachine(p, clock, new DispatchingSegmentSink());
        this.dispatcher = new SegmentDispatcher(streamId, speakerId, b.diarization, sampleRate, p.reorderTimeout());
        this.mailboxCapacity = p.getMailboxCapacity();
        this.mailbox = new ArrayBlockingQueue<>(mailboxCapacity);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Enqueues a message without blocking.
     *
     * @return false if the stream is released or its mailbox is full
     */
    public boolean post(StreamMessage message) {
        if (released) {
            return false;
        }
        if (!mailbox.offer(message)) {
            String type = message.getClass().getSimpleName();
            metrics.messageDropped(type);
            if (throttle.shouldLog(streamId + "/mailbox-full")) {
                LOG.warn("Mailbox full for stream {} (capacity {}), dropping {}", streamId, mailboxCapacity, type);
            }
            schedule();
            return false;
        }
        schedule();
        return true;
    }

    /**
     * Posts a tick unless one is already queued. A queued tick whose drain was rejected is
     * rescheduled instead.
     */
    public void postTick() {
        if (released) {
            return;
        }
        if (!tickPending.compareAndSet(false, true)) {
            if (!mailbox.isEmpty()) {
                schedule();
            }
            return;
        }
        if (!post(StreamMessage.Tick.INSTANCE)) {
            tickPending.set(false);
        }
    }

    private void schedule() {
        if (!scheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            // messages stay queued; the next post or tick retries
            scheduled.set(false);
            metrics.drainRejected();
            logThrottled("drain-rejected", "Stream executor saturated; drain of stream {} deferred ({} queued)",
                    streamId, mailbox.size());
        }
    }

    private void drain() {
        lock.lock();
        try (CloseableThreadContext.Instance ignored = CloseableThreadContext
                .put("streamId", streamId)
                .put("sessionId", sessionId == null ? "" : sessionId)) {
            StreamMessage message;
            int handled = 0;
            while (!released && handled < DRAIN_BATCH && (message = mailbox.poll()) != null) {
                handle(message);
                handled++;
            }
            publishCounters();
        } finally {
            lock.unlock();
            scheduled.set(false);
        }
        if (!released && !mailbox.isEmpty()) {
            schedule();
        }
    }

    private void handle(StreamMessage message) {
        try {
            if (message instanceof StreamMessage.Frame f) {
                for (AudioPacket packet : accumulator.append(f.frame())) {
                    dispatchPacket(packet);
                }
            } else if (message instanceof StreamMessage.Verdict v) {
                onVerdict(v.response());
            } else if (message instanceof StreamMessage.VerdictFailure vf) {
                if (tracker.fail(vf.correlationId())) {
                    logThrottled("vad-failure", "Voice-activity call failed for packet {}: {}",
                            vf.correlationId(), vf.cause().toString());
                }
                applyReadyVerdicts();
            } else if (message instanceof StreamMessage.Recognition r) {
                onRecognition(r.response());
            } else if (message instanceof StreamMessage.RecognitionFailure rf) {
                if (dispatcher.fail(rf.correlationId())) {
                    logThrottled("recognition-failure", "Recognition call failed for segment {}: {}",
                            rf.correlationId(), rf.cause().toString());
                }
                releaseTranscripts();
            } else if (message instanceof StreamMessage.Tick) {
                tickPending.set(false);
                onTick();
            }
        } catch (RuntimeException e) {
            metrics.handlerError();
            LOG.error("Stream {} failed to handle {}", streamId, message.getClass().getSimpleName(), e);
        }
    }

    private void dispatchPacket(AudioPacket packet) {
        Instant now = clock.instant();
        tracker.register(packet, now);
        metrics.packetDispatched();
        int evicted = tracker.enforceBound();
        if (evicted > 0) {
            logThrottled("evicted", "Evicted {} unresolved voice-activity request(s); resolved as non-speech", evicted);
        }
        long id = packet.correlationId();
        CompletableFuture<VadResponse> future;
        try {
            future = vadGateway.classify(new VadRequest(streamId, id, packet.samples(), sampleRate,
                    packet.captureTimestamp()));
        } catch (RuntimeException e) {
            tracker.fail(id);
            logThrottled("vad-failure", "Voice-activity gateway rejected packet {}: {}", id, e.toString());
            applyReadyVerdicts();
            return;
        }
        future.whenComplete((response, ex) -> {
            if (ex != null) {
                post(new StreamMessage.VerdictFailure(id, ex));
            } else {
                post(new StreamMessage.Verdict(response));
            }
        });
        applyReadyVerdicts();
    }

    private void onVerdict(VadResponse response) {
        CorrelationTracker.Resolution resolution =
                tracker.resolve(response.correlationId(), response.speech(), response.confidence());
        if (resolution != CorrelationTracker.Resolution.ACCEPTED) {
            metrics.verdict("unmatched");
            logThrottled("unmatched-verdict", "Discarded {} verdict for packet {}",
                    resolution.name().toLowerCase(Locale.ROOT), response.correlationId());
            return;
        }
        applyReadyVerdicts();
    }

    private void applyReadyVerdicts() {
        for (ResolvedVerdict verdict : tracker.drainReady()) {
            metrics.verdict(verdict.outcome().tag());
            stateMachine.onVerdict(verdict);
        }
    }

    private void onTick() {
        Instant now = clock.instant();
        int expired = tracker.expire(now);
        if (expired > 0) {
            logThrottled("verdict-timeout", "{} voice-activity request(s) timed out; resolved as non-speech", expired);
        }
        applyReadyVerdicts();
        if (!tracker.hasOutstanding()) {
            stateMachine.onTick();
        }
        int gaps = dispatcher.expireHead(now);
        if (gaps > 0) {
            logThrottled("reorder-timeout", "{} recognition reply(ies) timed out; releasing gap markers", gaps);
        }
        releaseTranscripts();
    }

    private void onRecognition(RecognitionResponse response) {
        Instant now = clock.instant();
        Duration latency = dispatcher.age(response.correlationId(), now);
        if (!dispatcher.accept(response, now)) {
            metrics.released("unmatched");
            logThrottled("unmatched-recognition", "Dropped unmatched recognition reply {}", response.correlationId());
            return;
        }
        metrics.recognitionLatency(latency);
        if (response.isMalformed()) {
            logThrottled("malformed-recognition", "Malformed recognition reply {}; releasing gap marker",
                    response.correlationId());
        }
        releaseTranscripts();
    }

    private void releaseTranscripts() {
        for (TranscriptionSegment segment : dispatcher.drainReady()) {
            if (released) {
                return;
            }
            if (segment.gap()) {
                metrics.released("gap");
            } else if (segment.text().isBlank()) {
                metrics.released("empty");
                continue;
            } else {
                metrics.released("delivered");
            }
            try {
                sink.accept(segment);
            } catch (RuntimeException e) {
                LOG.error("Transcript sink failed for stream {} segment {}", streamId, segment.sequence(), e);
            }
            if (!segment.gap()) {
                context.record(segment.text());
            }
        }
    }

    private void logThrottled(String key, String message, Object... args) {
        if (throttle.shouldLog(streamId + "/" + key)) {
            LOG.warn(message, args);
        } else if (LOG.isDebugEnabled()) {
            LOG.debug(message, args);
        }
    }

    private void publishCounters() {
        outstandingVerdicts = tracker.unresolvedCount();
        pendingRecognitions = dispatcher.pending();
        bufferedSpeechSamples = stateMachine.bufferedSamples();
    }

    /**
     * Tears down all per-stream state. Idempotent. Blocks only while a drain finishes its
     * current message.
     */
    public void release() {
        released = true;
        lock.lock();
        try {
            mailbox.clear();
            tracker.clear();
            stateMachine.reset();
            dispatcher.clear();
            accumulator.reset();
            publishCounters();
        } finally {
            lock.unlock();
        }
        throttle.forget(streamId + "/");
    }

    public boolean isReleased() {
        return released;
    }

    public String streamId() {
        return streamId;
    }

    public String speakerId() {
        return speakerId;
    }

    ConversationContext context() {
        return context;
    }

    public StreamSnapshot snapshot() {
        return new StreamSnapshot(streamId, speakerId, stateMachine.state().name(), mailbox.size(),
                mailboxCapacity, outstandingVerdicts, pendingRecognitions, bufferedSpeechSamples);
    }

    /** Hands finalized segments to the recognition gateway. Runs inside {@code handle}. */
    private final class DispatchingSegmentSink implements SegmentSink {

        @Override
        public void segmentReady(FinalizedSegment segment) {
            metrics.segment(segment.boundary().tag());
            RecognitionRequest request = dispatcher.register(segment, clock.instant())
                    .withContext(context.prompt(), context.history());
            long id = request.correlationId();
            LOG.debug("Dispatching segment {} ({} samples, {})", id, segment.length(), segment.boundary().tag());
            CompletableFuture<RecognitionResponse> future;
            try {
                future = recognitionGateway.recognize(request);
            } catch (RuntimeException e) {
                dispatcher.fail(id);
                logThrottled("recognition-failure", "Recognition gateway rejected segment {}: {}", id, e.toString());
                releaseTranscripts();
                return;
            }
            future.whenComplete((response, ex) -> {
                if (ex != null) {
                    post(new StreamMessage.RecognitionFailure(id, ex));
                } else {
                    post(new StreamMessage.Recognition(response));
                }
            });
        }

        @Override
        public void utteranceDiscarded(int samples) {
            metrics.utteranceDiscarded();
            LOG.debug("Discarded {} samples of speech below the minimum duration", samples);
        }
    }

    /**
     * Builder for {@link AudioStream}. Stream id, properties, both gateways, sink, clock and
     * executor are required.
     */
    public static final class Builder {
        private String streamId;
        private String speakerId;
        private String sessionId;
        private boolean diarization;
        private SegmentationProperties properties;
        private VadGateway vadGateway;
        private RecognitionGateway recognitionGateway;
        private TranscriptSink sink;
        private SegmentationMetricsPublisher metrics;
        private Clock clock;
        private Executor executor;
        private DiagnosticsThrottle throttle;
        private ConversationContext context;

        private Builder() {}

        public Builder streamId(String streamId) { this.streamId = streamId; return this; }
        public Builder speakerId(String speakerId) { this.speakerId = speakerId; return this; }
        public Builder sessionId(String sessionId) { this.sessionId = sessionId; return this; }
        public Builder diarization(boolean diarization) { this.diarization = diarization; return this; }
        public Builder properties(SegmentationProperties properties) { this.properties = properties; return this; }
        public Builder vadGateway(VadGateway vadGateway) { this.vadGateway = vadGateway; return this; }
        public Builder recognitionGateway(RecognitionGateway gateway) { this.recognitionGateway = gateway; return this; }
        public Builder sink(TranscriptSink sink) { this.sink = sink; return this; }
        public Builder metrics(SegmentationMetricsPublisher metrics) { this.metrics = metrics; return this; }
        public Builder clock(Clock clock) { this.clock = clock; return this; }
        public Builder executor(Executor executor) { this.executor = executor; return this; }
        public Builder throttle(DiagnosticsThrottle throttle) { this.throttle = throttle; return this; }
        public Builder context(ConversationContext context) { this.context = context; return this; }

        public AudioStream build() {
            requireNonNull(streamId, "streamId");
            requireNonNull(properties, "properties");
            requireNonNull(vadGateway, "vadGateway");
            requireNonNull(recognitionGateway, "recognitionGateway");
            requireNonNull(sink, "sink");
            requireNonNull(clock, "clock");
            requireNonNull(executor, "executor");
            return new AudioStream(this);
        }

        private static void requireNonNull(Object value, String name) {
            if (value == null) {
                throw new IllegalStateException(name + " is required");
            }
        }
    }
}
