package com.phillippitts.meetingscribe.service.stream;

import com.phillippitts.meetingscribe.config.properties.SegmentationProperties;
import com.phillippitts.meetingscribe.domain.TranscriptionSegment;
import com.phillippitts.meetingscribe.exception.GatewayException;
import com.phillippitts.meetingscribe.service.gateway.RecognitionRequest;
import com.phillippitts.meetingscribe.service.gateway.RecognitionResponse;
import com.phillippitts.meetingscribe.service.metrics.SegmentationMetrics;
import com.phillippitts.meetingscribe.service.metrics.SegmentationMetricsPublisher;
import com.phillippitts.meetingscribe.service.output.TranscriptSink;
import com.phillippitts.meetingscribe.testutil.CapturingTranscriptSink;
import com.phillippitts.meetingscribe.testutil.MutableClock;
import com.phillippitts.meetingscribe.testutil.ScriptedRecognitionGateway;
import com.phillippitts.meetingscribe.testutil.ScriptedVadGateway;
import com.phillippitts.meetingscribe.testutil.SyncExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.phillippitts.meetingscribe.testutil.AudioFixtures.PACKET;
import static com.phillippitts.meetingscribe.testutil.AudioFixtures.T0;
import static com.phillippitts.meetingscribe.testutil.AudioFixtures.constant;
import static com.phillippitts.meetingscribe.testutil.AudioFixtures.frame;
import static com.phillippitts.meetingscribe.testutil.AudioFixtures.ramp;
import static org.assertj.core.api.Assertions.assertThat;

class AudioStreamTest {

    private static final String ID = "alice";

    private MutableClock clock;
    private ScriptedVadGateway vad;
    private ScriptedRecognitionGateway recognition;
    private CapturingTranscriptSink sink;
    private MeterRegistry registry;
    private long seq;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        vad = new ScriptedVadGateway();
        recognition = new ScriptedRecognitionGateway();
        sink = new CapturingTranscriptSink();
        registry = new SimpleMeterRegistry();
    }

    private AudioStream stream(SegmentationProperties props) {
        return stream(props, new SyncExecutor(), sink);
    }

    private AudioStream stream(SegmentationProperties props, Executor executor, TranscriptSink out) {
        return AudioStream.builder()
                .streamId(ID)
                .speakerId(ID)
                .sessionId("s-1")
                .properties(props)
                .vadGateway(vad)
                .recognitionGateway(recognition)
                .sink(out)
                .metrics(new SegmentationMetricsPublisher(new SegmentationMetrics(registry)))
                .clock(clock)
                .executor(executor)
                .build();
    }

    private void send(AudioStream stream, short[] samples) {
        stream.post(new StreamMessage.Frame(frame(ID, samples, ++seq)));
    }

    private void speech(long from, long to) {
        for (long id = from; id <= to; id++) {
            vad.speech(ID, id);
        }
    }

    private double counter(String name, String tag, String value) {
        var c = registry.find("meetingscribe.segmentation." + name).tag(tag, value).counter();
        return c == null ? 0 : c.count();
    }

    @Test
    void speechFollowedBySilenceIsRecognizedAndDelivered() {
        AudioStream stream = stream(SegmentationProperties.defaults());

        send(stream, constant(1000, 6 * PACKET));
        assertThat(vad.requests()).hasSize(6);
        speech(1, 6);
        clock.advanceMillis(1_000);
        send(stream, constant(0, PACKET));
        vad.silence(ID, 7);

        assertThat(recognition.requests()).singleElement().satisfies(r -> {
            assertThat(r.correlationId()).isEqualTo(1L);
            assertThat(r.samples()).hasSize(6 * PACKET);
            assertThat(r.speakerId()).isEqualTo(ID);
        });
        recognition.reply(ID, 1, "hello there");

        assertThat(sink.segments()).singleElement().satisfies(s -> {
            assertThat(s.text()).isEqualTo("hello there");
            assertThat(s.speakerId()).isEqualTo(ID);
            assertThat(s.startSeconds()).isEqualTo(0.0);
            assertThat(s.endSeconds()).isEqualTo(0.6);
        });
        assertThat(counter("released", "outcome", "delivered")).isEqualTo(1.0);
        assertThat(registry.find("meetingscribe.segmentation.recognition.latency").timer().count()).isEqualTo(1);
    }

    @Test
    void shortUtteranceNeverReachesRecognition() {
        AudioStream stream = stream(SegmentationProperties.defaults());

        send(stream, constant(1000, 4 * PACKET));
        speech(1, 4);
        clock.advanceMillis(1_000);
        send(stream, constant(0, PACKET));
        vad.silence(ID, 5);

        assertThat(recognition.requests()).isEmpty();
        assertThat(registry.find("meetingscribe.segmentation.discarded").counter().count()).isEqualTo(1.0);
    }

    @Test
    void verdictsAreAppliedInPacketOrder() {
        AudioStream stream = stream(SegmentationProperties.builder().minSpeechMs(100).build());

        send(stream, ramp(0, 2 * PACKET));
        vad.speech(ID, 2);
        vad.speech(ID, 1);
        clock.advanceMillis(1_000);
        stream.postTick();

        RecognitionRequest request = recognition.requests().get(0);
        for (int i = 0; i < request.samples().length; i++) {
            assertThat(request.samples()[i]).isEqualTo((short) i);
        }
    }

    @Test
    void tickFinalizesSilenceWhenInputStops() {
        AudioStream stream = stream(SegmentationProperties.defaults());
        send(stream, constant(1000, 6 * PACKET));
        speech(1, 6);

        clock.advanceMillis(999);
        stream.postTick();
        assertThat(recognition.requests()).isEmpty();

        clock.advanceMillis(1);
        stream.postTick();
        assertThat(recognition.requests()).hasSize(1);
    }

    @Test
    void tickDoesNotFinalizeWhileVerdictsAreOutstanding() {
        AudioStream stream = stream(SegmentationProperties.builder().verdictTimeoutMs(5_000).build());
        send(stream, constant(1000, 7 * PACKET));
        speech(1, 6);

        clock.advanceMillis(1_000);
        stream.postTick();
        assertThat(recognition.requests()).isEmpty();

        vad.silence(ID, 7);
        assertThat(recognition.requests()).hasSize(1);
    }

    @Test
    void lostVerdictTimesOutAsNonSpeech() {
        AudioStream stream = stream(SegmentationProperties.defaults());
        send(stream, constant(1000, 7 * PACKET));
        speech(1, 6);

        clock.advanceMillis(1_000);
        stream.postTick();

        assertThat(counter("verdicts", "outcome", "timeout")).isEqualTo(1.0);
        assertThat(recognition.requests()).hasSize(1);
        vad.speech(ID, 7);
        assertThat(counter("verdicts", "outcome", "unmatched")).isEqualTo(1.0);
    }

    @Test
    void failedVerdictCountsAsNonSpeech() {
        AudioStream stream = stream(SegmentationProperties.defaults());
        send(stream, constant(1000, PACKET));

        vad.fail(ID, 1, new GatewayException("down", "vad"));

        assertThat(counter("verdicts", "outcome", "failed")).isEqualTo(1.0);
        assertThat(stream.snapshot().outstandingVerdicts()).isZero();
    }

    @Test
    void outOfOrderRecognitionRepliesAreDeliveredInDispatchOrder() {
        AudioStream stream = stream(SegmentationProperties.builder().segmentTargetMs(200).minSpeechMs(100).build());
        send(stream, constant(1000, 6 * PACKET));
        speech(1, 6);
        assertThat(recognition.requests()).hasSize(3);

        recognition.reply(ID, 3, "three");
        recognition.reply(ID, 2, "two");
        assertThat(sink.segments()).isEmpty();
        recognition.reply(ID, 1, "one");

        assertThat(sink.texts()).containsExactly("one", "two", "three");
        assertThat(sink.segments()).extracting(TranscriptionSegment::sequence).containsExactly(1L, 2L, 3L);
    }

    @Test
    void failedRecognitionIsDeliveredAsGap() {
        AudioStream stream = stream(SegmentationProperties.builder().segmentTargetMs(200).build());
        send(stream, constant(1000, 4 * PACKET));
        speech(1, 4);

        recognition.fail(ID, 1, new GatewayException("timeout", "recognition"));
        recognition.reply(ID, 2, "later");

        assertThat(sink.segments()).satisfiesExactly(
                gap -> assertThat(gap.gap()).isTrue(),
                next -> assertThat(next.text()).isEqualTo("later"));
        assertThat(counter("released", "outcome", "gap")).isEqualTo(1.0);
    }

    @Test
    void reorderTimeoutReleasesGap() {
        AudioStream stream = stream(SegmentationProperties.builder().segmentTargetMs(200).build());
        send(stream, constant(1000, 2 * PACKET));
        speech(1, 2);

        clock.advanceMillis(15_000);
        stream.postTick();

        assertThat(sink.segments()).singleElement().extracting(TranscriptionSegment::gap).isEqualTo(true);
        recognition.reply(ID, 1, "too late");
        assertThat(sink.segments()).hasSize(1);
        assertThat(counter("released", "outcome", "unmatched")).isEqualTo(1.0);
    }

    @Test
    void blankTextIsNotForwarded() {
        AudioStream stream = stream(SegmentationProperties.builder().segmentTargetMs(200).build());
        send(stream, constant(1000, 4 * PACKET));
        speech(1, 4);

        recognition.reply(ID, 1, "   ");
        recognition.reply(ID, 2, "words");

        assertThat(sink.texts()).containsExactly("words");
        assertThat(counter("released", "outcome", "empty")).isEqualTo(1.0);
    }

    @Test
    void sinkFailureDoesNotStopLaterSegments() {
        List<TranscriptionSegment> delivered = new ArrayList<>();
        TranscriptSink flaky = s -> {
            if (s.sequence() == 1) {
                throw new IllegalStateException("sink down");
            }
            delivered.add(s);
        };
        AudioStream stream = stream(SegmentationProperties.builder().segmentTargetMs(200).build(), new SyncExecutor(), flaky);
        send(stream, constant(1000, 4 * PACKET));
        speech(1, 4);

        recognition.reply(ID, 1, "lost");
        recognition.reply(ID, 2, "kept");

        assertThat(delivered).extracting(TranscriptionSegment::text).containsExactly("kept");
    }

    @Test
    void nothingIsEmittedAfterRelease() {
        AudioStream stream = stream(SegmentationProperties.builder().segmentTargetMs(200).build());
        send(stream, constant(1000, 4 * PACKET));
        speech(1, 2);

        stream.release();
        recognition.reply(ID, 1, "ghost");
        speech(3, 4);
        stream.postTick();

        assertThat(sink.segments()).isEmpty();
        assertThat(recognition.requests()).hasSize(1);
        assertThat(stream.isReleased()).isTrue();
        assertThat(stream.post(new StreamMessage.Frame(frame(ID, constant(1, PACKET), 99)))).isFalse();
        assertThat(stream.snapshot().state()).isEqualTo("IDLE");
    }

    @Test
    void releaseIsIdempotent() {
        AudioStream stream = stream(SegmentationProperties.defaults());

        stream.release();
        stream.release();

        assertThat(stream.isReleased()).isTrue();
    }

    @Test
    void fullMailboxDropsMessagesWithoutBlocking() {
        List<Runnable> parked = new ArrayList<>();
        AudioStream stream = stream(SegmentationProperties.builder().mailboxCapacity(16).build(), parked::add, sink);

        for (int i = 0; i < 16; i++) {
            assertThat(stream.post(new StreamMessage.Frame(frame(ID, constant(1, 160), i)))).isTrue();
        }
        assertThat(stream.post(new StreamMessage.Frame(frame(ID, constant(1, 160), 16)))).isFalse();

        assertThat(parked).hasSize(1);
        assertThat(counter("dropped", "type", "Frame")).isEqualTo(1.0);
        assertThat(stream.snapshot().mailboxSize()).isEqualTo(16);
        assertThat(stream.snapshot().mailboxFill()).isEqualTo(1.0);

        parked.get(0).run();
        assertThat(stream.snapshot().mailboxSize()).isZero();
        assertThat(vad.requests()).hasSize(1);
    }

    @Test
    void ticksAreCoalesced() {
        List<Runnable> parked = new ArrayList<>();
        AudioStream stream = stream(SegmentationProperties.defaults(), parked::add, sink);

        stream.postTick();
        stream.postTick();
        stream.postTick();

        assertThat(stream.snapshot().mailboxSize()).isEqualTo(1);
    }

    @Test
    void rejectedDrainStaysQueuedUntilTheNextTick() {
        AtomicBoolean saturated = new AtomicBoolean(true);
        List<String> drainThreads = new ArrayList<>();
        Executor executor = task -> {
            if (saturated.get()) {
                throw new RejectedExecutionException("saturated");
            }
            drainThreads.add("pool");
            task.run();
        };
        AudioStream stream = stream(SegmentationProperties.defaults(), executor, sink);

        assertThat(stream.post(new StreamMessage.Frame(frame(ID, constant(1, PACKET), 1)))).isTrue();
        stream.postTick();

        assertThat(vad.requests()).isEmpty();
        assertThat(stream.snapshot().mailboxSize()).isEqualTo(2);
        assertThat(registry.get("meetingscribe.segmentation.drain.rejected").counter().count()).isEqualTo(2.0);

        saturated.set(false);
        stream.postTick();

        assertThat(drainThreads).containsExactly("pool");
        assertThat(vad.requests()).hasSize(1);
        assertThat(stream.snapshot().mailboxSize()).isZero();
    }

    @Test
    void gatewayThatThrowsIsTreatedAsFailedCall() {
        recognition.autoReply(r -> {
            throw new IllegalStateException("refused");
        });
        AudioStream stream = stream(SegmentationProperties.builder().segmentTargetMs(200).build());
        send(stream, constant(1000, 2 * PACKET));

        speech(1, 2);

        assertThat(sink.segments()).singleElement().extracting(TranscriptionSegment::gap).isEqualTo(true);
    }

    @Test
    void mixedStreamForwardsDiarizedSpeaker() {
        AudioStream stream = AudioStream.builder()
                .streamId(StreamRegistry.MIXED_STREAM_ID)
                .diarization(true)
                .properties(SegmentationProperties.builder().segmentTargetMs(200).build())
                .vadGateway(ScriptedVadGateway.nonZeroIsSpeech())
                .recognitionGateway(recognition.autoReply(r ->
                        RecognitionResponse.of(r.correlationId(), "hi", "SPEAKER_00", 0.8)))
                .sink(sink)
                .clock(clock)
                .executor(new SyncExecutor())
                .build();

        stream.post(new StreamMessage.Frame(frame(null, constant(500, 2 * PACKET), 1)));

        assertThat(recognition.requests()).singleElement().extracting(RecognitionRequest::diarization).isEqualTo(true);
        assertThat(sink.segments()).singleElement().extracting(TranscriptionSegment::speakerId).isEqualTo("SPEAKER_00");
    }
}
