package com.phillippitts.meetingscribe.service.segmentation;

import com.phillippitts.meetingscribe.config.properties.SegmentationProperties;
import com.phillippitts.meetingscribe.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.phillippitts.meetingscribe.testutil.AudioFixtures.PACKET;
import static com.phillippitts.meetingscribe.testutil.AudioFixtures.SAMPLE_RATE;
import static com.phillippitts.meetingscribe.testutil.AudioFixtures.T0;
import static com.phillippitts.meetingscribe.testutil.AudioFixtures.constant;
import static com.phillippitts.meetingscribe.testutil.AudioFixtures.packet;
import static com.phillippitts.meetingscribe.testutil.AudioFixtures.silence;
import static com.phillippitts.meetingscribe.testutil.AudioFixtures.speech;
import static org.assertj.core.api.Assertions.assertThat;

class SpeechSegmentStateMachineTest {

    private final List<FinalizedSegment> emitted = new ArrayList<>();
    private final List<Integer> discarded = new ArrayList<>();
    private final SegmentSink sink = new SegmentSink() {
        @Override
        public void segmentReady(FinalizedSegment segment) {
            emitted.add(segment);
        }

        @Override
        public void utteranceDiscarded(int samples) {
            discarded.add(samples);
        }
    };

    private MutableClock clock;
    private SpeechSegmentStateMachine machine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        machine = new SpeechSegmentStateMachine(SegmentationProperties.defaults(), clock, sink);
    }

    private void speechPackets(int from, int count) {
        for (long id = from; id < from + count; id++) {
            machine.onVerdict(speech(id));
        }
    }

    @Test
    void twentySixSpeechPacketsEmitOneTargetSegmentAndCarryTheRest() {
        speechPackets(1, 26);

        assertThat(emitted).singleElement().satisfies(s -> {
            assertThat(s.length()).isEqualTo(40_000);
            assertThat(s.boundary()).isEqualTo(SegmentBoundary.TARGET);
            assertThat(s.startOffset()).isZero();
            assertThat(s.endOffset()).isEqualTo(40_000);
            assertThat(s.samples()[0]).isEqualTo((short) 1);
            assertThat(s.samples()[39_999]).isEqualTo((short) 25);
        });
        assertThat(machine.bufferedSamples()).isEqualTo(PACKET);
        assertThat(machine.state()).isEqualTo(SpeechSegmentStateMachine.State.ACCUMULATING);
    }

    @Test
    void carriedSamplesStartTheNextSegment() {
        speechPackets(1, 50);

        assertThat(emitted).hasSize(2);
        FinalizedSegment second = emitted.get(1);
        assertThat(second.startOffset()).isEqualTo(40_000);
        assertThat(second.samples()[0]).isEqualTo((short) 26);
        assertThat(second.timestamp()).isEqualTo(T0.plusMillis(2_500));
    }

    @Test
    void shortUtteranceFollowedBySilenceIsDiscarded() {
        speechPackets(1, 4);
        clock.advanceMillis(1_000);

        machine.onVerdict(silence(5));

        assertThat(emitted).isEmpty();
        assertThat(discarded).containsExactly(4 * PACKET);
        assertThat(machine.state()).isEqualTo(SpeechSegmentStateMachine.State.IDLE);
        assertThat(machine.bufferedSamples()).isZero();
    }

    @Test
    void utteranceAboveMinimumIsEmittedOnSilence() {
        speechPackets(1, 6);
        clock.advanceMillis(1_000);

        machine.onVerdict(silence(7));

        assertThat(emitted).singleElement().satisfies(s -> {
            assertThat(s.length()).isEqualTo(9_600);
            assertThat(s.boundary()).isEqualTo(SegmentBoundary.SILENCE);
            assertThat(s.endOffset()).isEqualTo(9_600);
        });
        assertThat(machine.state()).isEqualTo(SpeechSegmentStateMachine.State.IDLE);
    }

    @Test
    void exactlyMinimumDurationIsEmitted() {
        machine.onVerdict(new ResolvedVerdict(packet(1, constant(7, 8_000)), 1.0, VerdictOutcome.SPEECH));
        clock.advanceMillis(1_000);

        machine.onVerdict(silence(2));

        assertThat(emitted).singleElement().extracting(FinalizedSegment::length).isEqualTo(8_000);
        assertThat(discarded).isEmpty();
    }

    @Test
    void oneSampleBelowMinimumIsDiscarded() {
        machine.onVerdict(new ResolvedVerdict(packet(1, constant(7, 7_999)), 1.0, VerdictOutcome.SPEECH));
        clock.advanceMillis(1_000);

        machine.onVerdict(silence(2));

        assertThat(emitted).isEmpty();
        assertThat(discarded).containsExactly(7_999);
    }

    @Test
    void briefPauseKeepsUtteranceOpenAndExcludesNonSpeechSamples() {
        speechPackets(1, 6);
        clock.advanceMillis(500);
        machine.onVerdict(silence(7));
        assertThat(machine.state()).isEqualTo(SpeechSegmentStateMachine.State.ACCUMULATING);

        machine.onVerdict(speech(8));
        clock.advanceMillis(1_000);
        machine.onVerdict(silence(9));

        assertThat(emitted).singleElement().satisfies(s -> {
            assertThat(s.length()).isEqualTo(7 * PACKET);
            assertThat(s.samples()[6 * PACKET]).isEqualTo((short) 8);
            assertThat(s.startOffset()).isZero();
            assertThat(s.endOffset()).isEqualTo(8 * PACKET);
        });
    }

    @Test
    void silenceIsMeasuredFromLastSpeechVerdict() {
        speechPackets(1, 6);
        clock.advanceMillis(900);
        machine.onVerdict(speech(7));
        clock.advanceMillis(900);

        machine.onVerdict(silence(8));

        assertThat(emitted).isEmpty();
        assertThat(machine.state()).isEqualTo(SpeechSegmentStateMachine.State.ACCUMULATING);
    }

    @Test
    void continuousSpeechIsForceEmittedAtOverflowWhenTargetDisabled() {
        SegmentationProperties props = SegmentationProperties.builder().segmentTargetMs(0).build();
        machine = new SpeechSegmentStateMachine(props, clock, sink);

        speechPackets(1, 50);

        assertThat(emitted).singleElement().satisfies(s -> {
            assertThat(s.length()).isEqualTo(80_000);
            assertThat(s.boundary()).isEqualTo(SegmentBoundary.OVERFLOW);
        });
        assertThat(machine.state()).isEqualTo(SpeechSegmentStateMachine.State.ACCUMULATING);
        assertThat(machine.bufferedSamples()).isZero();

        machine.onVerdict(speech(51));
        assertThat(machine.bufferedSamples()).isEqualTo(PACKET);
    }

    @Test
    void overflowSplitsPacketAndIgnoresMinimumDuration() {
        machine = new SpeechSegmentStateMachine(0, 8_000, 4_000, Duration.ofSeconds(1), SAMPLE_RATE, clock, sink);

        speechPackets(1, 3);

        assertThat(emitted).singleElement().satisfies(s -> {
            assertThat(s.length()).isEqualTo(4_000);
            assertThat(s.boundary()).isEqualTo(SegmentBoundary.OVERFLOW);
            assertThat(s.endOffset()).isEqualTo(4_000);
        });
        assertThat(machine.bufferedSamples()).isEqualTo(800);
        assertThat(machine.capacity()).isEqualTo(4_000);
    }

    @Test
    void tickFinalizesWithoutFurtherVerdicts() {
        speechPackets(1, 6);
        clock.advanceMillis(999);
        assertThat(machine.onTick()).isFalse();

        clock.advanceMillis(1);

        assertThat(machine.onTick()).isTrue();
        assertThat(emitted).singleElement().extracting(FinalizedSegment::boundary).isEqualTo(SegmentBoundary.SILENCE);
        assertThat(machine.onTick()).isFalse();
    }

    @Test
    void silenceWhileIdleDoesNothing() {
        clock.advanceMillis(5_000);

        machine.onVerdict(silence(1));

        assertThat(machine.onTick()).isFalse();
        assertThat(emitted).isEmpty();
        assertThat(discarded).isEmpty();
    }

    @Test
    void resetDiscardsInProgressUtterance() {
        speechPackets(1, 10);

        machine.reset();
        clock.advanceMillis(2_000);
        machine.onTick();

        assertThat(emitted).isEmpty();
        assertThat(discarded).isEmpty();
        assertThat(machine.state()).isEqualTo(SpeechSegmentStateMachine.State.IDLE);
    }
}
