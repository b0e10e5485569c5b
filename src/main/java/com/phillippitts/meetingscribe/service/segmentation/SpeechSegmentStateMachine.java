package com.phillippitts.meetingscribe.service.segmentation;

import com.phillippitts.meetingscribe.config.properties.SegmentationProperties;
import com.phillippitts.meetingscribe.util.TimeUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

/**
 * Speech/silence state machine for one stream.
 *
 * <p>Driven by verdicts in packet order:
 * <ul>
 *   <li>speech: append the packet to the speech buffer, note the time of the verdict, enter
 *       {@link State#ACCUMULATING}. When the buffer reaches the segment target, a segment of
 *       exactly the target length is emitted and the excess starts the next one. When the
 *       buffer reaches its capacity (the overflow maximum), everything is emitted regardless
 *       of the minimum duration.</li>
 *   <li>non-speech: never appended. Once the silence timeout has elapsed since the last
 *       speech verdict, the utterance is finalized: emitted if at least the minimum speech
 *       duration long, otherwise discarded. Shorter pauses keep the utterance open.</li>
 * </ul>
 * {@link #onTick()} applies the same silence check without a verdict, for streams whose input
 * simply stopped.
 *
 * <p>The speech buffer is a fixed array sized to the overflow maximum and reused for the
 * lifetime of the stream. Not thread-safe; owned by a single {@code AudioStream}.
 */
public final class SpeechSegmentStateMachine {

    public enum State { IDLE, ACCUMULATING }

    private final short[] buffer;
    private final int targetSamples;
    private final int minSpeechSamples;
    private final Duration silenceTimeout;
    private final int sampleRate;
    private final Clock clock;
    private final SegmentSink sink;

    private volatile State state = State.IDLE;
    private int size;
    private long startOffset;
    private long lastSampleEnd;
    private Instant startTimestamp;
    private Instant lastSpeechAt;

    public SpeechSegmentStateMachine(SegmentationProperties properties, Clock clock, SegmentSink sink) {
        this(properties.segmentTargetSamples(), properties.minSpeechSamples(), properties.overflowMaxSamples(),
                properties.silenceTimeout(), properties.getSampleRate(), clock, sink);
    }

    SpeechSegmentStateMachine(int targetSamples, int minSpeechSamples, int overflowMaxSamples,
                              Duration silenceTimeout, int sampleRate, Clock clock, SegmentSink sink) {
        if (overflowMaxSamples <= 0) {
            throw new IllegalArgumentException("overflowMaxSamples must be positive");
        }
        this.buffer = new short[overflowMaxSamples];
        this.targetSamples = targetSamples;
        this.minSpeechSamples = minSpeechSamples;
        this.silenceTimeout = silenceTimeout;
        this.sampleRate = sampleRate;
        this.clock = clock;
        this.sink = sink;
    }

    public void onVerdict(ResolvedVerdict verdict) {
        if (verdict.speech()) {
            append(verdict.packet());
            lastSpeechAt = clock.instant();
            state = State.ACCUMULATING;
        } else if (state == State.ACCUMULATING
                && TimeUtils.hasElapsed(lastSpeechAt, clock.instant(), silenceTimeout)) {
            finalizeUtterance();
        }
    }

    /**
     * Finalizes the utterance if the silence timeout has elapsed since the last speech verdict.
     *
     * @return true if the utterance was finalized
     */
    public boolean onTick() {
        if (state == State.ACCUMULATING
                && TimeUtils.hasElapsed(lastSpeechAt, clock.instant(), silenceTimeout)) {
            finalizeUtterance();
            return true;
        }
        return false;
    }

    private void append(AudioPacket packet) {
        short[] samples = packet.samples();
        if (size == 0) {
            startOffset = packet.startOffset();
            startTimestamp = packet.captureTimestamp();
        }
        int pos = 0;
        while (pos < samples.length) {
            int n = Math.min(samples.length - pos, buffer.length - size);
            System.arraycopy(samples, pos, buffer, size, n);
            size += n;
            pos += n;
            long consumedEnd = packet.startOffset() + pos;
            lastSampleEnd = consumedEnd;

            if (targetSamples > 0 && size >= targetSamples) {
                int excess = size - targetSamples;
                emit(targetSamples, consumedEnd - excess, SegmentBoundary.TARGET);
                carryOver(excess, packet, pos);
            } else if (size == buffer.length) {
                emit(size, consumedEnd, SegmentBoundary.OVERFLOW);
                carryOver(0, packet, pos);
            }
        }
    }

    /** Moves the last {@code excess} samples to the front; they start the next segment. */
    private void carryOver(int excess, AudioPacket packet, int pos) {
        if (excess > 0) {
            System.arraycopy(buffer, size - excess, buffer, 0, excess);
        }
        size = excess;
        int firstCarried = pos - excess;
        startOffset = packet.startOffset() + firstCarried;
        startTimestamp = TimeUtils.plusSamples(packet.captureTimestamp(), firstCarried, sampleRate);
    }

    private void emit(int length, long endOffset, SegmentBoundary boundary) {
        short[] samples = Arrays.copyOf(buffer, length);
        sink.segmentReady(new FinalizedSegment(samples, startOffset, endOffset, boundary, startTimestamp));
    }

    private void finalizeUtterance() {
        if (size > 0) {
            if (size >= minSpeechSamples) {
                emit(size, lastSampleEnd, SegmentBoundary.SILENCE);
            } else {
                sink.utteranceDiscarded(size);
            }
        }
        reset();
    }

    /** Drops the in-progress utterance without emitting it. */
    public void reset() {
        size = 0;
        startTimestamp = null;
        lastSpeechAt = null;
        state = State.IDLE;
    }

    public State state() {
        return state;
    }

    /** Speech samples currently buffered. */
    public int bufferedSamples() {
        return size;
    }

    public int capacity() {
        return buffer.length;
    }
}
