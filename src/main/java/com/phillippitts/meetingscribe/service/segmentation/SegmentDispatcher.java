package com.phillippitts.meetingscribe.service.segmentation;

import com.phillippitts.meetingscribe.domain.TranscriptionSegment;
import com.phillippitts.meetingscribe.service.gateway.RecognitionRequest;
import com.phillippitts.meetingscribe.service.gateway.RecognitionResponse;
import com.phillippitts.meetingscribe.util.TimeUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns finalized segments into recognition requests and releases the replies in dispatch
 * order.
 *
 * <p>The recognition id doubles as the dispatch sequence number and has its own id-space,
 * independent of packet ids. Replies are held in a reorder buffer until every lower sequence
 * has been released. A slot is released as a gap marker when its reply is malformed, its
 * gateway call failed, or it has been waiting at the head of the buffer for the reorder
 * timeout. Replies for unknown or already-released ids are rejected.
 *
 * <p>Recognizer-reported times are offsets into the submitted audio and are shifted by the
 * segment's stream offset; without them the segment's own span is used.
 *
 * <p>Not thread-safe; owned by a single {@code AudioStream}.
 */
public final class SegmentDispatcher {

    private final String streamId;
    private final String speakerId;
    private final boolean diarization;
    private final int sampleRate;
    private final Duration reorderTimeout;
    private final TreeMap<Long, Slot> slots = new TreeMap<>();
    private long nextSequence = 1;

    /**
     * @param speakerId   fixed speaker of the stream (individual mode) or null (mixed mode,
     *                    the recognizer's label is used)
     * @param diarization whether requests ask the recognizer to label speakers
     */
    public SegmentDispatcher(String streamId, String speakerId, boolean diarization,
                             int sampleRate, Duration reorderTimeout) {
        this.streamId = streamId;
        this.speakerId = speakerId;
        this.diarization = diarization;
        this.sampleRate = sampleRate;
        this.reorderTimeout = reorderTimeout;
    }

    public RecognitionRequest register(FinalizedSegment segment, Instant now) {
        long sequence = nextSequence++;
        slots.put(sequence, new Slot(segment.startSeconds(sampleRate), segment.endSeconds(sampleRate), now));
        return new RecognitionRequest(streamId, sequence, segment.samples(), sampleRate,
                segment.timestamp(), diarization, speakerId);
    }

    /**
     * Records a reply.
     *
     * @return false if no slot is waiting for this id (unknown, duplicate, or already released)
     */
    public boolean accept(RecognitionResponse response, Instant now) {
        Slot slot = slots.get(response.correlationId());
        if (slot == null || slot.released != null) {
            return false;
        }
        long seq = response.correlationId();
        if (response.isMalformed()) {
            slot.released = gap(seq, slot);
            return true;
        }
        double start = slot.start;
        double end = slot.end;
        if (response.hasTimes()) {
            start = slot.start + response.startSeconds();
            end = slot.start + response.endSeconds();
        }
        String speaker = speakerId != null ? speakerId : response.speakerId();
        double confidence = Math.max(0.0, Math.min(1.0, response.confidence()));
        if (Double.isNaN(confidence)) {
            confidence = 0.0;
        }
        slot.released = new TranscriptionSegment(streamId, speaker, response.text(), confidence,
                start, end, seq, false);
        return true;
    }

    /**
     * Marks a slot whose gateway call failed as a gap.
     *
     * @return false if the id is not waiting
     */
    public boolean fail(long correlationId) {
        Slot slot = slots.get(correlationId);
        if (slot == null || slot.released != null) {
            return false;
        }
        slot.released = gap(correlationId, slot);
        return true;
    }

    /**
     * Gap-marks the head of the reorder buffer, and any following slots, while they have
     * waited at least the reorder timeout.
     *
     * @return number of slots gap-marked
     */
    public int expireHead(Instant now) {
        int expired = 0;
        for (Map.Entry<Long, Slot> e : slots.entrySet()) {
            Slot slot = e.getValue();
            if (slot.released != null) {
                continue;
            }
            if (!TimeUtils.hasElapsed(slot.dispatchedAt, now, reorderTimeout)) {
                break;
            }
            slot.released = gap(e.getKey(), slot);
            expired++;
        }
        return expired;
    }

    /**
     * Removes and returns the releasable prefix in dispatch order, gap markers included.
     */
    public List<TranscriptionSegment> drainReady() {
        if (slots.isEmpty()) {
            return Collections.emptyList();
        }
        List<TranscriptionSegment> ready = new ArrayList<>();
        while (!slots.isEmpty() && slots.firstEntry().getValue().released != null) {
            ready.add(slots.pollFirstEntry().getValue().released);
        }
        return ready;
    }

    /** Time the slot has been waiting, or null if the id is not waiting. */
    public Duration age(long correlationId, Instant now) {
        Slot slot = slots.get(correlationId);
        if (slot == null || slot.released != null) {
            return null;
        }
        return Duration.between(slot.dispatchedAt, now);
    }

    public int pending() {
        return slots.size();
    }

    /** Cancels all in-flight slots; their replies are rejected from now on. */
    public void clear() {
        slots.clear();
    }

    private TranscriptionSegment gap(long sequence, Slot slot) {
        return TranscriptionSegment.gap(streamId, speakerId, slot.start, slot.end, sequence);
    }

    private static final class Slot {
        private final double start;
        private final double end;
        private final Instant dispatchedAt;
        private TranscriptionSegment released;

        private Slot(double start, double end, Instant dispatchedAt) {
            this.start = start;
            this.end = end;
            this.dispatchedAt = dispatchedAt;
        }
    }
}
