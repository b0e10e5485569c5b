package com.phillippitts.meetingscribe.domain;

import java.util.Objects;

/**
 * Immutable recognized segment delivered to the output collaborator, in dispatch order per stream.
 *
 * <p>A gap marker ({@code gap == true}) stands in for a segment whose recognition reply was
 * lost, malformed, or timed out; its text is empty and its confidence is zero.
 *
 * @param streamId     stream that produced the audio
 * @param speakerId    speaker label; the stream's participant in individual mode, the recognizer's
 *                     diarized label (or null) in mixed mode
 * @param text         recognized text (empty for gap markers)
 * @param confidence   confidence between 0.0 and 1.0
 * @param startSeconds stream-relative start of the segment audio
 * @param endSeconds   stream-relative end of the segment audio
 * @param sequence     dispatch sequence number within the stream
 * @param gap          whether this is a gap marker
 */
public record TranscriptionSegment(
        String streamId,
        String speakerId,
        String text,
        double confidence,
        double startSeconds,
        double endSeconds,
        long sequence,
        boolean gap
) {

    public TranscriptionSegment {
        Objects.requireNonNull(streamId, "streamId must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        if (endSeconds < startSeconds) {
            throw new IllegalArgumentException("endSeconds must not precede startSeconds");
        }
    }

    /**
     * Creates a gap marker for an unrecoverable recognition slot.
     */
    public static TranscriptionSegment gap(String streamId, String speakerId, double startSeconds,
                                           double endSeconds, long sequence) {
        return new TranscriptionSegment(streamId, speakerId, "", 0.0, startSeconds, endSeconds, sequence, true);
    }

    public double durationSeconds() {
        return endSeconds - startSeconds;
    }
}
