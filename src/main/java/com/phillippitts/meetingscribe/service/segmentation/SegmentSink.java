package com.phillippitts.meetingscribe.service.segmentation;

/**
 * Receives the output of a {@link SpeechSegmentStateMachine}.
 */
public interface SegmentSink {

    void segmentReady(FinalizedSegment segment);

    /** An utterance shorter than the minimum speech duration was dropped. */
    default void utteranceDiscarded(int samples) {
    }
}
