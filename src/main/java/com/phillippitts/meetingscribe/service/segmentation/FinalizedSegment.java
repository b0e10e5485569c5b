package com.phillippitts.meetingscribe.service.segmentation;

import com.phillippitts.meetingscribe.util.TimeUtils;

import java.time.Instant;

/**
 * Speech audio ready for recognition.
 *
 * <p>{@code samples} is the concatenation of the speech-verdicted packets of the utterance
 * (non-speech packets inside a brief pause are not included), so {@code endOffset - startOffset}
 * may exceed {@code samples.length}.
 *
 * @param samples     segment audio, owned by the segment
 * @param startOffset stream offset of the first sample
 * @param endOffset   stream offset just past the last sample
 * @param boundary    what ended the segment
 * @param timestamp   capture time of the first sample
 */
public record FinalizedSegment(short[] samples, long startOffset, long endOffset,
                               SegmentBoundary boundary, Instant timestamp) {

    public int length() {
        return samples.length;
    }

    public double startSeconds(int sampleRate) {
        return TimeUtils.samplesToSeconds(startOffset, sampleRate);
    }

    public double endSeconds(int sampleRate) {
        return TimeUtils.samplesToSeconds(endOffset, sampleRate);
    }
}
