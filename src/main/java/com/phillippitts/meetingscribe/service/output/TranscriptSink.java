package com.phillippitts.meetingscribe.service.output;

import com.phillippitts.meetingscribe.domain.TranscriptionSegment;

/**
 * Output collaborator receiving transcription segments.
 *
 * <p>Called from a stream's processing thread, in dispatch order per stream; streams are not
 * ordered relative to each other. Implementations should return quickly. An exception thrown
 * here is logged by the stream and does not affect later segments.
 */
@FunctionalInterface
public interface TranscriptSink {

    void accept(TranscriptionSegment segment);
}
