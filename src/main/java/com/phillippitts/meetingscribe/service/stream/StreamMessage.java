package com.phillippitts.meetingscribe.service.stream;

import com.phillippitts.meetingscribe.domain.AudioFrame;
import com.phillippitts.meetingscribe.service.gateway.RecognitionResponse;
import com.phillippitts.meetingscribe.service.gateway.VadResponse;

/**
 * Messages accepted by an {@link AudioStream} mailbox. Every mutation of a stream's state
 * is one of these, handled on the stream's single logical writer.
 */
public interface StreamMessage {

    /** Raw audio from the platform. */
    record Frame(AudioFrame frame) implements StreamMessage {}

    /** Voice-activity reply. */
    record Verdict(VadResponse response) implements StreamMessage {}

    /** Voice-activity call for a packet completed exceptionally. */
    record VerdictFailure(long correlationId, Throwable cause) implements StreamMessage {}

    /** Recognition reply. */
    record Recognition(RecognitionResponse response) implements StreamMessage {}

    /** Recognition call for a segment completed exceptionally. */
    record RecognitionFailure(long correlationId, Throwable cause) implements StreamMessage {}

    /** Timer sweep: expire verdicts, finalize silence, time out the reorder head. */
    record Tick() implements StreamMessage {
        static final Tick INSTANCE = new Tick();
    }
}
