package com.phillippitts.meetingscribe.service.output;

import com.phillippitts.meetingscribe.domain.TranscriptionSegment;

import java.time.Instant;

/**
 * Published for every segment released by a stream, gap markers included.
 *
 * @param sessionId session the stream belongs to (null outside a session)
 * @param segment   the released segment
 * @param timestamp when the segment was released
 */
public record SegmentTranscribedEvent(
        String sessionId,
        TranscriptionSegment segment,
        Instant timestamp
) {}
