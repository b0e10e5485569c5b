package com.phillippitts.meetingscribe.service.output;

import com.phillippitts.meetingscribe.domain.TranscriptionSegment;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;

/**
 * Default sink: republishes segments as {@link SegmentTranscribedEvent}s on the Spring event bus,
 * where formatting and persistence collaborators subscribe.
 */
public class EventPublishingTranscriptSink implements TranscriptSink {

    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public EventPublishingTranscriptSink(ApplicationEventPublisher publisher, Clock clock) {
        this.publisher = publisher;
        this.clock = clock;
    }

    @Override
    public void accept(TranscriptionSegment segment) {
        String sessionId = ThreadContext.get("sessionId");
        if (sessionId != null && sessionId.isEmpty()) {
            sessionId = null;
        }
        publisher.publishEvent(new SegmentTranscribedEvent(sessionId, segment, clock.instant()));
    }
}
