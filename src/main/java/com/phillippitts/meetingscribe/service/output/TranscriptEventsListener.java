package com.phillippitts.meetingscribe.service.output;

import com.phillippitts.meetingscribe.domain.TranscriptionSegment;
import com.phillippitts.meetingscribe.util.DiagnosticsThrottle;
import com.phillippitts.meetingscribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs released segments. Transcript text is truncated; gap markers are throttled per stream.
 */
@Component
class TranscriptEventsListener {

    private static final Logger LOG = LogManager.getLogger(TranscriptEventsListener.class);
    private static final int PREVIEW_CHARS = 120;

    private final DiagnosticsThrottle throttle = new DiagnosticsThrottle();

    @EventListener
    void onSegmentTranscribed(SegmentTranscribedEvent e) {
        TranscriptionSegment s = e.segment();
        if (s.gap()) {
            if (throttle.shouldLog("gap-" + s.streamId())) {
                LOG.warn("Transcript gap: stream={}, seq={}, span=[{}s, {}s]",
                        s.streamId(), s.sequence(), format(s.startSeconds()), format(s.endSeconds()));
            }
            return;
        }
        LOG.info("[{}s - {}s] {}: {}", format(s.startSeconds()), format(s.endSeconds()),
                LogSanitizer.speakerLabel(s.speakerId()), LogSanitizer.truncate(s.text(), PREVIEW_CHARS));
    }

    private static String format(double seconds) {
        return String.format("%.2f", seconds);
    }
}
