package com.phillippitts.meetingscribe.service.segmentation;

/**
 * What ended a segment. Recorded for metrics and logs only; downstream segments carry the
 * same metadata whatever the boundary.
 */
public enum SegmentBoundary {
    /** Continuous speech reached the fixed segment length. */
    TARGET,
    /** Silence timeout finalized the utterance. */
    SILENCE,
    /** Speech buffer reached its hard capacity. */
    OVERFLOW;

    public String tag() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
