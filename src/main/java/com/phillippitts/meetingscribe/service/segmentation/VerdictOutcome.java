package com.phillippitts.meetingscribe.service.segmentation;

/**
 * How a packet's voice-activity verdict was obtained.
 */
public enum VerdictOutcome {
    SPEECH,
    NON_SPEECH,
    /** No reply within the verdict timeout; treated as non-speech. */
    TIMEOUT,
    /** Pushed out by the outstanding-request bound; treated as non-speech. */
    EVICTED,
    /** Gateway future failed; treated as non-speech. */
    FAILED;

    public String tag() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
