package com.phillippitts.meetingscribe.util;

/** Utility for privacy-safe logging of transcript previews. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Label used for a speaker in logs; mixed streams have no speaker.
     */
    public static String speakerLabel(String speakerId) {
        return (speakerId == null || speakerId.isBlank()) ? "Unknown" : "Speaker " + speakerId;
    }
}
