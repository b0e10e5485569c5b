package com.phillippitts.meetingscribe.service.segmentation;

/**
 * A packet together with its final voice-activity verdict.
 */
public record ResolvedVerdict(AudioPacket packet, double confidence, VerdictOutcome outcome) {

    public boolean speech() {
        return outcome == VerdictOutcome.SPEECH;
    }
}
