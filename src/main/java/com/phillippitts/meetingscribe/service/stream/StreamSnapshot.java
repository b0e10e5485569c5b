package com.phillippitts.meetingscribe.service.stream;

/**
 * Point-in-time view of a stream for health checks and the REST surface.
 *
 * @param streamId             stream identity
 * @param speakerId            fixed speaker, or null for the mixed stream
 * @param state                IDLE or ACCUMULATING
 * @param mailboxSize          queued messages
 * @param mailboxCapacity      mailbox bound
 * @param outstandingVerdicts  voice-activity requests without a verdict
 * @param pendingRecognitions  segments in the reorder buffer
 * @param bufferedSpeechSamples samples in the current utterance
 */
public record StreamSnapshot(
        String streamId,
        String speakerId,
        String state,
        int mailboxSize,
        int mailboxCapacity,
        int outstandingVerdicts,
        int pendingRecognitions,
        int bufferedSpeechSamples
) {

    public double mailboxFill() {
        return mailboxCapacity == 0 ? 0.0 : (double) mailboxSize / mailboxCapacity;
    }
}
