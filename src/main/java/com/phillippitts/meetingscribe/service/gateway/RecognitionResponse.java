package com.phillippitts.meetingscribe.service.gateway;

/**
 * Speech-recognition reply.
 *
 * @param correlationId id of the request this reply answers
 * @param text          recognized text; null marks a malformed reply
 * @param speakerId     diarized speaker label, or null
 * @param confidence    recognizer confidence, clamped to [0, 1] downstream
 * @param startSeconds  start as an offset into the submitted segment audio, or null
 * @param endSeconds    end as an offset into the submitted segment audio, or null
 */
public record RecognitionResponse(
        long correlationId,
        String text,
        String speakerId,
        double confidence,
        Double startSeconds,
        Double endSeconds
) {

    public static RecognitionResponse of(long correlationId, String text, String speakerId, double confidence) {
        return new RecognitionResponse(correlationId, text, speakerId, confidence, null, null);
    }

    public boolean isMalformed() {
        return text == null;
    }

    public boolean hasTimes() {
        return startSeconds != null && endSeconds != null && endSeconds >= startSeconds;
    }
}
