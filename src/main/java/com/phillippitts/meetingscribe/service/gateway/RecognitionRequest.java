package com.phillippitts.meetingscribe.service.gateway;

import java.time.Instant;
import java.util.List;

/**
 * Speech-recognition request for one finalized segment.
 *
 * @param streamId      stream that produced the segment
 * @param correlationId recognition id; also the segment's dispatch sequence number
 * @param samples       PCM16 segment samples, at most the overflow maximum long
 * @param sampleRate    sample rate in Hz
 * @param timestamp     capture time of the segment's first sample
 * @param diarization   whether the recognizer should label speakers
 * @param speakerId     known speaker (individual mode), or null
 * @param prompt        recently delivered session text, or empty
 * @param sentHistory   recently delivered session sentences, oldest first
 */
public record RecognitionRequest(
        String streamId,
        long correlationId,
        short[] samples,
        int sampleRate,
        Instant timestamp,
        boolean diarization,
        String speakerId,
        String prompt,
        List<String> sentHistory
) {

    public RecognitionRequest {
        prompt = prompt == null ? "" : prompt;
        sentHistory = sentHistory == null ? List.of() : List.copyOf(sentHistory);
    }

    /** Request without conversation context. */
    public RecognitionRequest(String streamId, long correlationId, short[] samples, int sampleRate,
                              Instant timestamp, boolean diarization, String speakerId) {
        this(streamId, correlationId, samples, sampleRate, timestamp, diarization, speakerId, "", List.of());
    }

    /**
     * Copy of this request carrying the given conversation context.
     */
    public RecognitionRequest withContext(String prompt, List<String> sentHistory) {
        return new RecognitionRequest(streamId, correlationId, samples, sampleRate, timestamp,
                diarization, speakerId, prompt, sentHistory);
    }

    public double durationSeconds() {
        return (double) samples.length / sampleRate;
    }
}
