package com.phillippitts.meetingscribe.domain;

import com.phillippitts.meetingscribe.exception.InvalidAudioException;
import com.phillippitts.meetingscribe.service.audio.PcmCodec;

import java.time.Instant;
import java.util.Objects;

/**
 * One raw PCM frame as delivered by the meeting platform.
 *
 * <p>Frames arrive at an irregular cadence (typically 20-40 ms) and are not aligned to
 * packet boundaries.
 *
 * @param participantId    platform participant that produced the frame; null when the
 *                         platform only supplies mixed audio
 * @param samples          PCM16 mono samples (never empty)
 * @param sampleRate       sample rate in Hz
 * @param captureTimestamp capture time of the first sample
 * @param sequence         arrival sequence number assigned by the platform collaborator
 */
public record AudioFrame(
        String participantId,
        short[] samples,
        int sampleRate,
        Instant captureTimestamp,
        long sequence
) {

    public AudioFrame {
        Objects.requireNonNull(samples, "samples must not be null");
        Objects.requireNonNull(captureTimestamp, "captureTimestamp must not be null");
        if (samples.length == 0) {
            throw new InvalidAudioException("frame is empty");
        }
        if (sampleRate <= 0) {
            throw new InvalidAudioException("sample rate must be positive, got " + sampleRate);
        }
    }

    /**
     * Builds a frame from PCM16LE bytes.
     *
     * @throws InvalidAudioException if the byte buffer is empty or not 16-bit aligned
     */
    public static AudioFrame fromPcm(String participantId, byte[] pcm, int sampleRate,
                                     Instant captureTimestamp, long sequence) {
        return new AudioFrame(participantId, PcmCodec.toSamples(pcm), sampleRate, captureTimestamp, sequence);
    }

    public int length() {
        return samples.length;
    }
}
