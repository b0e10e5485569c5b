package com.phillippitts.meetingscribe.service.gateway;

import java.time.Instant;

/**
 * Voice-activity classification request for exactly one packet.
 *
 * @param streamId         stream that produced the packet
 * @param correlationId    packet correlation id, unique within the stream
 * @param samples          PCM16 samples, exactly one packet long
 * @param sampleRate       sample rate in Hz
 * @param captureTimestamp capture time of the packet's first sample
 */
public record VadRequest(
        String streamId,
        long correlationId,
        short[] samples,
        int sampleRate,
        Instant captureTimestamp
) {
}
