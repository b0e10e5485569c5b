package com.phillippitts.meetingscribe.service.segmentation;

import java.time.Instant;

/**
 * Fixed-length packet cut from a stream's frames.
 *
 * @param correlationId    voice-activity correlation id (starts at 1 per stream)
 * @param samples          exactly one packet of PCM16 samples; owned by the packet
 * @param captureTimestamp capture time of the first sample
 * @param startOffset      stream offset (in samples) of the first sample
 */
public record AudioPacket(long correlationId, short[] samples, Instant captureTimestamp, long startOffset) {

    public int length() {
        return samples.length;
    }

    public long endOffset() {
        return startOffset + samples.length;
    }
}
