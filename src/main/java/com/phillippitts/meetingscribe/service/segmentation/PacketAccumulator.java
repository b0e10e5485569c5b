package com.phillippitts.meetingscribe.service.segmentation;

import com.phillippitts.meetingscribe.domain.AudioFrame;
import com.phillippitts.meetingscribe.util.TimeUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reshapes irregular frames into fixed-length packets.
 *
 * <p>Samples are copied into a reusable buffer of exactly one packet. Whenever it fills, a
 * packet is cut with the next correlation id and the buffer starts over; a frame that
 * straddles the boundary is split and its tail starts the next packet. No sample is
 * dropped, duplicated or reordered. The unfilled remainder is discarded on {@link #reset()}.
 *
 * <p>A packet's capture timestamp is that of the frame holding its first sample, shifted by
 * the sample's position inside the frame.
 *
 * <p>Not thread-safe; owned by a single {@code AudioStream}.
 */
public final class PacketAccumulator {

    private final short[] buffer;
    private final int sampleRate;
    private int fill;
    private Instant packetTimestamp;
    private long streamOffset;
    private long nextCorrelationId = 1;

    public PacketAccumulator(int packetSamples, int sampleRate) {
        if (packetSamples <= 0) {
            throw new IllegalArgumentException("packetSamples must be positive: " + packetSamples);
        }
        this.buffer = new short[packetSamples];
        this.sampleRate = sampleRate;
    }

    /**
     * Appends a frame and returns the packets it completed, in order (possibly none).
     */
    public List<AudioPacket> append(AudioFrame frame) {
        short[] samples = frame.samples();
        List<AudioPacket> out = new ArrayList<>(1 + samples.length / buffer.length);
        int pos = 0;
        while (pos < samples.length) {
            if (fill == 0) {
                packetTimestamp = TimeUtils.plusSamples(frame.captureTimestamp(), pos, sampleRate);
            }
            int n = Math.min(samples.length - pos, buffer.length - fill);
            System.arraycopy(samples, pos, buffer, fill, n);
            fill += n;
            pos += n;
            if (fill == buffer.length) {
                out.add(new AudioPacket(nextCorrelationId++, Arrays.copyOf(buffer, buffer.length),
                        packetTimestamp, streamOffset));
                streamOffset += buffer.length;
                fill = 0;
            }
        }
        return out;
    }

    /** Samples waiting for the next packet. Always below the packet length. */
    public int pending() {
        return fill;
    }

    public int packetSamples() {
        return buffer.length;
    }

    /** Stream offset of the first sample not yet cut into a packet. */
    public long streamOffset() {
        return streamOffset + fill;
    }

    /** Drops the unfilled remainder. Correlation ids keep increasing. */
    public void reset() {
        streamOffset += fill;
        fill = 0;
        packetTimestamp = null;
    }
}
