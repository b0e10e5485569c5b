package com.phillippitts.meetingscribe.service.audio;

import com.phillippitts.meetingscribe.exception.InvalidAudioException;

/**
 * Conversions between PCM16LE byte buffers and sample arrays, plus RMS energy.
 */
public final class PcmCodec {

    private PcmCodec() {
        // Utility class
    }

    /**
     * Decodes PCM16LE bytes into samples.
     *
     * @param pcm raw little-endian 16-bit mono audio
     * @return decoded samples
     * @throws InvalidAudioException if the buffer is null, empty, or has an odd byte count
     */
    public static short[] toSamples(byte[] pcm) {
        if (pcm == null || pcm.length == 0) {
            throw new InvalidAudioException("frame is empty");
        }
        if (pcm.length % AudioFormat.BLOCK_ALIGN != 0) {
            throw new InvalidAudioException(pcm.length, "byte count is not a multiple of "
                    + AudioFormat.BLOCK_ALIGN + " (16-bit mono)");
        }
        short[] samples = new short[pcm.length / 2];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = (short) ((pcm[2 * i] & 0xFF) | (pcm[2 * i + 1] << 8));
        }
        return samples;
    }

    /**
     * Encodes samples as PCM16LE bytes.
     */
    public static byte[] toBytes(short[] samples) {
        byte[] out = new byte[samples.length * 2];
        for (int i = 0; i < samples.length; i++) {
            out[2 * i] = (byte) (samples[i] & 0xFF);
            out[2 * i + 1] = (byte) ((samples[i] >> 8) & 0xFF);
        }
        return out;
    }

    /**
     * Calculates RMS (Root Mean Square) amplitude of a sample window.
     *
     * @param samples PCM16 samples
     * @return RMS amplitude (0-32768 range), 0 for an empty window
     */
    public static double rms(short[] samples) {
        if (samples == null || samples.length == 0) {
            return 0;
        }
        long sumSquares = 0;
        for (short s : samples) {
            sumSquares += (long) s * s;
        }
        return Math.sqrt((double) sumSquares / samples.length);
    }
}
