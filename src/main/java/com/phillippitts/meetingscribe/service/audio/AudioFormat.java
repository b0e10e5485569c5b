package com.phillippitts.meetingscribe.service.audio;

/**
 * Single source of truth for the ingested PCM format.
 * Required: 16-bit signed PCM, mono, little-endian. Sample rate is configurable (default 16 kHz).
 */
public final class AudioFormat {

    /** Default sample rate in Hz. */
    public static final int DEFAULT_SAMPLE_RATE = 16_000;
    /** Required bits per sample. */
    public static final int REQUIRED_BITS_PER_SAMPLE = 16;
    /** Required number of channels (mono). */
    public static final int REQUIRED_CHANNELS = 1;
    /** Required endian flag (false = little-endian). */
    public static final boolean REQUIRED_BIG_ENDIAN = false;

    /** Bytes per PCM frame (sample for all channels). */
    public static final int BLOCK_ALIGN = (REQUIRED_BITS_PER_SAMPLE / 8) * REQUIRED_CHANNELS; // 2 bytes

    private AudioFormat() {}

    /** Bytes per second at the given sample rate. */
    public static int byteRate(int sampleRate) {
        return sampleRate * BLOCK_ALIGN;
    }
}
