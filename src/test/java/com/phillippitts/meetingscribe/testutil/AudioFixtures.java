package com.phillippitts.meetingscribe.testutil;

import com.phillippitts.meetingscribe.domain.AudioFrame;
import com.phillippitts.meetingscribe.service.segmentation.AudioPacket;
import com.phillippitts.meetingscribe.service.segmentation.ResolvedVerdict;
import com.phillippitts.meetingscribe.service.segmentation.VerdictOutcome;

import java.time.Instant;
import java.util.Arrays;

/**
 * Builders for frames, packets and verdicts at 16 kHz.
 */
public final class AudioFixtures {

    public static final int SAMPLE_RATE = 16_000;
    public static final int PACKET = 1_600;
    public static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private AudioFixtures() {}

    /** Samples counting up from {@code start}, so concatenations are easy to verify. */
    public static short[] ramp(int start, int length) {
        short[] s = new short[length];
        for (int i = 0; i < length; i++) {
            s[i] = (short) (start + i);
        }
        return s;
    }

    public static short[] constant(int value, int length) {
        short[] s = new short[length];
        Arrays.fill(s, (short) value);
        return s;
    }

    public static AudioFrame frame(String participant, short[] samples, long sequence) {
        return new AudioFrame(participant, samples, SAMPLE_RATE, T0, sequence);
    }

    public static AudioPacket packet(long id, short[] samples) {
        return new AudioPacket(id, samples, T0.plusMillis((id - 1) * 100), (id - 1) * samples.length);
    }

    public static ResolvedVerdict speech(long id) {
        return new ResolvedVerdict(packet(id, constant((int) id, PACKET)), 1.0, VerdictOutcome.SPEECH);
    }

    public static ResolvedVerdict silence(long id) {
        return new ResolvedVerdict(packet(id, constant(0, PACKET)), 1.0, VerdictOutcome.NON_SPEECH);
    }
}
