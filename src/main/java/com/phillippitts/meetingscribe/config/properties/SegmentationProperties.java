package com.phillippitts.meetingscribe.config.properties;

import com.phillippitts.meetingscribe.util.TimeUtils;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for packet framing and speech segmentation.
 *
 * <p>Durations are configured in milliseconds and converted to sample counts at the
 * configured sample rate. Defaults at 16 kHz: packet 1,600 samples, segment target 40,000,
 * minimum speech 8,000, overflow maximum 80,000.
 */
@Validated
@ConfigurationProperties(prefix = "segmentation")
public class SegmentationProperties {

    @Min(8_000)
    @Max(48_000)
    private final int sampleRate;

    /** Voice-activity packet duration. */
    @Min(10)
    @Max(1_000)
    private final int packetMs;

    /** Fixed segment length for continuous speech; 0 disables fixed-length emission. */
    @Min(0)
    private final int segmentTargetMs;

    /** Utterances shorter than this are discarded on silence finalization. */
    @Min(0)
    private final int minSpeechMs;

    /** Elapsed silence after the last speech verdict that finalizes an utterance. */
    @Min(100)
    private final int silenceTimeoutMs;

    /** Hard upper bound of the speech buffer; reaching it force-emits a segment. */
    @Min(100)
    @Max(60_000)
    private final int overflowMaxMs;

    /** Unresolved voice-activity requests allowed per stream before the oldest is evicted. */
    @Min(1)
    @Max(1_000)
    private final int maxOutstandingVerdicts;

    /** Age after which an unanswered voice-activity request is resolved as non-speech. */
    @Min(10)
    private final int verdictTimeoutMs;

    /** Age after which the reorder-buffer head is released as a gap marker. */
    @Min(100)
    private final int reorderTimeoutMs;

    /** Interval of the timer sweep that drives timeouts without new input. */
    @Min(10)
    private final int sweepIntervalMs;

    /** Bounded per-stream message queue. */
    @Min(16)
    private final int mailboxCapacity;

    @ConstructorBinding
    public SegmentationProperties(Integer sampleRate,
                                  Integer packetMs,
                                  Integer segmentTargetMs,
                                  Integer minSpeechMs,
                                  Integer silenceTimeoutMs,
                                  Integer overflowMaxMs,
                                  Integer maxOutstandingVerdicts,
                                  Integer verdictTimeoutMs,
                                  Integer reorderTimeoutMs,
                                  Integer sweepIntervalMs,
                                  Integer mailboxCapacity) {
        this.sampleRate = sampleRate == null ? 16_000 : sampleRate;
        this.packetMs = packetMs == null ? 100 : packetMs;
        this.segmentTargetMs = segmentTargetMs == null ? 2_500 : segmentTargetMs;
        this.minSpeechMs = minSpeechMs == null ? 500 : minSpeechMs;
        this.silenceTimeoutMs = silenceTimeoutMs == null ? 1_000 : silenceTimeoutMs;
        this.overflowMaxMs = overflowMaxMs == null ? 5_000 : overflowMaxMs;
        this.maxOutstandingVerdicts = maxOutstandingVerdicts == null ? 8 : maxOutstandingVerdicts;
        this.verdictTimeoutMs = verdictTimeoutMs == null ? 3 * this.packetMs : verdictTimeoutMs;
        this.reorderTimeoutMs = reorderTimeoutMs == null ? 15_000 : reorderTimeoutMs;
        this.sweepIntervalMs = sweepIntervalMs == null ? 100 : sweepIntervalMs;
        this.mailboxCapacity = mailboxCapacity == null ? 512 : mailboxCapacity;
    }

    /** All defaults. */
    public static SegmentationProperties defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @AssertTrue(message = "segment-target-ms must not exceed overflow-max-ms")
    public boolean isSegmentTargetWithinOverflow() {
        return segmentTargetMs <= overflowMaxMs;
    }

    @AssertTrue(message = "min-speech-ms must not exceed overflow-max-ms")
    public boolean isMinSpeechWithinOverflow() {
        return minSpeechMs <= overflowMaxMs;
    }

    public int getSampleRate() { return sampleRate; }
    public int getPacketMs() { return packetMs; }
    public int getSegmentTargetMs() { return segmentTargetMs; }
    public int getMinSpeechMs() { return minSpeechMs; }
    public int getSilenceTimeoutMs() { return silenceTimeoutMs; }
    public int getOverflowMaxMs() { return overflowMaxMs; }
    public int getMaxOutstandingVerdicts() { return maxOutstandingVerdicts; }
    public int getVerdictTimeoutMs() { return verdictTimeoutMs; }
    public int getReorderTimeoutMs() { return reorderTimeoutMs; }
    public int getSweepIntervalMs() { return sweepIntervalMs; }
    public int getMailboxCapacity() { return mailboxCapacity; }

    public int packetSamples() {
        return TimeUtils.millisToSamples(packetMs, sampleRate);
    }

    /** Fixed segment length in samples, or 0 when disabled. */
    public int segmentTargetSamples() {
        return TimeUtils.millisToSamples(segmentTargetMs, sampleRate);
    }

    public int minSpeechSamples() {
        return TimeUtils.millisToSamples(minSpeechMs, sampleRate);
    }

    public int overflowMaxSamples() {
        return TimeUtils.millisToSamples(overflowMaxMs, sampleRate);
    }

    public Duration silenceTimeout() {
        return Duration.ofMillis(silenceTimeoutMs);
    }

    public Duration verdictTimeout() {
        return Duration.ofMillis(verdictTimeoutMs);
    }

    public Duration reorderTimeout() {
        return Duration.ofMillis(reorderTimeoutMs);
    }

    /**
     * Builder for programmatic construction (tests, non-Spring embedding). Unset values
     * fall back to the same defaults as property binding.
     */
    public static final class Builder {
        private Integer sampleRate;
        private Integer packetMs;
        private Integer segmentTargetMs;
        private Integer minSpeechMs;
        private Integer silenceTimeoutMs;
        private Integer overflowMaxMs;
        private Integer maxOutstandingVerdicts;
        private Integer verdictTimeoutMs;
        private Integer reorderTimeoutMs;
        private Integer sweepIntervalMs;
        private Integer mailboxCapacity;

        private Builder() {}

        public Builder sampleRate(int v) { this.sampleRate = v; return this; }
        public Builder packetMs(int v) { this.packetMs = v; return this; }
        public Builder segmentTargetMs(int v) { this.segmentTargetMs = v; return this; }
        public Builder minSpeechMs(int v) { this.minSpeechMs = v; return this; }
        public Builder silenceTimeoutMs(int v) { this.silenceTimeoutMs = v; return this; }
        public Builder overflowMaxMs(int v) { this.overflowMaxMs = v; return this; }
        public Builder maxOutstandingVerdicts(int v) { this.maxOutstandingVerdicts = v; return this; }
        public Builder verdictTimeoutMs(int v) { this.verdictTimeoutMs = v; return this; }
        public Builder reorderTimeoutMs(int v) { this.reorderTimeoutMs = v; return this; }
        public Builder sweepIntervalMs(int v) { this.sweepIntervalMs = v; return this; }
        public Builder mailboxCapacity(int v) { this.mailboxCapacity = v; return this; }

        public SegmentationProperties build() {
            return new SegmentationProperties(sampleRate, packetMs, segmentTargetMs, minSpeechMs,
                    silenceTimeoutMs, overflowMaxMs, maxOutstandingVerdicts, verdictTimeoutMs,
                    reorderTimeoutMs, sweepIntervalMs, mailboxCapacity);
        }
    }
}
