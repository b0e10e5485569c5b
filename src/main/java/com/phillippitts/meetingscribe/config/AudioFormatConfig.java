package com.phillippitts.meetingscribe.config;

import com.phillippitts.meetingscribe.config.properties.SegmentationProperties;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Configuration;

import static com.phillippitts.meetingscribe.service.audio.AudioFormat.BLOCK_ALIGN;
import static com.phillippitts.meetingscribe.service.audio.AudioFormat.REQUIRED_BIG_ENDIAN;
import static com.phillippitts.meetingscribe.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.meetingscribe.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.meetingscribe.service.audio.AudioFormat.byteRate;

/**
 * Startup sanity check for the ingested audio format and the derived segmentation sizes.
 * Logs the effective values and fails fast if misconfigured.
 */
@Configuration
class AudioFormatConfig {
    private static final Logger LOG = LogManager.getLogger(AudioFormatConfig.class);

    private final SegmentationProperties segmentation;

    AudioFormatConfig(SegmentationProperties segmentation) {
        this.segmentation = segmentation;
    }

    @PostConstruct
    void validateAudioFormat() {
        if (REQUIRED_BITS_PER_SAMPLE != 16 || REQUIRED_CHANNELS != 1 || REQUIRED_BIG_ENDIAN) {
            throw new IllegalStateException(
                    "Audio format constants misconfigured. Expected 16-bit, mono, little-endian.");
        }
        if (segmentation.packetSamples() <= 0) {
            throw new IllegalStateException("segmentation.packet-ms yields an empty packet at "
                    + segmentation.getSampleRate() + " Hz");
        }
        LOG.info("Audio format configured: sampleRate={} Hz, bitsPerSample={}, channels={}, "
                        + "byteRate={}, blockAlign={} (littleEndian={})",
                segmentation.getSampleRate(), REQUIRED_BITS_PER_SAMPLE, REQUIRED_CHANNELS,
                byteRate(segmentation.getSampleRate()), BLOCK_ALIGN, !REQUIRED_BIG_ENDIAN);
        LOG.info("Segmentation sizes (samples): packet={}, segmentTarget={}, minSpeech={}, overflowMax={}; "
                        + "silenceTimeout={} ms, verdictTimeout={} ms, maxOutstandingVerdicts={}",
                segmentation.packetSamples(), segmentation.segmentTargetSamples(),
                segmentation.minSpeechSamples(), segmentation.overflowMaxSamples(),
                segmentation.getSilenceTimeoutMs(), segmentation.getVerdictTimeoutMs(),
                segmentation.getMaxOutstandingVerdicts());
    }
}
