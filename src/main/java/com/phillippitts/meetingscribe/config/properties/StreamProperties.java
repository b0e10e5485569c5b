package com.phillippitts.meetingscribe.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for how platform audio maps onto streams.
 */
@Validated
@ConfigurationProperties(prefix = "stream")
public class StreamProperties {

    /**
     * MIXED: one synthetic stream carries the whole meeting.
     * INDIVIDUAL: one stream per participant, created on its first frame.
     */
    public enum Mode { MIXED, INDIVIDUAL }

    @NotNull
    private final Mode mode;

    /** Ask the recognizer to diarize mixed audio. Individual streams are never diarized. */
    private final boolean diarization;

    /** Delivered sentences sent to the recognizer as session context; 0 disables it. */
    @Min(0)
    private final int contextHistorySize;

    @ConstructorBinding
    public StreamProperties(Mode mode, Boolean diarization, Integer contextHistorySize) {
        this.mode = mode == null ? Mode.MIXED : mode;
        this.diarization = diarization == null || diarization;
        this.contextHistorySize = contextHistorySize == null ? 30 : contextHistorySize;
    }

    public StreamProperties(Mode mode, Boolean diarization) {
        this(mode, diarization, null);
    }

    public StreamProperties(Mode mode) {
        this(mode, true);
    }

    public Mode getMode() {
        return mode;
    }

    public boolean isDiarization() {
        return diarization;
    }

    public int getContextHistorySize() {
        return contextHistorySize;
    }

    public boolean isIndividual() {
        return mode == Mode.INDIVIDUAL;
    }
}
