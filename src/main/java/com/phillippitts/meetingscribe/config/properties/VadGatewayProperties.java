package com.phillippitts.meetingscribe.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the local energy-based voice-activity classifier.
 */
@Validated
@ConfigurationProperties(prefix = "gateway.vad")
public class VadGatewayProperties {

    /** RMS amplitude (16-bit PCM scale) at or above which a packet counts as speech. */
    @Min(1)
    @Max(32_767)
    private final int energyThreshold;

    @ConstructorBinding
    public VadGatewayProperties(Integer energyThreshold) {
        this.energyThreshold = energyThreshold == null ? 500 : energyThreshold;
    }

    public int getEnergyThreshold() {
        return energyThreshold;
    }
}
