package com.phillippitts.meetingscribe.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the remote speech-recognition endpoint.
 */
@Validated
@ConfigurationProperties(prefix = "gateway.recognition")
public class RecognitionGatewayProperties {

    /** Endpoint receiving JSON recognition requests. */
    @NotBlank
    private final String url;

    /** Connect + read timeout for a single request. */
    @Min(100)
    private final int timeoutMs;

    @ConstructorBinding
    public RecognitionGatewayProperties(String url, Integer timeoutMs) {
        this.url = (url == null || url.isBlank()) ? "http://localhost:8000/v1/recognize" : url;
        this.timeoutMs = timeoutMs == null ? 10_000 : timeoutMs;
    }

    public String getUrl() {
        return url;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }
}
