package com.phillippitts.meetingscribe.service.gateway;

import com.phillippitts.meetingscribe.config.properties.VadGatewayProperties;
import com.phillippitts.meetingscribe.service.audio.PcmCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Local voice-activity classifier based on RMS energy.
 *
 * <p>A packet counts as speech when its RMS amplitude reaches the configured threshold.
 * Confidence grows with the distance from the threshold, saturating at twice (speech) or
 * zero (silence) the threshold. Classification runs on the gateway executor so the
 * calling stream never computes it inline.
 */
public class EnergyVadGateway implements VadGateway {

    private static final Logger LOG = LogManager.getLogger(EnergyVadGateway.class);

    private final int threshold;
    private final Executor executor;

    public EnergyVadGateway(VadGatewayProperties properties, Executor executor) {
        this.threshold = properties.getEnergyThreshold();
        this.executor = executor;
    }

    @Override
    public CompletableFuture<VadResponse> classify(VadRequest request) {
        return CompletableFuture.supplyAsync(() -> evaluate(request), executor);
    }

    VadResponse evaluate(VadRequest request) {
        double rms = PcmCodec.rms(request.samples());
        boolean speech = rms >= threshold;
        double confidence = speech
                ? Math.min(1.0, 0.5 + (rms - threshold) / (2.0 * threshold))
                : Math.min(1.0, 0.5 + (threshold - rms) / (2.0 * threshold));
        if (LOG.isTraceEnabled()) {
            LOG.trace("Packet {} rms={} speech={}", request.correlationId(), String.format("%.1f", rms), speech);
        }
        return new VadResponse(request.correlationId(), speech, confidence);
    }

    @Override
    public String name() {
        return "energy-vad";
    }
}
