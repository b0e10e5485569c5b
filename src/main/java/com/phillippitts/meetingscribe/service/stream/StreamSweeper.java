package com.phillippitts.meetingscribe.service.stream;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drives time-based work (verdict timeouts, silence finalization, reorder timeouts) for
 * streams that receive no further input.
 */
@Component
public class StreamSweeper {

    private final SegmentationEngine engine;

    public StreamSweeper(SegmentationEngine engine) {
        this.engine = engine;
    }

    @Scheduled(fixedDelayString = "${segmentation.sweep-interval-ms:100}")
    public void sweep() {
        engine.tick();
    }
}
