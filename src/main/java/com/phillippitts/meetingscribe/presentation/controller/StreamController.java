package com.phillippitts.meetingscribe.presentation.controller;

import com.phillippitts.meetingscribe.domain.AudioFrame;
import com.phillippitts.meetingscribe.exception.NoActiveSessionException;
import com.phillippitts.meetingscribe.exception.UnknownStreamException;
import com.phillippitts.meetingscribe.service.stream.SegmentationEngine;
import com.phillippitts.meetingscribe.service.stream.StreamSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * HTTP surface for the session and platform collaborators: session lifecycle, raw frame
 * ingestion (PCM16LE body) and stream teardown.
 */
@RestController
class StreamController {

    private static final Logger LOG = LogManager.getLogger(StreamController.class);

    static final String CAPTURE_TIMESTAMP_HEADER = "X-Capture-Timestamp";

    private final SegmentationEngine engine;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    StreamController(SegmentationEngine engine, Clock clock) {
        this.engine = engine;
        this.clock = clock;
    }

    @PostMapping("/sessions/{sessionId}")
    ResponseEntity<Map<String, Object>> startSession(@PathVariable String sessionId) {
        engine.startSession(sessionId);
        return ResponseEntity.ok(Map.of("sessionId", sessionId, "streams", engine.activeStreams().size()));
    }

    @DeleteMapping("/sessions/current")
    ResponseEntity<Map<String, Object>> endSession() {
        int released = engine.endSession();
        return ResponseEntity.ok(Map.of("released", released));
    }

    /**
     * Ingests one frame. In mixed mode the path variable is recorded as the participant but
     * the frame is routed to the mixed stream.
     *
     * @return 202 when queued, 429 when the stream dropped it
     * @throws NoActiveSessionException (409) when no session is active
     */
    @PostMapping(path = "/streams/{streamId}/frames", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    ResponseEntity<Void> ingest(@PathVariable String streamId,
                                @RequestBody byte[] pcm,
                                @RequestHeader(name = CAPTURE_TIMESTAMP_HEADER, required = false) Instant capturedAt,
                                @RequestHeader(name = "X-Sample-Rate", required = false) Integer sampleRate) {
        Instant timestamp = capturedAt != null ? capturedAt : clock.instant();
        int rate = sampleRate != null ? sampleRate : engine.sampleRate();
        AudioFrame frame = AudioFrame.fromPcm(streamId, pcm, rate, timestamp, sequence.incrementAndGet());
        if (!engine.ingest(frame)) {
            if (engine.currentSession().isEmpty()) {
                throw new NoActiveSessionException(streamId);
            }
            LOG.debug("Frame for stream {} dropped", streamId);
            return ResponseEntity.status(429).build();
        }
        return ResponseEntity.accepted().build();
    }

    @DeleteMapping("/streams/{streamId}")
    ResponseEntity<Void> release(@PathVariable String streamId) {
        if (!engine.releaseStream(streamId)) {
            throw new UnknownStreamException(streamId);
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/streams")
    List<StreamSnapshot> streams() {
        return engine.activeStreams();
    }
}
