package com.phillippitts.meetingscribe.presentation.exception;

import com.phillippitts.meetingscribe.exception.InvalidAudioException;
import com.phillippitts.meetingscribe.exception.NoActiveSessionException;
import com.phillippitts.meetingscribe.exception.UnknownStreamException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - malformed frame (HTTP 400).
     */
    @ExceptionHandler(InvalidAudioException.class)
    ResponseEntity<ApiError> handleInvalidAudio(InvalidAudioException ex) {
        LOG.warn("Invalid audio: size={}, reason={}", ex.getAudioSize(), ex.getReason());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid audio format",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Lifecycle call for a stream that is not live (HTTP 404).
     */
    @ExceptionHandler(UnknownStreamException.class)
    ResponseEntity<ApiError> handleUnknownStream(UnknownStreamException ex) {
        LOG.debug("Unknown stream: {}", ex.getStreamId());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Stream not found",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Frame sent before a session was started or after it ended (HTTP 409).
     */
    @ExceptionHandler(NoActiveSessionException.class)
    ResponseEntity<ApiError> handleNoActiveSession(NoActiveSessionException ex) {
        LOG.debug("Frame outside a session: {}", ex.getStreamId());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "No active session",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
