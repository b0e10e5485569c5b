/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.meetingscribe.exception.MeetingScribeException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.meetingscribe.exception.InvalidAudioException} - Thrown when an
 *       ingested frame fails validation (odd byte count, empty, sample-rate mismatch)</li>
 *   <li>{@link com.phillippitts.meetingscribe.exception.UnknownStreamException} - Thrown at the
 *       REST boundary for lifecycle calls naming a stream that is not live</li>
 *   <li>{@link com.phillippitts.meetingscribe.exception.GatewayException} - Failure of a remote
 *       voice-activity or recognition call</li>
 * </ul>
 *
 * <p>Only validation errors reach ingestion callers. Faults inside a stream (lost verdicts,
 * malformed replies, overflow) are resolved by policy, logged, and counted.
 *
 * @see com.phillippitts.meetingscribe.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.meetingscribe.exception;
