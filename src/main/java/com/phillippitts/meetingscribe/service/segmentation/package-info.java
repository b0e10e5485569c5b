/**
 * Per-stream segmentation pipeline: packet framing, verdict correlation, the speech/silence
 * state machine and ordered recognition dispatch.
 *
 * <p>Every class here is single-threaded and owned by one
 * {@link com.phillippitts.meetingscribe.service.stream.AudioStream}, which serializes all
 * access through its mailbox.
 */
package com.phillippitts.meetingscribe.service.segmentation;
