/**
 * Domain models exchanged with the platform and output collaborators.
 *
 * <p>All domain models are immutable records that validate themselves in their
 * compact constructors.
 *
 * <ul>
 *   <li>{@link com.phillippitts.meetingscribe.domain.AudioFrame} - raw frame from the platform</li>
 *   <li>{@link com.phillippitts.meetingscribe.domain.TranscriptionSegment} - ordered recognized
 *       segment (or gap marker) handed to the output collaborator</li>
 * </ul>
 */
package com.phillippitts.meetingscribe.domain;
