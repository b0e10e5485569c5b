/**
 * Stream lifecycle and the single-writer processing unit.
 *
 * <p>{@link com.phillippitts.meetingscribe.service.stream.SegmentationEngine} is the facade;
 * {@link com.phillippitts.meetingscribe.service.stream.StreamRegistry} owns the live
 * {@link com.phillippitts.meetingscribe.service.stream.AudioStream}s.
 */
package com.phillippitts.meetingscribe.service.stream;
