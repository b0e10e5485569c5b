/**
 * Output side of the engine: the {@link com.phillippitts.meetingscribe.service.output.TranscriptSink}
 * contract and its default event-publishing implementation.
 */
package com.phillippitts.meetingscribe.service.output;
