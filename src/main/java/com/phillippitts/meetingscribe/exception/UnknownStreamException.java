package com.phillippitts.meetingscribe.exception;

/**
 * Thrown at the REST boundary when a lifecycle call names a stream that is not live.
 * The segmentation core itself never throws this; it drops traffic for released streams.
 */
public class UnknownStreamException extends MeetingScribeException {

    private final String streamId;

    public UnknownStreamException(String streamId) {
        super("No active audio stream: " + streamId);
        this.streamId = streamId;
    }

    public String getStreamId() {
        return streamId;
    }
}
