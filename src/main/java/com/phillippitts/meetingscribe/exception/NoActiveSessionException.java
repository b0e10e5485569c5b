package com.phillippitts.meetingscribe.exception;

/**
 * Thrown at the REST boundary when audio arrives while no session is active.
 */
public class NoActiveSessionException extends MeetingScribeException {

    private final String streamId;

    public NoActiveSessionException(String streamId) {
        super("No active session; frame for " + streamId + " dropped");
        this.streamId = streamId;
    }

    public String getStreamId() {
        return streamId;
    }
}
