package com.phillippitts.meetingscribe.exception;

/**
 * Thrown when an ingested frame does not match the configured PCM format
 * (16-bit signed little-endian, mono) or is empty.
 */
public class InvalidAudioException extends MeetingScribeException {

    private final int audioSize;
    private final String reason;

    public InvalidAudioException(String reason) {
        super("Invalid audio frame: " + reason);
        this.audioSize = 0;
        this.reason = reason;
    }

    public InvalidAudioException(int audioSize, String reason) {
        super("Invalid audio frame (" + audioSize + " bytes): " + reason);
        this.audioSize = audioSize;
        this.reason = reason;
    }

    public int getAudioSize() {
        return audioSize;
    }

    public String getReason() {
        return reason;
    }
}
