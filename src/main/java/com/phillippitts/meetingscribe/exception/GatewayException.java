package com.phillippitts.meetingscribe.exception;

/**
 * Thrown (or used to complete a future exceptionally) when a remote classifier
 * call fails: transport error, non-2xx status, timeout, or an unparseable reply.
 */
public class GatewayException extends MeetingScribeException {

    private final String gateway;

    public GatewayException(String message) {
        super(message);
        this.gateway = "unknown";
    }

    public GatewayException(String message, String gateway) {
        super(message + " (gateway: " + gateway + ")");
        this.gateway = gateway;
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
        this.gateway = "unknown";
    }

    public GatewayException(String message, String gateway, Throwable cause) {
        super(message + " (gateway: " + gateway + ")", cause);
        this.gateway = gateway;
    }

    public String getGateway() {
        return gateway;
    }
}
