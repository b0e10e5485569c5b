package com.phillippitts.meetingscribe.service.gateway;

/**
 * Voice-activity verdict for one packet.
 *
 * @param correlationId id of the request this verdict answers
 * @param speech        whether the packet contains speech
 * @param confidence    classifier confidence between 0.0 and 1.0
 */
public record VadResponse(long correlationId, boolean speech, double confidence) {

    public static VadResponse speech(long correlationId) {
        return new VadResponse(correlationId, true, 1.0);
    }

    public static VadResponse silence(long correlationId) {
        return new VadResponse(correlationId, false, 1.0);
    }
}
