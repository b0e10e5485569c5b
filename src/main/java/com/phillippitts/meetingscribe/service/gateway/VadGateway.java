package com.phillippitts.meetingscribe.service.gateway;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous voice-activity classifier.
 *
 * <p>Implementations must not block the caller: the returned future completes on the
 * implementation's own threads. A future that completes exceptionally is treated as a lost
 * verdict and resolved as non-speech by the caller. Retry, if any, belongs to the
 * implementation.
 */
public interface VadGateway {

    CompletableFuture<VadResponse> classify(VadRequest request);

    /** Short name used in logs and exceptions. */
    default String name() {
        return getClass().getSimpleName();
    }
}
