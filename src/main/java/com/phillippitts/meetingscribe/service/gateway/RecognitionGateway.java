package com.phillippitts.meetingscribe.service.gateway;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous speech recognizer.
 *
 * <p>Several requests per stream may be in flight at once; replies may complete in any order.
 * A future that completes exceptionally is released downstream as a gap marker.
 */
public interface RecognitionGateway {

    CompletableFuture<RecognitionResponse> recognize(RecognitionRequest request);

    default String name() {
        return getClass().getSimpleName();
    }
}
