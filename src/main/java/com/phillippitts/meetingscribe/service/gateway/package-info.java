/**
 * Contracts and default implementations of the two remote classifiers: voice activity
 * ({@link com.phillippitts.meetingscribe.service.gateway.VadGateway}) and speech recognition
 * ({@link com.phillippitts.meetingscribe.service.gateway.RecognitionGateway}).
 *
 * <p>Both return {@link java.util.concurrent.CompletableFuture}s; callers never block on them.
 */
package com.phillippitts.meetingscribe.service.gateway;
