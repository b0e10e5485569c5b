package com.phillippitts.meetingscribe.service.gateway;

import com.phillippitts.meetingscribe.config.properties.RecognitionGatewayProperties;
import com.phillippitts.meetingscribe.exception.GatewayException;
import com.phillippitts.meetingscribe.exception.GatewayExceptionBuilder;
import com.phillippitts.meetingscribe.service.audio.PcmCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Base64;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Recognition gateway that POSTs segments as JSON to a remote recognizer.
 *
 * <p>Request body:
 * <pre>
 * {"audio_base64": "&lt;PCM16LE&gt;", "sample_rate": 16000, "timestamp": "2024-...Z",
 *  "correlation_id": 7, "diarization": true, "speaker_id": null,
 *  "prompt": "Let's start.", "recog_sent_history": ["Let's start."]}
 * </pre>
 * The blocking HTTP call runs on the gateway executor. Transport and HTTP status faults
 * complete the future exceptionally with a {@link GatewayException}; no retry is attempted.
 */
public class HttpRecognitionGateway implements RecognitionGateway {

    static final String NAME = "recognition";

    private static final Logger LOG = LogManager.getLogger(HttpRecognitionGateway.class);

    private final RestClient restClient;
    private final String url;
    private final Executor executor;

    public HttpRecognitionGateway(RecognitionGatewayProperties properties, Executor executor) {
        this(RestClient.builder().requestFactory(requestFactory(properties.getTimeoutMs())).build(),
                properties.getUrl(), executor);
    }

    HttpRecognitionGateway(RestClient restClient, String url, Executor executor) {
        this.restClient = restClient;
        this.url = url;
        this.executor = executor;
    }

    private static SimpleClientHttpRequestFactory requestFactory(int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return factory;
    }

    @Override
    public CompletableFuture<RecognitionResponse> recognize(RecognitionRequest request) {
        return CompletableFuture.supplyAsync(() -> call(request), executor);
    }

    RecognitionResponse call(RecognitionRequest request) {
        long startNanos = System.nanoTime();
        String body = toJson(request).toString();
        LOG.debug("Sending recognition request {} ({} s of audio)", request.correlationId(),
                String.format("%.2f", request.durationSeconds()));
        String reply;
        try {
            reply = restClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw GatewayExceptionBuilder.create("Recognition request rejected")
                    .gateway(NAME)
                    .correlationId(request.correlationId())
                    .statusCode(e.getStatusCode().value())
                    .durationMs(elapsedMs(startNanos))
                    .metadata("streamId", request.streamId())
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw GatewayExceptionBuilder.create("Recognition request failed")
                    .gateway(NAME)
                    .correlationId(request.correlationId())
                    .durationMs(elapsedMs(startNanos))
                    .metadata("streamId", request.streamId())
                    .cause(e)
                    .build();
        }
        RecognitionResponse response = RecognitionJsonParser.parse(request.correlationId(), reply);
        LOG.debug("Recognition reply {} received in {} ms", request.correlationId(), elapsedMs(startNanos));
        return response;
    }

    static JSONObject toJson(RecognitionRequest request) {
        JSONObject json = new JSONObject();
        json.put("audio_base64", Base64.getEncoder().encodeToString(PcmCodec.toBytes(request.samples())));
        json.put("sample_rate", request.sampleRate());
        json.put("timestamp", request.timestamp().toString());
        json.put("correlation_id", request.correlationId());
        json.put("diarization", request.diarization());
        json.put("speaker_id", request.speakerId() == null ? JSONObject.NULL : request.speakerId());
        json.put("prompt", request.prompt());
        json.put("recog_sent_history", new JSONArray(request.sentHistory()));
        return json;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    @Override
    public String name() {
        return NAME;
    }
}
