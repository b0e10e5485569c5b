package com.phillippitts.meetingscribe.service.gateway;

import com.phillippitts.meetingscribe.exception.GatewayExceptionBuilder;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Parses recognizer JSON replies.
 *
 * <p>Two shapes are accepted:
 * <pre>
 * {"text": "...", "speaker_id": "...", "confidence": 0.92, "start": 1.2, "end": 3.7}
 * {"segments": [{"text": "...", "no_speech_prob": 0.1, "words": [...]}, ...]}
 * </pre>
 * In the segment shape, segments with {@code no_speech_prob > 0.9} are skipped and the rest
 * joined with single spaces. A reply with neither field yields a response with null text,
 * which downstream treats as malformed.
 */
final class RecognitionJsonParser {

    static final double NO_SPEECH_CUTOFF = 0.9;

    private RecognitionJsonParser() {}

    /**
     * @throws com.phillippitts.meetingscribe.exception.GatewayException if the body is not a JSON object
     */
    static RecognitionResponse parse(long correlationId, String json) {
        if (json == null || json.isBlank()) {
            throw GatewayExceptionBuilder.create("Empty recognition reply")
                    .gateway(HttpRecognitionGateway.NAME)
                    .correlationId(correlationId)
                    .build();
        }
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            throw GatewayExceptionBuilder.create("Unparseable recognition reply")
                    .gateway(HttpRecognitionGateway.NAME)
                    .correlationId(correlationId)
                    .cause(e)
                    .build();
        }

        String speakerId = obj.optString("speaker_id", null);
        if (speakerId != null && speakerId.isBlank()) {
            speakerId = null;
        }
        Double start = obj.has("start") ? obj.optDouble("start") : null;
        Double end = obj.has("end") ? obj.optDouble("end") : null;
        if (start != null && start.isNaN() || end != null && end.isNaN()) {
            start = null;
            end = null;
        }

        if (obj.has("text") && !obj.isNull("text")) {
            String text = obj.optString("text", "").trim();
            double confidence = obj.optDouble("confidence", 1.0);
            return new RecognitionResponse(correlationId, text, speakerId, clamp(confidence), start, end);
        }

        JSONArray segs = obj.optJSONArray("segments");
        if (segs == null) {
            return new RecognitionResponse(correlationId, null, speakerId, 0.0, start, end);
        }
        StringBuilder sb = new StringBuilder();
        double probSum = 0;
        int kept = 0;
        for (int i = 0; i < segs.length(); i++) {
            JSONObject seg = segs.optJSONObject(i);
            if (seg == null) {
                continue;
            }
            double noSpeech = seg.optDouble("no_speech_prob", 0.0);
            if (noSpeech > NO_SPEECH_CUTOFF) {
                continue;
            }
            String t = seg.optString("text", "").trim();
            if (t.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(t);
            probSum += noSpeech;
            kept++;
        }
        double confidence = kept == 0 ? 0.0 : 1.0 - probSum / kept;
        return new RecognitionResponse(correlationId, sb.toString(), speakerId, clamp(confidence), start, end);
    }

    static double clamp(double v) {
        if (Double.isNaN(v)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, v));
    }
}
