package com.phillippitts.audiogen.service.synthesis;

import com.phillippitts.audiogen.exception.SynthesisExceptionBuilder;
import com.phillippitts.audiogen.util.LogSanitizer;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Base64;

/**
 * Parses the HTTP backend's response body:
 * <pre>
 * {"status_code": 0, "data": {"v_str": "&lt;base64 audio&gt;"}}
 * </pre>
 *
 * <p>Strict, unlike a best-effort parser: anything that does not match the shape raises a
 * {@link com.phillippitts.audiogen.exception.DecodeException}. The audio payload is only
 * required when the status is success.
 */
final class HttpTtsResponseParser {

    static final String BACKEND = "http";
    private static final int BODY_SNIPPET_MAX_CHARS = 200;

    private HttpTtsResponseParser() {}

    /**
     * Parsed body.
     *
     * @param statusCode  backend status code
     * @param audioBase64 base64 audio, null when the status is not success
     */
    record HttpTtsResponse(int statusCode, String audioBase64) {}

    static HttpTtsResponse parse(String body) {
        if (body == null || body.isBlank()) {
            throw SynthesisExceptionBuilder.create("Empty response body")
                    .backend(BACKEND)
                    .withLogContext()
                    .decode();
        }
        try {
            JSONObject obj = new JSONObject(body);
            int statusCode = obj.getInt("status_code");
            if (!BackendStatus.fromCode(statusCode).isSuccess()) {
                return new HttpTtsResponse(statusCode, null);
            }
            String audio = obj.getJSONObject("data").getString("v_str");
            if (audio.isBlank()) {
                throw new JSONException("data.v_str is blank");
            }
            return new HttpTtsResponse(statusCode, audio);
        } catch (JSONException e) {
            throw SynthesisExceptionBuilder.create("Malformed response body: " + e.getMessage())
                    .backend(BACKEND)
                    .withLogContext()
                    .metadata("body", LogSanitizer.truncate(body, BODY_SNIPPET_MAX_CHARS))
                    .cause(e)
                    .decode();
        }
    }

    static byte[] decodeAudio(String audioBase64) {
        try {
            return Base64.getMimeDecoder().decode(audioBase64);
        } catch (IllegalArgumentException e) {
            throw SynthesisExceptionBuilder.create("Audio payload is not valid base64")
                    .backend(BACKEND)
                    .withLogContext()
                    .cause(e)
                    .decode();
        }
    }
}
