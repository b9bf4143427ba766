package com.phillippitts.audiogen.service.synthesis;

import com.phillippitts.audiogen.config.properties.HttpBackendProperties;
import com.phillippitts.audiogen.domain.VoiceSettings;
import com.phillippitts.audiogen.exception.InvalidConfigException;
import com.phillippitts.audiogen.exception.SynthesisExceptionBuilder;
import com.phillippitts.audiogen.service.auth.Authenticator;
import com.phillippitts.audiogen.service.auth.CookieSession;
import com.phillippitts.audiogen.util.LogSanitizer;
import com.phillippitts.audiogen.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Raw HTTP backend: one form POST per chunk, authorized by a session cookie.
 *
 * <p>Request fields: {@code speaker}, {@code text}, {@code account_id}, {@code map_type}.
 * The client id is sent as {@code User-Agent}. The JSON response carries a status code and,
 * on success, base64 audio (see {@link HttpTtsResponseParser}).
 *
 * <p>Every failure is fatal for the request and is never retried: transport errors and
 * non-200 responses raise {@link com.phillippitts.audiogen.exception.TransportException},
 * unparseable bodies {@link com.phillippitts.audiogen.exception.DecodeException}, and non-zero
 * backend statuses {@link com.phillippitts.audiogen.exception.BackendStatusException}.
 */
public class HttpSynthesisClient implements SynthesisClient {

    private static final Logger LOG = LogManager.getLogger(HttpSynthesisClient.class);
    private static final String BACKEND = HttpTtsResponseParser.BACKEND;
    private static final int BODY_SNIPPET_MAX_CHARS = 200;

    private final RestTemplate restTemplate;
    private final Authenticator<CookieSession> authenticator;
    private final HttpBackendProperties props;

    public HttpSynthesisClient(RestTemplate restTemplate,
                               Authenticator<CookieSession> authenticator,
                               HttpBackendProperties props) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
        this.props = Objects.requireNonNull(props, "props");
        if (props.baseUrl() == null || props.baseUrl().isBlank()) {
            throw new InvalidConfigException("audiogen.http.base-url", "required when the http backend is selected");
        }
    }

    @Override
    public byte[] synthesize(String text, VoiceSettings voice) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(voice, "voice");
        CookieSession session = authenticator.acquire();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(new MediaType("application", "x-www-form-urlencoded", StandardCharsets.UTF_8));
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.COOKIE, session.cookie());
        headers.set(HttpHeaders.USER_AGENT, props.clientId());

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("speaker", voice.voiceId());
        form.add("text", text);
        if (props.accountId() != null && !props.accountId().isBlank()) {
            form.add("account_id", props.accountId());
        }
        if (props.mapType() != null && !props.mapType().isBlank()) {
            form.add("map_type", props.mapType());
        }

        long startTime = System.nanoTime();
        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(props.baseUrl(), HttpMethod.POST,
                    new HttpEntity<>(form, headers), String.class);
        } catch (RestClientResponseException e) {
            throw SynthesisExceptionBuilder.create("Backend returned HTTP " + e.getStatusCode().value())
                    .backend(BACKEND)
                    .withLogContext()
                    .httpStatus(e.getStatusCode().value())
                    .durationMs(TimeUtils.elapsedMillis(startTime))
                    .metadata("body", LogSanitizer.truncate(e.getResponseBodyAsString(), BODY_SNIPPET_MAX_CHARS))
                    .cause(e)
                    .transport();
        } catch (RestClientException e) {
            throw SynthesisExceptionBuilder.create("Request to backend failed: " + e.getMessage())
                    .backend(BACKEND)
                    .withLogContext()
                    .durationMs(TimeUtils.elapsedMillis(startTime))
                    .metadata("url", props.baseUrl())
                    .cause(e)
                    .transport();
        }

        int httpStatus = response.getStatusCode().value();
        if (httpStatus != 200) {
            throw SynthesisExceptionBuilder.create("Backend returned HTTP " + httpStatus)
                    .backend(BACKEND)
                    .withLogContext()
                    .httpStatus(httpStatus)
                    .durationMs(TimeUtils.elapsedMillis(startTime))
                    .transport();
        }

        HttpTtsResponseParser.HttpTtsResponse parsed = HttpTtsResponseParser.parse(response.getBody());
        BackendStatus status = BackendStatus.fromCode(parsed.statusCode());
        if (!status.isSuccess()) {
            throw SynthesisExceptionBuilder.create("Backend rejected the request: "
                            + BackendStatus.describe(parsed.statusCode()))
                    .backend(BACKEND)
                    .withLogContext()
                    .metadata("speaker", voice.voiceId())
                    .metadata("textLength", text.length())
                    .status(parsed.statusCode());
        }

        byte[] audio = HttpTtsResponseParser.decodeAudio(parsed.audioBase64());
        LOG.debug("HTTP backend returned {} bytes in {} ms", audio.length, TimeUtils.elapsedMillis(startTime));
        return audio;
    }

    @Override
    public String getBackendName() {
        return BACKEND;
    }
}
