package com.phillippitts.audiogen.service.synthesis;

import com.phillippitts.audiogen.config.properties.HttpBackendProperties;
import com.phillippitts.audiogen.domain.AudioFormat;
import com.phillippitts.audiogen.domain.VoiceSettings;
import com.phillippitts.audiogen.exception.BackendStatusException;
import com.phillippitts.audiogen.exception.DecodeException;
import com.phillippitts.audiogen.exception.InvalidConfigException;
import com.phillippitts.audiogen.exception.TransportException;
import com.phillippitts.audiogen.service.auth.CookieAuthenticator;
import com.phillippitts.audiogen.util.LogContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpSynthesisClientTest {

    private static final String URL = "http://tts.test/api/synthesize";
    private static final VoiceSettings VOICE = new VoiceSettings("spk-7", "standard", AudioFormat.MP3, "en-US");

    private MockRestServiceServer server;
    private HttpSynthesisClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        HttpBackendProperties props = new HttpBackendProperties(
                URL, "audiogen-test/1.0", "map-3", "acct-9", "session=abc", 1000, 1000);
        client = new HttpSynthesisClient(restTemplate, new CookieAuthenticator(props.sessionCookie()), props);
    }

    @AfterEach
    void clearContext() {
        LogContext.clearRequest();
    }

    @Test
    void postsFormWithCookieAndDecodesAudio() {
        byte[] audio = "ID3-fake-mp3".getBytes(StandardCharsets.UTF_8);
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.COOKIE, "session=abc"))
                .andExpect(header(HttpHeaders.USER_AGENT, "audiogen-test/1.0"))
                .andExpect(content().formDataContains(Map.of(
                        "speaker", "spk-7",
                        "text", "Hello there",
                        "account_id", "acct-9",
                        "map_type", "map-3")))
                .andRespond(withSuccess(successBody(audio), MediaType.APPLICATION_JSON));

        byte[] result = client.synthesize("Hello there", VOICE);

        assertThat(result).isEqualTo(audio);
        server.verify();
    }

    @Test
    void nonZeroStatusIsFatalBackendStatusWithMappedDiagnostic() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"status_code\":2,\"data\":{}}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.synthesize("too long", VOICE))
                .isInstanceOfSatisfying(BackendStatusException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(2);
                    assertThat(e.getStatus()).isEqualTo(BackendStatus.TEXT_TOO_LONG);
                    assertThat(e.getReason()).isEqualTo("status-text_too_long");
                })
                .hasMessageContaining("Text exceeds the backend character limit (code 2)");
        server.verify();
    }

    @Test
    void unknownStatusCodeIsReported() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"status_code\":99}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.synthesize("x", VOICE))
                .isInstanceOf(BackendStatusException.class)
                .hasMessageContaining("Unknown status code (code 99)");
    }

    @Test
    void httpErrorIsTransportErrorWithStatus() {
        server.expect(requestTo(URL))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY).body("upstream down"));

        assertThatThrownBy(() -> client.synthesize("x", VOICE))
                .isInstanceOfSatisfying(TransportException.class,
                        e -> assertThat(e.getHttpStatus()).isEqualTo(502))
                .hasMessageContaining("upstream down");
    }

    @Test
    void nonOkSuccessStatusIsTransportError() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.ACCEPTED));

        assertThatThrownBy(() -> client.synthesize("x", VOICE))
                .isInstanceOfSatisfying(TransportException.class,
                        e -> assertThat(e.getHttpStatus()).isEqualTo(202));
    }

    @Test
    void ioFailureIsTransportError() {
        server.expect(requestTo(URL)).andRespond(withException(new IOException("connection reset")));

        assertThatThrownBy(() -> client.synthesize("x", VOICE))
                .isInstanceOfSatisfying(TransportException.class,
                        e -> assertThat(e.getHttpStatus()).isNull())
                .hasMessageContaining("connection reset");
    }

    @Test
    void malformedBodyIsDecodeErrorCarryingRequestContext() {
        LogContext.putRequest("req-5", "spk-7");
        LogContext.putChunk(3);
        server.expect(requestTo(URL)).andRespond(withSuccess("oops", MediaType.TEXT_PLAIN));

        assertThatThrownBy(() -> client.synthesize("x", VOICE))
                .isInstanceOfSatisfying(DecodeException.class, e -> {
                    assertThat(e.getRequestId()).isEqualTo("req-5");
                    assertThat(e.getChunkIndex()).isEqualTo(3);
                })
                .hasMessageContaining("requestId=req-5")
                .hasMessageContaining("chunk=3");
    }

    @Test
    void requiresBaseUrl() {
        HttpBackendProperties props = new HttpBackendProperties(null, null, null, null, null, null, null);

        assertThatThrownBy(() -> new HttpSynthesisClient(new RestTemplate(),
                new CookieAuthenticator("session=abc"), props))
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("base-url");
    }

    private static String successBody(byte[] audio) {
        return "{\"status_code\":0,\"data\":{\"v_str\":\"" + Base64.getEncoder().encodeToString(audio) + "\"}}";
    }
}
