package com.phillippitts.audiogen.service.synthesis;

import com.phillippitts.audiogen.exception.DecodeException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpTtsResponseParserTest {

    @Test
    void parsesSuccessfulResponse() {
        String audio = Base64.getEncoder().encodeToString("ID3audio".getBytes(StandardCharsets.UTF_8));

        HttpTtsResponseParser.HttpTtsResponse parsed =
                HttpTtsResponseParser.parse("{\"status_code\":0,\"data\":{\"v_str\":\"" + audio + "\"}}");

        assertThat(parsed.statusCode()).isZero();
        assertThat(HttpTtsResponseParser.decodeAudio(parsed.audioBase64()))
                .isEqualTo("ID3audio".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void nonSuccessStatusNeedsNoAudio() {
        HttpTtsResponseParser.HttpTtsResponse parsed = HttpTtsResponseParser.parse("{\"status_code\":2}");

        assertThat(parsed.statusCode()).isEqualTo(2);
        assertThat(parsed.audioBase64()).isNull();
    }

    @Test
    void rejectsMalformedBodies() {
        for (String body : new String[]{"", "  ", "not json", "{\"data\":{}}", "{\"status_code\":0}",
                "{\"status_code\":0,\"data\":{\"v_str\":\"\"}}", "{\"status_code\":\"zero\"}"}) {
            assertThatThrownBy(() -> HttpTtsResponseParser.parse(body))
                    .as("body: %s", body)
                    .isInstanceOf(DecodeException.class);
        }
    }

    @Test
    void decodeErrorCarriesBodySnippet() {
        assertThatThrownBy(() -> HttpTtsResponseParser.parse("<html>502 Bad Gateway</html>"))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("body=<html>502 Bad Gateway</html>")
                .hasMessageContaining("backend: http");
    }

    @Test
    void rejectsInvalidBase64() {
        assertThatThrownBy(() -> HttpTtsResponseParser.decodeAudio("***not base64***"))
                .isInstanceOf(DecodeException.class);
    }
}
