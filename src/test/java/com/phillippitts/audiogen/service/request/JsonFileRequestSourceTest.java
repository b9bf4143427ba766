package com.phillippitts.audiogen.service.request;

import com.phillippitts.audiogen.domain.SynthesisRequest;
import com.phillippitts.audiogen.exception.InvalidConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileRequestSourceTest {

    @TempDir
    Path dir;

    @Test
    void loadsRequestsInFileOrder() throws Exception {
        Path file = write("""
                [
                  {"id": 1, "speaker": "Joanna", "text": "Hello there."},
                  {"id": "b-2", "speaker": "Matthew", "text": "Ünïcode text"}
                ]
                """);

        List<SynthesisRequest> requests = new JsonFileRequestSource(file).load();

        assertThat(requests).containsExactly(
                new SynthesisRequest("1", "Joanna", "Hello there."),
                new SynthesisRequest("b-2", "Matthew", "Ünïcode text"));
    }

    @Test
    void malformedJsonIsAConfigError() throws Exception {
        Path file = write("[{\"id\": 1, \"speaker\": ");

        assertThatThrownBy(() -> new JsonFileRequestSource(file).load())
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("audiogen.pipeline.requests-file")
                .hasMessageContaining("malformed");
    }

    @Test
    void missingFieldRejectsWholeFile() throws Exception {
        Path file = write("[{\"id\": 1, \"speaker\": \"Joanna\", \"text\": \"ok\"}, {\"id\": 2, \"speaker\": \"Joanna\"}]");

        assertThatThrownBy(() -> new JsonFileRequestSource(file).load())
                .isInstanceOf(InvalidConfigException.class);
    }

    @Test
    void blankSpeakerIsRejected() throws Exception {
        Path file = write("[{\"id\": 1, \"speaker\": \" \", \"text\": \"ok\"}]");

        assertThatThrownBy(() -> new JsonFileRequestSource(file).load())
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("blank speaker");
    }

    @Test
    void missingFileIsAConfigError() {
        assertThatThrownBy(() -> new JsonFileRequestSource(dir.resolve("absent.json")).load())
                .isInstanceOf(InvalidConfigException.class)
                .hasMessageContaining("cannot read");
    }

    @Test
    void sampleSourceServesTwoRequests() {
        List<SynthesisRequest> requests = new SampleRequestSource().load();

        assertThat(requests).extracting(SynthesisRequest::id).containsExactly("1", "2");
        assertThat(requests).allSatisfy(r -> assertThat(r.speaker()).isEqualTo("Joanna"));
    }

    private Path write(String json) throws Exception {
        Path file = dir.resolve("requests.json");
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return file;
    }
}
