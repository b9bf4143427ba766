package com.phillippitts.audiogen.service.assembly;

import com.phillippitts.audiogen.domain.AudioFormat;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ArtifactNamerTest {

    @Test
    void namesWithIdSpeakerAndExtension() {
        ArtifactNamer namer = new ArtifactNamer(() -> "abcdef123456");

        assertThat(namer.fileName("Joanna", AudioFormat.MP3)).isEqualTo("abcdef123456_Joanna.mp3");
        assertThat(namer.fileName("Joanna", AudioFormat.OGG_VORBIS)).isEqualTo("abcdef123456_Joanna.ogg");
        assertThat(namer.fileName("Joanna", AudioFormat.PCM)).isEqualTo("abcdef123456_Joanna.pcm");
    }

    @Test
    void defaultIdsAreTwelveCharactersAndUnique() {
        ArtifactNamer namer = new ArtifactNamer();

        String first = namer.fileName("Joanna", AudioFormat.MP3);
        String second = namer.fileName("Joanna", AudioFormat.MP3);

        assertThat(first).matches("[0-9a-f]{12}_Joanna\\.mp3");
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void sanitizesSpeakerForFileSystems() {
        assertThat(ArtifactNamer.sanitize("../evil/voice")).isEqualTo("___evil_voice");
        assertThat(ArtifactNamer.sanitize(" Matthew ")).isEqualTo("Matthew");
        assertThat(ArtifactNamer.sanitize("en-US_1")).isEqualTo("en-US_1");
        assertThat(ArtifactNamer.sanitize("  ")).isEqualTo("unknown");
    }

    @Test
    void resolvesInsideOutputDirectory() {
        ArtifactNamer namer = new ArtifactNamer(() -> "000000000000");

        Path path = namer.resolve(Path.of("generated_files"), "Joanna", AudioFormat.MP3);

        assertThat(path).isEqualTo(Path.of("generated_files", "000000000000_Joanna.mp3"));
    }
}
