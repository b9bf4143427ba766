package com.phillippitts.audiogen.config.properties;

import com.phillippitts.audiogen.domain.AudioFormat;
import com.phillippitts.audiogen.domain.VoiceSettings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Voice parameters shared by all requests of a run. Binds to "audiogen.voice".
 *
 * @param engine       backend engine type ("standard", "neural", ...)
 * @param audioFormat  output format, also decides the artifact extension
 * @param languageCode language of the source texts
 */
@Validated
@ConfigurationProperties(prefix = "audiogen.voice")
public record VoiceProperties(
        @NotBlank(message = "Voice engine must not be blank")
        String engine,

        @NotNull
        AudioFormat audioFormat,

        @NotBlank(message = "Language code must not be blank")
        String languageCode
) {

    public VoiceProperties {
        engine = engine == null ? "standard" : engine;
        audioFormat = audioFormat == null ? AudioFormat.MP3 : audioFormat;
        languageCode = languageCode == null ? "en-US" : languageCode;
    }

    public VoiceSettings forSpeaker(String speaker) {
        return new VoiceSettings(speaker, engine, audioFormat, languageCode);
    }
}
