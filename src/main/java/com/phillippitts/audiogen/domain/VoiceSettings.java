package com.phillippitts.audiogen.domain;

import java.util.Objects;

/**
 * Voice parameters passed with every synthesis call of one request.
 *
 * @param voiceId      backend voice / speaker identifier
 * @param engine       backend engine type (e.g., "standard", "neural")
 * @param format       output audio format
 * @param languageCode BCP-47 language code (e.g., "en-US")
 */
public record VoiceSettings(String voiceId, String engine, AudioFormat format, String languageCode) {

    public VoiceSettings {
        Objects.requireNonNull(voiceId, "Voice id must not be null");
        Objects.requireNonNull(format, "Audio format must not be null");
    }
}
