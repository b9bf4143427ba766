package com.phillippitts.audiogen.testutil;

import com.phillippitts.audiogen.domain.VoiceSettings;
import com.phillippitts.audiogen.service.synthesis.SynthesisClient;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Deterministic {@link SynthesisClient}: audio is computed from the chunk text alone, so the
 * result does not depend on call order or thread.
 */
public class StubSynthesisClient implements SynthesisClient {

    private final Function<String, byte[]> audioForText;
    private final List<String> calls = new CopyOnWriteArrayList<>();

    public StubSynthesisClient(Function<String, byte[]> audioForText) {
        this.audioForText = audioForText;
    }

    /**
     * Returns the upper-cased first character of the chunk, e.g. "bbb bbb" becomes "B".
     */
    public static StubSynthesisClient firstLetter() {
        return new StubSynthesisClient(text -> new byte[]{(byte) Character.toUpperCase(text.charAt(0))});
    }

    @Override
    public byte[] synthesize(String text, VoiceSettings voice) {
        calls.add(text);
        return audioForText.apply(text);
    }

    @Override
    public String getBackendName() {
        return "stub";
    }

    public List<String> calls() {
        return calls;
    }
}
