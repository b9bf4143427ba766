package com.phillippitts.audiogen.service.synthesis;

import com.phillippitts.audiogen.domain.VoiceSettings;
import com.phillippitts.audiogen.exception.AuthExhaustedException;
import com.phillippitts.audiogen.exception.SynthesisException;

/**
 * Contract for speech backends: render one chunk of text into raw audio bytes.
 *
 * <p>Each implementation is bound to the {@link com.phillippitts.audiogen.service.auth.Authenticator}
 * of its backend and reads the current session from it for every call, so the pipeline never
 * branches on which backend is in use.
 *
 * <p>Thread Safety: implementations must be safe for concurrent calls from the synthesis pool.
 *
 * @see com.phillippitts.audiogen.service.synthesis.PollySynthesisClient
 * @see com.phillippitts.audiogen.service.synthesis.HttpSynthesisClient
 */
public interface SynthesisClient {

    /**
     * Synthesizes {@code text} with the given voice settings.
     *
     * @param text  chunk text, already within the backend's length limit
     * @param voice voice, engine, format and language to render with
     * @return raw audio bytes in the requested format; never empty
     * @throws SynthesisException on transport, decode or backend-status failures
     * @throws AuthExhaustedException if the session expired and could not be re-established
     */
    byte[] synthesize(String text, VoiceSettings voice);

    /**
     * @return backend name for logs and metrics (e.g., "polly", "http")
     */
    String getBackendName();
}
