package com.phillippitts.audiogen.service.synthesis;

import com.phillippitts.audiogen.domain.VoiceSettings;
import com.phillippitts.audiogen.exception.SynthesisExceptionBuilder;
import com.phillippitts.audiogen.service.auth.Authenticator;
import com.phillippitts.audiogen.service.auth.PollySession;
import com.phillippitts.audiogen.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.polly.model.SynthesizeSpeechRequest;
import software.amazon.awssdk.services.polly.model.SynthesizeSpeechResponse;

import java.util.Objects;

/**
 * Cloud backend: Amazon Polly {@code SynthesizeSpeech}.
 *
 * <p>A credential-expiry failure makes the authenticator refresh the session and the call is
 * retried exactly once with the fresh session. Any other failure, or a failure of the retry,
 * is reported as a transport error for the chunk.
 */
public class PollySynthesisClient implements SynthesisClient {

    private static final Logger LOG = LogManager.getLogger(PollySynthesisClient.class);
    private static final String BACKEND = "polly";

    private final Authenticator<PollySession> authenticator;

    public PollySynthesisClient(Authenticator<PollySession> authenticator) {
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
    }

    @Override
    public byte[] synthesize(String text, VoiceSettings voice) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(voice, "voice");
        SynthesizeSpeechRequest request = SynthesizeSpeechRequest.builder()
                .text(text)
                .engine(voice.engine())
                .voiceId(voice.voiceId())
                .outputFormat(voice.format().backendName())
                .languageCode(voice.languageCode())
                .build();

        PollySession session = authenticator.acquire();
        long startTime = System.nanoTime();
        try {
            return call(session, request);
        } catch (SdkException e) {
            if (!CredentialExpiry.isCredentialExpiry(e)) {
                throw failure("Polly synthesis failed", e, startTime);
            }
            LOG.warn("Polly credentials expired mid-run: {}", e.getMessage());
        }

        PollySession fresh = authenticator.refresh(session);
        long retryStart = System.nanoTime();
        try {
            return call(fresh, request);
        } catch (SdkException e) {
            throw failure("Polly synthesis failed after session refresh", e, retryStart);
        }
    }

    private byte[] call(PollySession session, SynthesizeSpeechRequest request) {
        ResponseBytes<SynthesizeSpeechResponse> response = session.client().synthesizeSpeechAsBytes(request);
        byte[] audio = response.asByteArray();
        if (audio.length == 0) {
            throw SynthesisExceptionBuilder.create("Polly returned an empty audio stream")
                    .backend(BACKEND)
                    .withLogContext()
                    .metadata("contentType", response.response().contentType())
                    .decode();
        }
        LOG.debug("Polly returned {} bytes ({} characters billed)", audio.length,
                response.response().requestCharacters());
        return audio;
    }

    private RuntimeException failure(String message, SdkException e, long startTime) {
        return SynthesisExceptionBuilder.create(message)
                .backend(BACKEND)
                .withLogContext()
                .durationMs(TimeUtils.elapsedMillis(startTime))
                .metadata("error", e.getMessage())
                .cause(e)
                .transport();
    }

    @Override
    public String getBackendName() {
        return BACKEND;
    }
}
