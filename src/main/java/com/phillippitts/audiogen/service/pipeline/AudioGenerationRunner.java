package com.phillippitts.audiogen.service.pipeline;

import com.phillippitts.audiogen.domain.SynthesisRequest;
import com.phillippitts.audiogen.exception.AuthExhaustedException;
import com.phillippitts.audiogen.exception.InvalidConfigException;
import com.phillippitts.audiogen.service.auth.Authenticator;
import com.phillippitts.audiogen.service.request.RequestSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Runs the batch once at startup and exposes the process exit code.
 *
 * <p>The backend session is established before the first request, so an expired login is
 * resolved (or reported as fatal) up front instead of inside the first chunk call.
 */
@Component
@ConditionalOnProperty(prefix = "audiogen.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AudioGenerationRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger LOG = LogManager.getLogger(AudioGenerationRunner.class);

    private final RequestSource requests;
    private final Authenticator<?> authenticator;
    private final AudioGenerationPipeline pipeline;

    private volatile int exitCode = BatchReport.EXIT_OK;

    public AudioGenerationRunner(RequestSource requests, Authenticator<?> authenticator,
                                 AudioGenerationPipeline pipeline) {
        this.requests = Objects.requireNonNull(requests, "requests must not be null");
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            List<SynthesisRequest> batch = requests.load();
            LOG.info("Starting run: {} requests from {}, backend={}",
                    batch.size(), requests.describe(), authenticator.getBackendName());
            authenticator.acquire();
            BatchReport report = pipeline.runAll(batch);
            exitCode = report.exitCode();
        } catch (AuthExhaustedException e) {
            LOG.error("Run aborted: {}", e.getMessage(), e);
            exitCode = BatchReport.EXIT_FATAL;
        } catch (InvalidConfigException e) {
            LOG.error("Run aborted, invalid configuration: {}", e.getMessage(), e);
            exitCode = BatchReport.EXIT_FATAL;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
