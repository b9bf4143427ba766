package com.phillippitts.audiogen.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Typed properties for the audio generation pipeline.
 * Binds to properties prefixed with "audiogen.pipeline".
 *
 * <p>Example application.properties:
 * <pre>
 * audiogen.pipeline.backend=polly
 * audiogen.pipeline.output-dir=generated_files
 * audiogen.pipeline.provenance-file=audio_to_text_map.csv
 * audiogen.pipeline.max-chunk-length=3000
 * audiogen.pipeline.parallelism=1
 * </pre>
 *
 * @param backend          which speech backend renders the chunks
 * @param outputDir        directory receiving artifacts and the provenance log
 * @param provenanceFile   provenance log file name, resolved inside {@code outputDir}
 * @param maxChunkLength   maximum characters per backend call
 * @param parallelism      chunks synthesized concurrently per request (1 = sequential)
 * @param requestTimeoutMs upper bound for synthesizing all chunks of one request
 * @param tempDir          parent of per-request chunk directories (system temp dir when blank)
 * @param requestsFile     optional JSON request catalog; the built-in sample is used when blank
 */
@Validated
@ConfigurationProperties(prefix = "audiogen.pipeline")
public record PipelineProperties(
        @NotNull
        Backend backend,

        @NotBlank(message = "Output directory must not be blank")
        String outputDir,

        @NotBlank(message = "Provenance file name must not be blank")
        String provenanceFile,

        @NotNull
        @Positive(message = "Max chunk length must be positive")
        Integer maxChunkLength,

        @NotNull
        @Positive(message = "Parallelism must be positive")
        Integer parallelism,

        @NotNull
        @Positive(message = "Request timeout must be positive")
        Long requestTimeoutMs,

        String tempDir,

        String requestsFile
) {

    public enum Backend { POLLY, HTTP }

    public PipelineProperties {
        backend = backend == null ? Backend.POLLY : backend;
        outputDir = outputDir == null ? "generated_files" : outputDir;
        provenanceFile = provenanceFile == null ? "audio_to_text_map.csv" : provenanceFile;
        maxChunkLength = maxChunkLength == null ? 3000 : maxChunkLength;
        parallelism = parallelism == null ? 1 : parallelism;
        requestTimeoutMs = requestTimeoutMs == null ? 120_000L : requestTimeoutMs;
    }

    public Path outputPath() {
        return Path.of(outputDir);
    }

    public Path provenancePath() {
        return outputPath().resolve(provenanceFile);
    }

    /**
     * @return configured temp parent, or null to use the platform default
     */
    public Path tempPath() {
        return tempDir == null || tempDir.isBlank() ? null : Path.of(tempDir);
    }
}
