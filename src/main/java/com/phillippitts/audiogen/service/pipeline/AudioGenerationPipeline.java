package com.phillippitts.audiogen.service.pipeline;

import com.phillippitts.audiogen.config.properties.PipelineProperties;
import com.phillippitts.audiogen.config.properties.VoiceProperties;
import com.phillippitts.audiogen.domain.AudioArtifact;
import com.phillippitts.audiogen.domain.SynthesisRequest;
import com.phillippitts.audiogen.domain.TextChunk;
import com.phillippitts.audiogen.domain.VoiceSettings;
import com.phillippitts.audiogen.exception.ArtifactIoException;
import com.phillippitts.audiogen.exception.AuthExhaustedException;
import com.phillippitts.audiogen.exception.InvalidConfigException;
import com.phillippitts.audiogen.exception.SynthesisException;
import com.phillippitts.audiogen.service.assembly.ArtifactNamer;
import com.phillippitts.audiogen.service.assembly.ChunkAssembler;
import com.phillippitts.audiogen.service.metrics.SynthesisMetrics;
import com.phillippitts.audiogen.service.provenance.ProvenanceLog;
import com.phillippitts.audiogen.service.synthesis.ChunkSynthesisService;
import com.phillippitts.audiogen.service.text.TextChunker;
import com.phillippitts.audiogen.util.LogContext;
import com.phillippitts.audiogen.util.LogSanitizer;
import com.phillippitts.audiogen.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns requests into audio artifacts: chunk, synthesize, assemble, record provenance.
 *
 * <p><b>Failure semantics:</b> a {@link SynthesisException} or {@link ArtifactIoException}
 * fails only the current request. It is logged with the request id, counted, and the run moves
 * on; no partial artifact and no provenance row is written. {@link AuthExhaustedException} and
 * {@link InvalidConfigException} are not caught here: they abort the whole run.
 */
@Service
public class AudioGenerationPipeline {

    private static final Logger LOG = LogManager.getLogger(AudioGenerationPipeline.class);

    private final TextChunker chunker;
    private final ChunkSynthesisService synthesis;
    private final ArtifactNamer namer;
    private final ProvenanceLog provenance;
    private final SynthesisMetrics metrics;
    private final PipelineProperties props;
    private final VoiceProperties voice;

    public AudioGenerationPipeline(TextChunker chunker,
                                   ChunkSynthesisService synthesis,
                                   ArtifactNamer namer,
                                   ProvenanceLog provenance,
                                   SynthesisMetrics metrics,
                                   PipelineProperties props,
                                   VoiceProperties voice) {
        this.chunker = Objects.requireNonNull(chunker, "chunker must not be null");
        this.synthesis = Objects.requireNonNull(synthesis, "synthesis must not be null");
        this.namer = Objects.requireNonNull(namer, "namer must not be null");
        this.provenance = Objects.requireNonNull(provenance, "provenance must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.voice = Objects.requireNonNull(voice, "voice must not be null");
    }

    /**
     * Processes every request in order.
     *
     * @throws AuthExhaustedException if no backend session can be established
     * @throws InvalidConfigException on a configuration error
     */
    public BatchReport runAll(List<SynthesisRequest> requests) {
        List<RequestOutcome> outcomes = new ArrayList<>(requests.size());
        for (SynthesisRequest request : requests) {
            outcomes.add(process(request));
        }
        BatchReport report = new BatchReport(outcomes);
        LOG.info("Run finished: {} succeeded, {} failed", report.succeeded(), report.failed());
        return report;
    }

    /**
     * Produces one artifact and records it in the provenance log.
     */
    public RequestOutcome process(SynthesisRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        String backend = synthesis.getBackendName();
        long startTime = System.nanoTime();
        LogContext.putRequest(request.id(), request.speaker());
        try {
            List<TextChunk> chunks = chunker.chunk(request.text(), props.maxChunkLength());
            LOG.info("Processing request: chars={}, chunks={}", request.text().length(), chunks.size());
            LOG.debug("Request text preview: {}", LogSanitizer.preview(request.text(), 80));
            if (chunks.isEmpty()) {
                metrics.incrementArtifactFailure(backend, "empty");
                LOG.warn("Request {} has no text; no artifact produced", request.id());
                return RequestOutcome.failure(request.id(), "empty", "request text is blank");
            }

            VoiceSettings settings = voice.forSpeaker(request.speaker());
            Path output = namer.resolve(props.outputPath(), request.speaker(), settings.format());
            AudioArtifact artifact;
            try (ChunkAssembler assembler = ChunkAssembler.open(props.tempPath(), request.id())) {
                synthesis.synthesizeAll(chunks, settings, c -> assembler.write(c.index(), c.audio()));
                artifact = assembler.assemble(output, chunks.size());
            }
            provenance.append(artifact.path(), request.text());

            metrics.incrementArtifactSuccess(backend);
            LOG.info("Request completed: artifact={}, bytes={}, ms={}",
                    artifact.path(), artifact.sizeBytes(), TimeUtils.elapsedMillis(startTime));
            return RequestOutcome.success(request.id(), artifact);
        } catch (SynthesisException e) {
            metrics.incrementArtifactFailure(backend, e.getReason());
            LOG.error("Request {} failed, no artifact produced: {}", request.id(), e.getMessage(), e);
            return RequestOutcome.failure(request.id(), e.getReason(), e.getMessage());
        } catch (ArtifactIoException e) {
            metrics.incrementArtifactFailure(backend, "io");
            LOG.error("Request {} failed writing {}: {}", request.id(), e.getPath(), e.getMessage(), e);
            return RequestOutcome.failure(request.id(), "io", e.getMessage());
        } finally {
            LogContext.clearRequest();
        }
    }
}
