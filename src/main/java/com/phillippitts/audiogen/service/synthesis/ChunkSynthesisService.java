package com.phillippitts.audiogen.service.synthesis;

import com.phillippitts.audiogen.config.properties.PipelineProperties;
import com.phillippitts.audiogen.domain.SynthesizedChunk;
import com.phillippitts.audiogen.domain.TextChunk;
import com.phillippitts.audiogen.domain.VoiceSettings;
import com.phillippitts.audiogen.exception.SynthesisException;
import com.phillippitts.audiogen.exception.SynthesisExceptionBuilder;
import com.phillippitts.audiogen.service.metrics.SynthesisMetrics;
import com.phillippitts.audiogen.service.synthesis.event.BackendEventPublisher;
import com.phillippitts.audiogen.util.LogContext;
import com.phillippitts.audiogen.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Renders all chunks of one request through the configured {@link SynthesisClient}.
 *
 * <p><b>Thread Model:</b> with {@code parallelism == 1} chunks are synthesized strictly
 * sequentially on the calling thread. With a higher value they are submitted to the bounded
 * {@code synthesisExecutor} and may finish in any order; each result is stored at its chunk's
 * index, so the returned list is always in index order.
 *
 * <p><b>Error Handling:</b> the first failing chunk fails the whole request. Remaining tasks
 * are cancelled (best-effort) and the failure is rethrown unchanged. There is no per-chunk
 * retry; the only retry in the system is the session refresh inside a client.
 *
 * @see SynthesisClient
 */
@Service
public class ChunkSynthesisService {

    private static final Logger LOG = LogManager.getLogger(ChunkSynthesisService.class);

    private final SynthesisClient client;
    private final Executor executor;
    private final int parallelism;
    private final long timeoutMs;
    private final SynthesisMetrics metrics;
    private final ApplicationEventPublisher publisher;

    @Autowired
    public ChunkSynthesisService(SynthesisClient client,
                                 @Qualifier("synthesisExecutor") Executor executor,
                                 PipelineProperties props,
                                 SynthesisMetrics metrics,
                                 ApplicationEventPublisher publisher) {
        this(client, executor, props.parallelism(), props.requestTimeoutMs(), metrics, publisher);
    }

    public ChunkSynthesisService(SynthesisClient client, Executor executor, int parallelism, long timeoutMs,
                                 SynthesisMetrics metrics, ApplicationEventPublisher publisher) {
        this.client = Objects.requireNonNull(client, "client");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.parallelism = Math.max(1, parallelism);
        this.timeoutMs = timeoutMs <= 0 ? 120_000 : timeoutMs;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.publisher = publisher;
    }

    /**
     * @param chunks chunks of one request, indexed 0..n-1
     * @param voice  voice settings for every call
     * @return synthesized chunks in ascending index order
     * @throws SynthesisException on the first chunk failure
     */
    public List<SynthesizedChunk> synthesizeAll(List<TextChunk> chunks, VoiceSettings voice) {
        return synthesizeAll(chunks, voice, chunk -> { });
    }

    /**
     * Like {@link #synthesizeAll(List, VoiceSettings)}, additionally handing each chunk to
     * {@code sink} as soon as it is synthesized. With parallelism the sink is called from worker
     * threads, in completion order, at most once per index.
     *
     * @throws RuntimeException the first failure of a backend call or of the sink
     */
    public List<SynthesizedChunk> synthesizeAll(List<TextChunk> chunks, VoiceSettings voice,
                                                Consumer<SynthesizedChunk> sink) {
        Objects.requireNonNull(chunks, "chunks");
        Objects.requireNonNull(voice, "voice");
        Objects.requireNonNull(sink, "sink");
        if (parallelism == 1 || chunks.size() <= 1) {
            List<SynthesizedChunk> results = new ArrayList<>(chunks.size());
            for (TextChunk chunk : chunks) {
                SynthesizedChunk done = synthesizeOne(chunk, voice);
                sink.accept(done);
                results.add(done);
            }
            return List.copyOf(results);
        }
        return synthesizeConcurrently(chunks, voice, sink);
    }

    public String getBackendName() {
        return client.getBackendName();
    }

    private List<SynthesizedChunk> synthesizeConcurrently(List<TextChunk> chunks, VoiceSettings voice,
                                                          Consumer<SynthesizedChunk> sink) {
        SynthesizedChunk[] slots = new SynthesizedChunk[chunks.size()];
        List<CompletableFuture<Void>> futures = new ArrayList<>(chunks.size());
        for (TextChunk chunk : chunks) {
            futures.add(CompletableFuture.runAsync(LogContext.propagating(() -> {
                SynthesizedChunk done = synthesizeOne(chunk, voice);
                sink.accept(done);
                slots[chunk.index()] = done;
            }), executor));
        }

        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new));
        // Fail fast: complete "all" as soon as any chunk fails
        futures.forEach(f -> f.whenComplete((ok, err) -> {
            if (err != null) {
                all.completeExceptionally(err);
            }
        }));

        try {
            all.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            futures.forEach(f -> f.cancel(true));
            throw SynthesisExceptionBuilder.create("Synthesis timed out after " + timeoutMs + " ms")
                    .backend(client.getBackendName())
                    .withLogContext()
                    .metadata("chunks", chunks.size())
                    .transport();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw SynthesisExceptionBuilder.create("Interrupted while waiting for synthesis")
                    .backend(client.getBackendName())
                    .withLogContext()
                    .cause(ie)
                    .transport();
        } catch (ExecutionException ee) {
            futures.forEach(f -> f.cancel(true));
            throw rethrowable(ee.getCause());
        }

        List<SynthesizedChunk> ordered = Arrays.asList(slots);
        LOG.debug("Synthesized {} chunks concurrently (parallelism={})", ordered.size(), parallelism);
        return List.copyOf(ordered);
    }

    private SynthesizedChunk synthesizeOne(TextChunk chunk, VoiceSettings voice) {
        LogContext.putChunk(chunk.index());
        long startTime = System.nanoTime();
        try {
            byte[] audio = client.synthesize(chunk.text(), voice);
            metrics.recordChunkLatency(client.getBackendName(), System.nanoTime() - startTime);
            metrics.incrementChunkSuccess(client.getBackendName());
            LOG.debug("Chunk {} synthesized: chars={}, bytes={}, ms={}",
                    chunk.index(), chunk.text().length(), audio.length, TimeUtils.elapsedMillis(startTime));
            return new SynthesizedChunk(chunk.index(), audio);
        } catch (SynthesisException e) {
            metrics.incrementChunkFailure(client.getBackendName(), e.getReason());
            BackendEventPublisher.publishFailure(publisher, e);
            throw e;
        } finally {
            LogContext.clearChunk();
        }
    }

    private static RuntimeException rethrowable(Throwable t) {
        Throwable cause = t;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return new CompletionException(cause);
    }
}
