package com.phillippitts.audiogen.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for audio generation.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Chunk synthesis latency per backend (polly, http)</li>
 *   <li>Chunk success/failure rates per backend, failures tagged with a reason</li>
 *   <li>Artifacts produced and requests failed</li>
 *   <li>Session acquisition attempts</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class SynthesisMetrics {

    private static final String METRIC_PREFIX = "audiogen";

    private final MeterRegistry registry;

    public SynthesisMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the latency of one backend call.
     *
     * @param backend backend name (polly, http)
     * @param durationNanos duration in nanoseconds
     */
    public void recordChunkLatency(String backend, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".chunk.latency")
                .description("Time taken to synthesize one chunk")
                .tag("backend", backend)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementChunkSuccess(String backend) {
        Counter.builder(METRIC_PREFIX + ".chunk.success")
                .description("Number of chunks synthesized")
                .tag("backend", backend)
                .register(registry)
                .increment();
    }

    /**
     * @param backend backend name
     * @param reason failure reason (transport, decode, status-text_too_long, ...)
     */
    public void incrementChunkFailure(String backend, String reason) {
        Counter.builder(METRIC_PREFIX + ".chunk.failure")
                .description("Number of failed chunk synthesis calls")
                .tag("backend", backend)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementArtifactSuccess(String backend) {
        Counter.builder(METRIC_PREFIX + ".artifact.success")
                .description("Number of audio artifacts produced")
                .tag("backend", backend)
                .register(registry)
                .increment();
    }

    public void incrementArtifactFailure(String backend, String reason) {
        Counter.builder(METRIC_PREFIX + ".artifact.failure")
                .description("Number of requests that produced no artifact")
                .tag("backend", backend)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param backend backend name
     * @param outcome success or failure
     */
    public void recordAuthAttempt(String backend, String outcome) {
        Counter.builder(METRIC_PREFIX + ".auth.attempts")
                .description("Number of session acquisition attempts")
                .tag("backend", backend)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
