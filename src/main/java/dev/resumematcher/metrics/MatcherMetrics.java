package dev.resumematcher.metrics;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for the matching pipeline.
 */
@Component
public class MatcherMetrics {

    private final MeterRegistry registry;

    // Counters
    private final Counter matchesComputedCounter;
    private final Counter matchFailuresCounter;
    private final Counter cacheHitsCounter;
    private final Counter cacheMissesCounter;
    private final Counter embeddingFallbacksCounter;
    private final Counter enhancerFallbacksCounter;

    // Timers
    private final Timer inferenceTimer;
    private final Timer matchTimer;

    // Gauges
    private final AtomicInteger lastBatchMatched = new AtomicInteger(0);

    public MatcherMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.matchesComputedCounter = Counter.builder("resume_matcher_matches_computed_total")
                .description("Total match results computed and stored")
                .register(registry);

        this.matchFailuresCounter = Counter.builder("resume_matcher_match_failures_total")
                .description("Total match attempts that failed to persist")
                .register(registry);

        this.cacheHitsCounter = Counter.builder("resume_matcher_embedding_cache_hits_total")
                .description("Embedding requests served from cache")
                .register(registry);

        this.cacheMissesCounter = Counter.builder("resume_matcher_embedding_cache_misses_total")
                .description("Embedding requests that required inference")
                .register(registry);

        this.embeddingFallbacksCounter = Counter.builder("resume_matcher_embedding_fallbacks_total")
                .description("Embedding requests answered with the zero-vector fallback")
                .register(registry);

        this.enhancerFallbacksCounter = Counter.builder("resume_matcher_explanation_fallbacks_total")
                .description("Explanations that fell back to the template text")
                .register(registry);

        this.inferenceTimer = Timer.builder("resume_matcher_embedding_inference_duration")
                .description("Time spent in embedding model inference")
                .register(registry);

        this.matchTimer = Timer.builder("resume_matcher_match_duration")
                .description("Time to compute and store one match result")
                .register(registry);

        Gauge.builder("resume_matcher_last_batch_matched", lastBatchMatched, AtomicInteger::get)
                .description("Match results produced by the last job-wide trigger")
                .register(registry);
    }

    /**
     * Expose the circuit breaker state (0 closed, 1 open, 2 half-open, other states above).
     */
    public void bindCircuitBreaker(CircuitBreaker circuitBreaker) {
        Gauge.builder("resume_matcher_embedding_circuit_state", circuitBreaker,
                        cb -> cb.getState().getOrder())
                .description("Embedding circuit breaker state")
                .tag("name", circuitBreaker.getName())
                .register(registry);
    }

    public void recordMatchComputed() {
        matchesComputedCounter.increment();
    }

    public void recordMatchFailure() {
        matchFailuresCounter.increment();
    }

    public void recordCacheHit() {
        cacheHitsCounter.increment();
    }

    public void recordCacheMiss() {
        cacheMissesCounter.increment();
    }

    public void recordEmbeddingFallback(int count) {
        embeddingFallbacksCounter.increment(count);
    }

    public void recordEnhancerFallback() {
        enhancerFallbacksCounter.increment();
    }

    public void recordInferenceLatency(long latencyMs) {
        inferenceTimer.record(Duration.ofMillis(latencyMs));
    }

    public void recordMatchLatency(long latencyMs) {
        matchTimer.record(Duration.ofMillis(latencyMs));
    }

    public void updateLastBatch(int matched) {
        lastBatchMatched.set(matched);
    }
}
