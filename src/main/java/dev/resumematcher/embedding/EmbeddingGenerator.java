package dev.resumematcher.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.resumematcher.config.EmbeddingConfig;
import dev.resumematcher.metrics.MatcherMetrics;
import dev.resumematcher.model.EmbeddingHealth;
import dev.resumematcher.model.EmbeddingVector;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns text into embedding vectors.
 * <p>
 * Inference runs on the bounded embedding worker pool, guarded by a timeout and a circuit breaker.
 * Any failure, including an open breaker, degrades to a zero vector of the model dimension;
 * callers never see an error from this service.
 */
@Slf4j
@Service
public class EmbeddingGenerator {

    private static final String HEALTH_PROBE = "health check";

    private final EmbeddingModel embeddingModel;
    private final TextPreprocessor preprocessor;
    private final EmbeddingCache cache;
    private final CircuitBreaker circuitBreaker;
    private final Scheduler scheduler;
    private final MatcherMetrics metrics;
    private final EmbeddingConfig config;

    public EmbeddingGenerator(EmbeddingModel embeddingModel,
                              TextPreprocessor preprocessor,
                              EmbeddingCache cache,
                              CircuitBreaker embeddingCircuitBreaker,
                              @Qualifier("embeddingScheduler") Scheduler scheduler,
                              MatcherMetrics metrics,
                              EmbeddingConfig config) {
        this.embeddingModel = embeddingModel;
        this.preprocessor = preprocessor;
        this.cache = cache;
        this.circuitBreaker = embeddingCircuitBreaker;
        this.scheduler = scheduler;
        this.metrics = metrics;
        this.config = config;
        metrics.bindCircuitBreaker(embeddingCircuitBreaker);
    }

    /**
     * Embed a single text.
     *
     * @param text raw text, may be null
     * @return Mono with the vector; a zero vector for empty text or when inference is unavailable
     */
    public Mono<EmbeddingVector> embed(String text) {
        return Mono.defer(() -> {
            String normalized = preprocessor.normalize(text);
            if (normalized.isEmpty()) {
                return Mono.just(zeroVector());
            }

            var cached = cache.get(normalized);
            if (cached.isPresent()) {
                metrics.recordCacheHit();
                return Mono.just(cached.get());
            }
            metrics.recordCacheMiss();

            return guarded(Mono.fromCallable(() -> infer(normalized)))
                    .doOnNext(vector -> cache.put(normalized, vector))
                    .onErrorResume(e -> {
                        log.warn("Embedding unavailable, using zero vector: {}", describe(e));
                        metrics.recordEmbeddingFallback(1);
                        return Mono.just(zeroVector());
                    });
        });
    }

    /**
     * Embed several texts, preserving order. Cached texts are served from cache and the
     * remaining distinct texts go to the model in a single call.
     */
    public Mono<List<EmbeddingVector>> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return Mono.just(List.of());
        }

        return Mono.defer(() -> {
            List<String> normalized = texts.stream().map(preprocessor::normalize).toList();
            Map<String, EmbeddingVector> resolved = new LinkedHashMap<>();
            List<String> pending = new ArrayList<>();

            for (String text : normalized) {
                if (text.isEmpty() || resolved.containsKey(text) || pending.contains(text)) {
                    continue;
                }
                var cached = cache.get(text);
                if (cached.isPresent()) {
                    metrics.recordCacheHit();
                    resolved.put(text, cached.get());
                } else {
                    metrics.recordCacheMiss();
                    pending.add(text);
                }
            }

            if (pending.isEmpty()) {
                return Mono.just(assemble(normalized, resolved));
            }

            log.debug("Embedding batch: {} texts, {} cached, {} sent to model",
                    texts.size(), resolved.size(), pending.size());

            return guarded(Mono.fromCallable(() -> inferAll(pending)))
                    .map(vectors -> {
                        for (int i = 0; i < pending.size(); i++) {
                            cache.put(pending.get(i), vectors.get(i));
                            resolved.put(pending.get(i), vectors.get(i));
                        }
                        return assemble(normalized, resolved);
                    })
                    .onErrorResume(e -> {
                        log.warn("Batch embedding unavailable for {} texts, using zero vectors: {}",
                                pending.size(), describe(e));
                        metrics.recordEmbeddingFallback(pending.size());
                        return Mono.just(assemble(normalized, resolved));
                    });
        });
    }

    /**
     * Probe the model with a fixed text, bypassing the cache.
     * <p>
     * The probe does not pass through the circuit breaker: its outcome never counts toward the
     * failure window, and while the breaker is not closed the state is reported without calling
     * the model, so the half-open trial call stays with real traffic.
     */
    public Mono<EmbeddingHealth> healthCheck() {
        return Mono.defer(() -> {
            CircuitBreaker.State state = circuitBreaker.getState();
            if (state != CircuitBreaker.State.CLOSED) {
                log.debug("Embedding health check skipped, breaker is {}", state);
                return Mono.just(new EmbeddingHealth(false, 0, state.name()));
            }

            long start = System.currentTimeMillis();
            return Mono.fromCallable(() -> infer(HEALTH_PROBE))
                    .subscribeOn(scheduler)
                    .timeout(config.getTimeout())
                    .map(vector -> new EmbeddingHealth(true, System.currentTimeMillis() - start,
                            circuitBreaker.getState().name()))
                    .onErrorResume(e -> {
                        log.warn("Embedding health check failed: {}", describe(e));
                        return Mono.just(new EmbeddingHealth(false, System.currentTimeMillis() - start,
                                circuitBreaker.getState().name()));
                    });
        });
    }

    public String modelVersion() {
        return config.getModelName();
    }

    public int dimension() {
        return config.getDimension();
    }

    public EmbeddingVector zeroVector() {
        return EmbeddingVector.zero(config.getDimension());
    }

    private <T> Mono<T> guarded(Mono<T> inference) {
        return inference
                .subscribeOn(scheduler)
                .timeout(config.getTimeout())
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker));
    }

    private EmbeddingVector infer(String normalized) {
        long start = System.currentTimeMillis();
        Embedding embedding = embeddingModel.embed(normalized).content();
        metrics.recordInferenceLatency(System.currentTimeMillis() - start);
        return toVector(embedding);
    }

    private List<EmbeddingVector> inferAll(List<String> normalized) {
        long start = System.currentTimeMillis();
        List<TextSegment> segments = normalized.stream().map(TextSegment::from).toList();
        List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
        metrics.recordInferenceLatency(System.currentTimeMillis() - start);

        if (embeddings == null || embeddings.size() != normalized.size()) {
            throw new IllegalStateException("Model returned "
                    + (embeddings == null ? 0 : embeddings.size()) + " embeddings for "
                    + normalized.size() + " texts");
        }
        return embeddings.stream().map(this::toVector).toList();
    }

    private EmbeddingVector toVector(Embedding embedding) {
        if (embedding == null || embedding.vector() == null) {
            throw new IllegalStateException("Model returned no embedding");
        }
        float[] values = embedding.vector();
        if (values.length != config.getDimension()) {
            throw new IllegalStateException("Model returned dimension " + values.length
                    + ", expected " + config.getDimension());
        }
        return new EmbeddingVector(values);
    }

    private List<EmbeddingVector> assemble(List<String> normalized, Map<String, EmbeddingVector> resolved) {
        EmbeddingVector zero = zeroVector();
        return normalized.stream()
                .map(text -> resolved.getOrDefault(text, zero))
                .toList();
    }

    private static String describe(Throwable e) {
        return e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : "");
    }
}
