package dev.resumematcher.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.resumematcher.config.EmbeddingConfig;
import dev.resumematcher.config.ResilienceConfig;
import dev.resumematcher.metrics.MatcherMetrics;
import dev.resumematcher.model.EmbeddingVector;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmbeddingGeneratorTest {

    private static final int DIMENSION = 4;

    @Mock
    private EmbeddingModel embeddingModel;

    private EmbeddingConfig config;
    private CircuitBreaker circuitBreaker;
    private Scheduler scheduler;
    private MeterRegistry meterRegistry;
    private EmbeddingGenerator generator;

    @BeforeEach
    void setUp() {
        config = new EmbeddingConfig();
        config.setDimension(DIMENSION);
        config.setTimeout(Duration.ofMillis(500));
        config.getBreaker().setFailureThreshold(5);
        config.getBreaker().setCoolDown(Duration.ofSeconds(60));

        circuitBreaker = new ResilienceConfig().embeddingCircuitBreaker(config);
        scheduler = Schedulers.newBoundedElastic(2, 50, "test-embedding");
        meterRegistry = new SimpleMeterRegistry();

        generator = new EmbeddingGenerator(embeddingModel, new TextPreprocessor(config), new EmbeddingCache(config),
                circuitBreaker, scheduler, new MatcherMetrics(meterRegistry), config);
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    private static Response<Embedding> embedding(float... values) {
        return Response.from(Embedding.from(values));
    }

    private static EmbeddingVector zero() {
        return EmbeddingVector.zero(DIMENSION);
    }

    @Nested
    @DisplayName("Single text")
    class SingleTextTests {

        @Test
        @DisplayName("Should return the model vector")
        void shouldReturnModelVector() {
            when(embeddingModel.embed(anyString())).thenReturn(embedding(1f, 0f, 0f, 0f));

            StepVerifier.create(generator.embed("Senior Java developer"))
                    .assertNext(v -> assertThat(v.values()).containsExactly(1f, 0f, 0f, 0f))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should embed the normalized text")
        void shouldEmbedNormalizedText() {
            when(embeddingModel.embed(anyString())).thenReturn(embedding(1f, 0f, 0f, 0f));

            generator.embed("  python \n  sql ").block();

            verify(embeddingModel).embed("python sql");
        }

        @Test
        @DisplayName("Should call the model once for the same normalized text")
        void shouldServeRepeatFromCache() {
            when(embeddingModel.embed(anyString())).thenReturn(embedding(0f, 1f, 0f, 0f));

            EmbeddingVector first = generator.embed("python sql").block();
            EmbeddingVector second = generator.embed("  python   sql ").block();

            assertThat(second).isEqualTo(first);
            verify(embeddingModel, times(1)).embed(anyString());
            assertThat(meterRegistry.counter("resume_matcher_embedding_cache_hits_total").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should return a zero vector for empty text without calling the model")
        void shouldReturnZeroForEmptyText() {
            StepVerifier.create(generator.embed("   "))
                    .assertNext(v -> assertThat(v).isEqualTo(zero()))
                    .verifyComplete();

            verifyNoInteractions(embeddingModel);
        }

        @Test
        @DisplayName("Should fall back to a zero vector when the model fails, without caching it")
        void shouldFallBackOnFailure() {
            when(embeddingModel.embed(anyString()))
                    .thenThrow(new IllegalStateException("onnx runtime error"))
                    .thenReturn(embedding(0f, 0f, 1f, 0f));

            StepVerifier.create(generator.embed("kotlin"))
                    .assertNext(v -> assertThat(v.isZero()).isTrue())
                    .verifyComplete();
            StepVerifier.create(generator.embed("kotlin"))
                    .assertNext(v -> assertThat(v.isZero()).isFalse())
                    .verifyComplete();

            assertThat(meterRegistry.counter("resume_matcher_embedding_fallbacks_total").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should treat a wrong output dimension as a failure")
        void shouldRejectWrongDimension() {
            when(embeddingModel.embed(anyString())).thenReturn(embedding(1f, 2f));

            StepVerifier.create(generator.embed("scala"))
                    .assertNext(v -> assertThat(v).isEqualTo(zero()))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should fall back to a zero vector when inference times out")
        void shouldFallBackOnTimeout() {
            when(embeddingModel.embed(anyString())).thenAnswer(invocation -> {
                Thread.sleep(2_000);
                return embedding(1f, 1f, 1f, 1f);
            });

            StepVerifier.create(generator.embed("slow text"))
                    .assertNext(v -> assertThat(v.isZero()).isTrue())
                    .expectComplete()
                    .verify(Duration.ofSeconds(2));
        }
    }

    @Nested
    @DisplayName("Circuit breaker")
    class CircuitBreakerTests {

        @Test
        @DisplayName("Should open after five failures and stop calling the model")
        void shouldOpenAfterFiveFailures() {
            when(embeddingModel.embed(anyString())).thenThrow(new IllegalStateException("model down"));

            for (int i = 0; i < 5; i++) {
                StepVerifier.create(generator.embed("text " + i))
                        .assertNext(v -> assertThat(v.isZero()).isTrue())
                        .verifyComplete();
            }
            assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);

            StepVerifier.create(generator.embed("text 6"))
                    .assertNext(v -> assertThat(v).isEqualTo(zero()))
                    .verifyComplete();

            verify(embeddingModel, times(5)).embed(anyString());
        }

        @Test
        @DisplayName("Should close again after a successful trial call when half-open")
        void shouldCloseAfterSuccessfulTrial() {
            circuitBreaker.transitionToOpenState();
            circuitBreaker.transitionToHalfOpenState();
            when(embeddingModel.embed(anyString())).thenReturn(embedding(1f, 0f, 0f, 0f));

            StepVerifier.create(generator.embed("recovered"))
                    .assertNext(v -> assertThat(v.isZero()).isFalse())
                    .verifyComplete();

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        }

        @Test
        @DisplayName("Should reopen when the half-open trial call fails")
        void shouldReopenAfterFailedTrial() {
            circuitBreaker.transitionToOpenState();
            circuitBreaker.transitionToHalfOpenState();
            when(embeddingModel.embed(anyString())).thenThrow(new IllegalStateException("still down"));

            StepVerifier.create(generator.embed("trial"))
                    .assertNext(v -> assertThat(v.isZero()).isTrue())
                    .verifyComplete();

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        }
    }

    @Nested
    @DisplayName("Batch")
    class BatchTests {

        @Test
        @DisplayName("Should preserve order and send only uncached distinct texts in one call")
        void shouldBatchMisses() {
            when(embeddingModel.embed(anyString())).thenReturn(embedding(9f, 9f, 9f, 9f));
            generator.embed("cached").block();

            when(embeddingModel.embedAll(anyList())).thenAnswer(invocation -> {
                List<TextSegment> segments = invocation.getArgument(0);
                List<Embedding> out = segments.stream()
                        .map(s -> Embedding.from(new float[]{s.text().length(), 0f, 0f, 0f}))
                        .toList();
                return Response.from(out);
            });

            List<EmbeddingVector> vectors = generator.embedBatch(List.of("ab", "cached", "", "abcd", "ab")).block();

            assertThat(vectors).hasSize(5);
            assertThat(vectors.get(0).values()[0]).isEqualTo(2f);
            assertThat(vectors.get(1).values()[0]).isEqualTo(9f);
            assertThat(vectors.get(2).isZero()).isTrue();
            assertThat(vectors.get(3).values()[0]).isEqualTo(4f);
            assertThat(vectors.get(4)).isEqualTo(vectors.get(0));
            verify(embeddingModel, times(1)).embedAll(anyList());
        }

        @Test
        @DisplayName("Should fill zero vectors when the batch call fails")
        void shouldFallBackForBatch() {
            when(embeddingModel.embedAll(anyList())).thenThrow(new IllegalStateException("batch failed"));

            List<EmbeddingVector> vectors = generator.embedBatch(List.of("one", "two")).block();

            assertThat(vectors).hasSize(2).allMatch(EmbeddingVector::isZero);
        }

        @Test
        @DisplayName("Should return an empty list for no texts")
        void shouldHandleEmptyBatch() {
            assertThat(generator.embedBatch(List.of()).block()).isEmpty();
            verifyNoInteractions(embeddingModel);
        }
    }

    @Nested
    @DisplayName("Health check")
    class HealthCheckTests {

        @Test
        @DisplayName("Should report ok with the breaker state")
        void shouldReportHealthy() {
            when(embeddingModel.embed(anyString())).thenReturn(embedding(1f, 0f, 0f, 0f));

            StepVerifier.create(generator.healthCheck())
                    .assertNext(health -> {
                        assertThat(health.ok()).isTrue();
                        assertThat(health.circuitState()).isEqualTo("CLOSED");
                        assertThat(health.latencyMs()).isGreaterThanOrEqualTo(0);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should report not ok while the breaker is open")
        void shouldReportOpenBreaker() {
            circuitBreaker.transitionToOpenState();

            StepVerifier.create(generator.healthCheck())
                    .assertNext(health -> {
                        assertThat(health.ok()).isFalse();
                        assertThat(health.circuitState()).isEqualTo("OPEN");
                    })
                    .verifyComplete();

            verifyNoInteractions(embeddingModel);
        }

        @Test
        @DisplayName("Should not count failed health checks toward the breaker")
        void shouldNotTripBreakerOnFailedChecks() {
            when(embeddingModel.embed(anyString())).thenThrow(new RuntimeException("model crashed"));

            for (int i = 0; i < 6; i++) {
                StepVerifier.create(generator.healthCheck())
                        .assertNext(health -> assertThat(health.ok()).isFalse())
                        .verifyComplete();
            }

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
            assertThat(circuitBreaker.getMetrics().getNumberOfFailedCalls()).isZero();
        }

        @Test
        @DisplayName("Should leave the half-open trial call to real traffic")
        void shouldNotConsumeHalfOpenTrial() {
            circuitBreaker.transitionToOpenState();
            circuitBreaker.transitionToHalfOpenState();

            StepVerifier.create(generator.healthCheck())
                    .assertNext(health -> {
                        assertThat(health.ok()).isFalse();
                        assertThat(health.circuitState()).isEqualTo("HALF_OPEN");
                    })
                    .verifyComplete();

            verifyNoInteractions(embeddingModel);
            assertThat(circuitBreaker.tryAcquirePermission()).isTrue();
        }
    }
}
