package dev.resumematcher.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Circuit breaker and bounded worker pool for embedding inference.
 */
@Slf4j
@Configuration
public class ResilienceConfig {

    @Bean
    public CircuitBreaker embeddingCircuitBreaker(EmbeddingConfig embeddingConfig) {
        EmbeddingConfig.Breaker breaker = embeddingConfig.getBreaker();
        int window = Math.max(1, breaker.getFailureThreshold());

        // N failures within the last N calls opens the breaker; one trial call when half-open
        var cfg = CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(window)
                .minimumNumberOfCalls(window)
                .failureRateThreshold(breaker.getFailureRateThreshold())
                .waitDurationInOpenState(breaker.getCoolDown())
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();

        CircuitBreaker circuitBreaker = CircuitBreaker.of("embedding", cfg);
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn("Embedding circuit breaker: {}",
                        event.getStateTransition()));
        return circuitBreaker;
    }

    @Bean("embeddingExecutor")
    public ThreadPoolTaskExecutor embeddingExecutor(EmbeddingConfig embeddingConfig) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(embeddingConfig.getWorkerPoolSize());
        executor.setMaxPoolSize(embeddingConfig.getWorkerPoolSize());
        executor.setQueueCapacity(embeddingConfig.getWorkerQueueCapacity());
        // Rejected work surfaces as an inference failure and takes the fallback path
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setThreadNamePrefix("EmbeddingWorker-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "embeddingScheduler", destroyMethod = "dispose")
    public Scheduler embeddingScheduler(@Qualifier("embeddingExecutor") ThreadPoolTaskExecutor embeddingExecutor) {
        return Schedulers.fromExecutor(embeddingExecutor);
    }
}
