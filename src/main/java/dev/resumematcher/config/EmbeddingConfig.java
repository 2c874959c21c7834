package dev.resumematcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for embedding generation, caching and the inference circuit breaker.
 * Loaded from application.yml under 'embedding' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "embedding")
public class EmbeddingConfig {

    private String modelName = "all-MiniLM-L6-v2";
    private int dimension = 384;
    private int maxTextLength = 8000;
    private Duration timeout = Duration.ofSeconds(10);
    private int workerPoolSize = 4;
    private int workerQueueCapacity = 200;
    private Cache cache = new Cache();
    private Breaker breaker = new Breaker();

    @Data
    public static class Cache {
        private Duration ttl = Duration.ofHours(24);
        private long maxSize = 10_000;
    }

    @Data
    public static class Breaker {
        private int failureThreshold = 5;
        private float failureRateThreshold = 100.0f;
        private Duration coolDown = Duration.ofSeconds(60);
    }
}
