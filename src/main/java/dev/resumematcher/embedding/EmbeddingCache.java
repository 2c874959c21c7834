package dev.resumematcher.embedding;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import dev.resumematcher.config.EmbeddingConfig;
import dev.resumematcher.model.EmbeddingVector;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Content-addressed embedding cache keyed by the SHA-256 of the normalized text.
 * Entries are immutable once written, so a miss only means "not computed yet".
 */
@Slf4j
@Component
public class EmbeddingCache {

    private final Cache<String, EmbeddingVector> cache;
    private final Duration defaultTtl;

    @Autowired
    public EmbeddingCache(EmbeddingConfig embeddingConfig) {
        this(embeddingConfig, Ticker.systemTicker());
    }

    EmbeddingCache(EmbeddingConfig embeddingConfig, Ticker ticker) {
        this.defaultTtl = embeddingConfig.getCache().getTtl();
        this.cache = Caffeine.newBuilder()
                .maximumSize(embeddingConfig.getCache().getMaxSize())
                .expireAfter(new Expiry<String, EmbeddingVector>() {
                    @Override
                    public long expireAfterCreate(String key, EmbeddingVector value, long currentTime) {
                        return defaultTtl.toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, EmbeddingVector value,
                                                  long currentTime, long currentDuration) {
                        return defaultTtl.toNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, EmbeddingVector value,
                                                long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .ticker(ticker)
                .recordStats()
                .build();
    }

    public Optional<EmbeddingVector> get(String normalizedText) {
        return Optional.ofNullable(cache.getIfPresent(keyFor(normalizedText)));
    }

    public void put(String normalizedText, EmbeddingVector embedding) {
        cache.put(keyFor(normalizedText), embedding);
    }

    public void put(String normalizedText, EmbeddingVector embedding, Duration ttl) {
        String key = keyFor(normalizedText);
        cache.policy().expireVariably().ifPresentOrElse(
                expiration -> expiration.put(key, embedding, ttl),
                () -> cache.put(key, embedding));
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public long missCount() {
        return cache.stats().missCount();
    }

    static String keyFor(String normalizedText) {
        return DigestUtils.sha256Hex(normalizedText);
    }
}
