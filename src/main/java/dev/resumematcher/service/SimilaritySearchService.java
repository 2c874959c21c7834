package dev.resumematcher.service;

import dev.resumematcher.embedding.EmbeddingGenerator;
import dev.resumematcher.model.EmbeddableText;
import dev.resumematcher.model.ResumeSearchHit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Free-text search over stored resume embeddings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SimilaritySearchService {

    static final int DEFAULT_LIMIT = 10;
    static final int MAX_LIMIT = 100;

    private final EmbeddingGenerator embeddingGenerator;
    private final VectorStoreService vectorStore;

    public Mono<List<ResumeSearchHit>> search(String query, Integer limit) {
        if (query == null || query.isBlank()) {
            return Mono.error(new IllegalArgumentException("Search query is required"));
        }
        int effectiveLimit = limit == null || limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        EmbeddableText text = EmbeddableText.query(query);

        // Query embeddings are cached like any other text but never stored
        return embeddingGenerator.embed(text.text())
                .flatMap(vector -> {
                    if (vector.isZero()) {
                        log.warn("Similarity search unavailable: no embedding for query");
                        return Mono.just(List.<ResumeSearchHit>of());
                    }
                    return Mono.fromCallable(() -> vectorStore.findNearestResumes(vector, effectiveLimit))
                            .subscribeOn(Schedulers.boundedElastic());
                })
                .doOnNext(hits -> log.debug("Similarity search returned {} resumes", hits.size()));
    }
}
