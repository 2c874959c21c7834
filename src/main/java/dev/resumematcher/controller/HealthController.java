package dev.resumematcher.controller;

import dev.resumematcher.embedding.EmbeddingGenerator;
import dev.resumematcher.model.EmbeddingHealth;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
public class HealthController {

    private final EmbeddingGenerator embeddingGenerator;

    /**
     * Probe the embedding model. 503 while the model is failing or the breaker is not closed.
     */
    @GetMapping("/embedding")
    public Mono<ResponseEntity<EmbeddingHealth>> embedding() {
        return embeddingGenerator.healthCheck()
                .map(health -> ResponseEntity
                        .status(health.ok() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                        .body(health));
    }
}
