package dev.resumematcher.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * No-op implementation of ExplanationEnhancer.
 * Used when no AI provider is configured.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "none", matchIfMissing = true)
public class NoOpExplanationEnhancer implements ExplanationEnhancer {

    public NoOpExplanationEnhancer() {
        log.info("AI explanation enhancement disabled - using template explanations");
    }

    @Override
    public Mono<String> enhance(ExplanationRequest request) {
        return Mono.just(request.templateExplanation());
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
