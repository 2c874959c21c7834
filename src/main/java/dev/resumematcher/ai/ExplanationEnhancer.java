package dev.resumematcher.ai;

import reactor.core.publisher.Mono;

/**
 * Rewrites a template explanation into richer prose.
 * Can be implemented by AI-powered or no-op implementations.
 */
public interface ExplanationEnhancer {

    /**
     * Enhance the template explanation of a match.
     *
     * @param request match facts and the template text
     * @return Mono with the enhanced text, or the template text when enhancement is not possible
     */
    Mono<String> enhance(ExplanationRequest request);

    /**
     * Check if AI enhancement is available.
     *
     * @return true if AI enhancement is enabled and configured
     */
    boolean isEnabled();
}
