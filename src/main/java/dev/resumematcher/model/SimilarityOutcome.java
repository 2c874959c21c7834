package dev.resumematcher.model;

/**
 * Cosine similarity between a job and a resume, flagged when either vector was unusable.
 */
public record SimilarityOutcome(double score, boolean lowConfidence) {

    public static SimilarityOutcome missing() {
        return new SimilarityOutcome(0.0, true);
    }
}
