package dev.resumematcher.service;

import dev.resumematcher.config.MatchingConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Weighted combination of semantic similarity and skill coverage into a 0-100 score.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScoreCombiner {

    private static final double DEFAULT_SIMILARITY_WEIGHT = 0.6;
    private static final double DEFAULT_SKILL_WEIGHT = 0.4;

    private final MatchingConfig matchingConfig;

    /**
     * Result of scoring calculation.
     */
    public record ScoringResult(
            int overallScore,
            Map<String, Integer> breakdown) {
    }

    /**
     * Combine the two signals.
     *
     * @param similarity    cosine similarity, clamped to [0, 1]
     * @param coverageRatio skill coverage, clamped to [0, 1]
     * @return overall score in [0, 100] with the points each signal contributed
     */
    public ScoringResult combine(double similarity, double coverageRatio) {
        double s = clamp(similarity);
        double c = clamp(coverageRatio);

        double similarityWeight = Math.max(0.0, matchingConfig.getSimilarityWeight());
        double skillWeight = Math.max(0.0, matchingConfig.getSkillWeight());
        double total = similarityWeight + skillWeight;
        if (total <= 0.0 || Double.isNaN(total)) {
            similarityWeight = DEFAULT_SIMILARITY_WEIGHT;
            skillWeight = DEFAULT_SKILL_WEIGHT;
            total = 1.0;
        }
        similarityWeight /= total;
        skillWeight /= total;

        // Round once, on the weighted sum; the breakdown is derived from the rounded total
        double weighted = s * similarityWeight + c * skillWeight;
        int overall = (int) Math.round(weighted * 100);
        overall = Math.max(0, Math.min(100, overall));

        int similarityPoints = Math.min(overall, (int) Math.round(s * similarityWeight * 100));
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        breakdown.put("semantic_similarity", similarityPoints);
        breakdown.put("skill_coverage", overall - similarityPoints);

        log.debug("Combined similarity {} and coverage {} into {}", s, c, overall);
        return new ScoringResult(overall, breakdown);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
