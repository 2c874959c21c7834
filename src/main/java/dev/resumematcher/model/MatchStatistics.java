package dev.resumematcher.model;

import java.util.List;

/**
 * Aggregate view of all match results for one job.
 */
public record MatchStatistics(
        Long jobId,
        int totalCandidates,
        double averageScore,
        int topScore,
        int candidatesAbove70,
        int candidatesAbove50,
        List<String> mostCommonMissingSkills) {

    public static MatchStatistics empty(Long jobId) {
        return new MatchStatistics(jobId, 0, 0.0, 0, 0, 0, List.of());
    }
}
