package dev.resumematcher.ai;

import java.util.Set;

/**
 * Facts about a match handed to an {@link ExplanationEnhancer}.
 */
public record ExplanationRequest(
        String jobTitle,
        String candidateName,
        int overallScore,
        Set<String> matchedSkills,
        Set<String> missingSkills,
        double coverageRatio,
        String templateExplanation) {
}
