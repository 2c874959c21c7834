package dev.resumematcher.service;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Deterministic, template-based explanation of a match score.
 */
@Service
public class ExplanationGenerator {

    private static final int NAMED_SKILLS = 3;

    /**
     * Assessment tier by overall score.
     */
    public enum Tier {
        EXCELLENT(80,
                "This candidate shows excellent alignment with the job requirements.",
                "Strongly recommended for interview."),
        GOOD(60,
                "This candidate shows good potential with some areas for development.",
                "Recommended for interview with focus on addressing skill gaps."),
        MODERATE(40,
                "This candidate shows moderate alignment with mixed qualifications.",
                "Consider for interview if other candidates are limited."),
        LIMITED(0,
                "This candidate shows limited alignment with the job requirements.",
                "Not recommended unless significant training is planned.");

        private final int minScore;
        private final String assessment;
        private final String recommendation;

        Tier(int minScore, String assessment, String recommendation) {
            this.minScore = minScore;
            this.assessment = assessment;
            this.recommendation = recommendation;
        }

        public static Tier of(int overallScore) {
            for (Tier tier : values()) {
                if (overallScore >= tier.minScore) {
                    return tier;
                }
            }
            return LIMITED;
        }

        public String assessment() {
            return assessment;
        }

        public String recommendation() {
            return recommendation;
        }
    }

    /**
     * Build the explanation paragraph.
     *
     * @param overallScore  combined score in [0, 100]
     * @param matched       required skills the candidate has
     * @param missing       required skills the candidate lacks
     * @param coverageRatio share of required skills covered
     * @return the same text for the same inputs
     */
    public String explain(int overallScore, Collection<String> matched, Collection<String> missing,
                          double coverageRatio) {
        Tier tier = Tier.of(overallScore);
        List<String> matchedSorted = sorted(matched);
        List<String> missingSorted = sorted(missing);

        List<String> strengths = new ArrayList<>();
        if (!matchedSorted.isEmpty()) {
            strengths.add("Possesses " + matchedSorted.size() + " relevant skills including "
                    + name(matchedSorted));
        }
        if (overallScore >= 50) {
            strengths.add("Resume content shows good semantic alignment with the job description");
        }
        if (strengths.isEmpty()) {
            strengths.add("Basic qualifications present in resume");
        }

        List<String> concerns = new ArrayList<>();
        if (!missingSorted.isEmpty()) {
            concerns.add("Missing " + missingSorted.size() + " key skills: " + name(missingSorted));
        }
        if (overallScore < 60) {
            concerns.add("Limited alignment between resume content and job requirements");
        }
        if (concerns.isEmpty()) {
            concerns.add("No significant concerns identified");
        }

        StringBuilder text = new StringBuilder();
        text.append("Overall Assessment\n")
                .append(tier.assessment())
                .append(String.format(Locale.ROOT,
                        " The match score of %d%% reflects the degree of alignment between the candidate's"
                                + " background and the position requirements, with %.0f%% of the required skills covered.",
                        overallScore, clampRatio(coverageRatio) * 100))
                .append("\n\nKey Strengths\n");
        strengths.forEach(s -> text.append("- ").append(s).append('\n'));
        text.append("\nAreas of Concern\n");
        concerns.forEach(c -> text.append("- ").append(c).append('\n'));
        text.append("\nRecommendation\n").append(tier.recommendation());
        return text.toString();
    }

    private static String name(List<String> skills) {
        String named = String.join(", ", skills.subList(0, Math.min(NAMED_SKILLS, skills.size())));
        int rest = skills.size() - NAMED_SKILLS;
        return rest > 0 ? named + " and " + rest + " more" : named;
    }

    private static List<String> sorted(Collection<String> skills) {
        if (skills == null) {
            return List.of();
        }
        return new ArrayList<>(new TreeSet<>(skills));
    }

    private static double clampRatio(double ratio) {
        if (Double.isNaN(ratio)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, ratio));
    }
}
