package dev.resumematcher.service;

import dev.resumematcher.config.SkillVocabularyConfig;
import dev.resumematcher.model.ImprovementSuggestions;
import dev.resumematcher.skill.SkillExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Template-based advice for a candidate, built from the skills they miss and their match score.
 */
@Slf4j
@Service
public class ImprovementSuggester {

    private static final int MAX_SUGGESTIONS = 5;
    private static final int NAMED_TECHNICAL = 3;
    private static final int NAMED_SOFT = 2;

    private static final List<String> GENERAL = List.of(
            "Use keywords from the job description in your resume",
            "Quantify your achievements with specific metrics and results",
            "Ensure your resume clearly demonstrates relevant experience");

    private final SkillExtractor skillExtractor;
    private final Set<String> softSkills;

    public ImprovementSuggester(SkillExtractor skillExtractor, SkillVocabularyConfig vocabulary) {
        this.skillExtractor = skillExtractor;
        this.softSkills = vocabulary.getSoft().stream()
                .filter(skill -> skill != null && !skill.isBlank())
                .map(skill -> skill.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Build up to five suggestions. Skill-specific advice comes first, then advice by score
     * band (below 40, below 70), then general resume advice.
     *
     * @param missing      skills the candidate lacks, any casing or synonym
     * @param overallScore match score in [0, 100]
     * @return the same suggestions for the same inputs
     */
    public ImprovementSuggestions suggest(Collection<String> missing, int overallScore) {
        if (overallScore < 0 || overallScore > 100) {
            throw new IllegalArgumentException("Match score must be between 0 and 100, got " + overallScore);
        }

        Set<String> technical = new TreeSet<>();
        Set<String> soft = new TreeSet<>();
        if (missing != null) {
            for (String skill : missing) {
                String normalized = skillExtractor.normalize(skill);
                if (normalized.isEmpty()) {
                    continue;
                }
                (softSkills.contains(normalized) ? soft : technical).add(normalized);
            }
        }

        List<String> suggestions = new ArrayList<>();
        if (!technical.isEmpty()) {
            suggestions.add("Consider gaining experience in: " + first(technical, NAMED_TECHNICAL));
            suggestions.add("Take online courses or certifications in the missing technical skills");
        }
        if (!soft.isEmpty()) {
            suggestions.add("Highlight or develop: " + first(soft, NAMED_SOFT));
            suggestions.add("Include specific examples demonstrating these soft skills in your resume");
        }

        if (overallScore < 40) {
            suggestions.add("Consider targeting roles that better match your current skill set");
            suggestions.add("Significantly expand your skills in this domain before applying");
        } else if (overallScore < 70) {
            suggestions.add("Tailor your resume to better highlight relevant experience");
            suggestions.add("Consider gaining 1-2 additional key skills to improve your match");
        }

        suggestions.addAll(GENERAL);

        int missingCount = technical.size() + soft.size();
        log.debug("Built suggestions for {} missing skills at score {}", missingCount, overallScore);
        return new ImprovementSuggestions(
                List.copyOf(suggestions.subList(0, Math.min(MAX_SUGGESTIONS, suggestions.size()))),
                missingCount, overallScore);
    }

    private static String first(Set<String> skills, int count) {
        return skills.stream().limit(count).collect(Collectors.joining(", "));
    }
}
