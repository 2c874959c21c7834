package dev.resumematcher.skill;

import dev.resumematcher.config.SkillVocabularyConfig;
import dev.resumematcher.config.SkillVocabularyConfig.SynonymGroup;
import dev.resumematcher.model.SkillSet;
import dev.resumematcher.model.SkillSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Vocabulary-based skill extraction.
 * <p>
 * A term matches when it is not surrounded by letters or digits, so tokens such as
 * {@code c++}, {@code c#}, {@code node.js} and {@code ci/cd} are found while {@code java}
 * does not match inside {@code javascript}. A term does not start right after a dot inside a
 * dotted token either, so {@code js} is not found in {@code node.js}. Synonym variants resolve
 * to their canonical form.
 */
@Slf4j
@Component
public class SkillExtractor {

    /** Every searchable term (vocabulary entries and synonym variants) mapped to its canonical skill. */
    private final Map<String, String> terms;
    private final Map<String, String> synonyms;
    private final Map<String, Pattern> patternCache = new ConcurrentHashMap<>();

    public SkillExtractor(SkillVocabularyConfig vocabulary) {
        Map<String, String> synonymMap = new LinkedHashMap<>();
        for (SynonymGroup group : vocabulary.getSynonyms()) {
            if (group.getCanonical() == null || group.getCanonical().isBlank()) {
                continue;
            }
            String canonical = fold(group.getCanonical());
            for (String variant : group.getVariants()) {
                if (variant != null && !variant.isBlank()) {
                    synonymMap.put(fold(variant), canonical);
                }
            }
        }
        this.synonyms = Collections.unmodifiableMap(synonymMap);

        Map<String, String> termMap = new LinkedHashMap<>();
        addAll(termMap, vocabulary.getTechnical());
        addAll(termMap, vocabulary.getSoft());
        addAll(termMap, vocabulary.getCertifications());
        synonymMap.forEach(termMap::put);
        synonymMap.values().forEach(canonical -> termMap.putIfAbsent(canonical, canonical));
        this.terms = Collections.unmodifiableMap(termMap);

        log.info("Skill vocabulary loaded: {} terms, {} synonyms", terms.size(), synonyms.size());
    }

    /**
     * Extract the known skills mentioned in a text.
     *
     * @param text   free text, may be null
     * @param source tag for the resulting set
     * @return canonical skills found, empty for null or blank text
     */
    public SkillSet extract(String text, SkillSource source) {
        if (text == null || text.isBlank()) {
            return SkillSet.empty(source);
        }

        Set<String> found = new TreeSet<>();
        for (Map.Entry<String, String> entry : terms.entrySet()) {
            if (!found.contains(entry.getValue()) && containsTerm(text, entry.getKey())) {
                found.add(entry.getValue());
            }
        }
        return new SkillSet(found, source);
    }

    /**
     * Required skills of a job: those mentioned in its text plus the explicitly listed ones.
     * Explicit skills are kept even when they are outside the vocabulary.
     */
    public SkillSet extractRequired(String jobText, Collection<String> explicitSkills) {
        Set<String> required = new TreeSet<>(extract(jobText, SkillSource.REQUIRED).skills());
        if (explicitSkills != null) {
            for (String skill : explicitSkills) {
                String normalized = normalize(skill);
                if (!normalized.isEmpty()) {
                    required.add(normalized);
                }
            }
        }
        return new SkillSet(required, SkillSource.REQUIRED);
    }

    /**
     * Case-fold a token and resolve synonyms to the canonical skill name.
     */
    public String normalize(String token) {
        if (token == null || token.isBlank()) {
            return "";
        }
        String folded = fold(token);
        return synonyms.getOrDefault(folded, folded);
    }

    private boolean containsTerm(String text, String term) {
        Pattern pattern = patternCache.computeIfAbsent(term,
                t -> Pattern.compile("(?<![a-z0-9])(?<![a-z0-9]\\.)" + Pattern.quote(t) + "(?![a-z0-9])",
                        Pattern.CASE_INSENSITIVE));
        return pattern.matcher(text).find();
    }

    private static void addAll(Map<String, String> termMap, List<String> entries) {
        for (String entry : entries) {
            if (entry != null && !entry.isBlank()) {
                String folded = fold(entry);
                termMap.putIfAbsent(folded, folded);
            }
        }
    }

    private static String fold(String token) {
        return token.trim().toLowerCase(Locale.ROOT);
    }
}
