package dev.resumematcher.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Case-folded, deduplicated set of skill tokens tagged with where they came from.
 */
public record SkillSet(Set<String> skills, SkillSource source) {

    private static final String COLUMN_SEPARATOR = ",";

    public SkillSet {
        TreeSet<String> folded = new TreeSet<>();
        if (skills != null) {
            for (String skill : skills) {
                if (skill != null && !skill.isBlank()) {
                    folded.add(skill.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        skills = Collections.unmodifiableSortedSet(folded);
    }

    public static SkillSet empty(SkillSource source) {
        return new SkillSet(Set.of(), source);
    }

    public static SkillSet of(SkillSource source, String... skills) {
        return new SkillSet(new TreeSet<>(Arrays.asList(skills)), source);
    }

    public int size() {
        return skills.size();
    }

    public boolean isEmpty() {
        return skills.isEmpty();
    }

    public boolean contains(String skill) {
        return skill != null && skills.contains(skill.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Encode a skill collection for a single text column.
     */
    public static String toColumn(Collection<String> skills) {
        if (skills == null || skills.isEmpty()) {
            return "";
        }
        return skills.stream()
                .sorted()
                .collect(Collectors.joining(COLUMN_SEPARATOR));
    }

    /**
     * Decode a column written by {@link #toColumn(Collection)}.
     */
    public static Set<String> fromColumn(String column) {
        if (column == null || column.isBlank()) {
            return Collections.emptySortedSet();
        }
        return Collections.unmodifiableSortedSet(Arrays.stream(column.split(COLUMN_SEPARATOR))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(TreeSet::new)));
    }
}
