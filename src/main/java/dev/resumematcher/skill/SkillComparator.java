package dev.resumematcher.skill;

import dev.resumematcher.model.SkillComparison;
import dev.resumematcher.model.SkillSet;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Set comparison of a job's required skills against a candidate's skills.
 */
@Component
public class SkillComparator {

    public SkillComparison compare(SkillSet required, SkillSet candidate) {
        SortedSet<String> requiredSkills = required != null ? new TreeSet<>(required.skills()) : new TreeSet<>();
        SortedSet<String> candidateSkills = candidate != null ? new TreeSet<>(candidate.skills()) : new TreeSet<>();

        SortedSet<String> matched = new TreeSet<>(requiredSkills);
        matched.retainAll(candidateSkills);

        SortedSet<String> missing = new TreeSet<>(requiredSkills);
        missing.removeAll(candidateSkills);

        SortedSet<String> additional = new TreeSet<>(candidateSkills);
        additional.removeAll(requiredSkills);

        // Nothing required means nothing can be missing
        double coverage = requiredSkills.isEmpty()
                ? 1.0
                : (double) matched.size() / requiredSkills.size();

        return new SkillComparison(
                Collections.unmodifiableSortedSet(matched),
                Collections.unmodifiableSortedSet(missing),
                Collections.unmodifiableSortedSet(additional),
                coverage);
    }
}
