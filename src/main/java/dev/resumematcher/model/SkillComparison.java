package dev.resumematcher.model;

import java.util.Set;

/**
 * Outcome of comparing required skills against a candidate's skills.
 *
 * @param matched       required skills the candidate has
 * @param missing       required skills the candidate lacks
 * @param additional    candidate skills the job does not ask for
 * @param coverageRatio |matched| / |required|, 1.0 when nothing is required
 */
public record SkillComparison(
        Set<String> matched,
        Set<String> missing,
        Set<String> additional,
        double coverageRatio) {
}
