package dev.resumematcher.model;

import java.util.List;

public record ImprovementSuggestions(List<String> suggestions, int missingSkillsCount, int matchScore) {
}
