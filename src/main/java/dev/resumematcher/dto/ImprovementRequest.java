package dev.resumematcher.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ImprovementRequest(List<String> missingSkills, @NotNull @Min(0) @Max(100) Integer matchScore) {
}
