package dev.resumematcher.dto;

import dev.resumematcher.entity.JobPosting;
import dev.resumematcher.model.SkillSet;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record JobRequest(
        @NotBlank String title,
        String company,
        String description,
        String requirements,
        String location,
        List<String> requiredSkills) {

    public JobPosting toEntity() {
        return JobPosting.builder()
                .title(title)
                .company(company)
                .description(description)
                .requirements(requirements)
                .location(location)
                .requiredSkills(SkillSet.toColumn(requiredSkills))
                .build();
    }
}
