package dev.resumematcher.dto;

import dev.resumematcher.entity.JobPosting;

import java.time.LocalDateTime;
import java.util.List;

public record JobResponse(
        Long id,
        String title,
        String company,
        String location,
        boolean active,
        List<String> requiredSkills,
        boolean embedded,
        LocalDateTime createdAt,
        LocalDateTime updatedAt) {

    public static JobResponse from(JobPosting job) {
        return new JobResponse(job.getId(), job.getTitle(), job.getCompany(), job.getLocation(),
                job.isActive(), List.copyOf(job.requiredSkillSet()), job.getEmbedding() != null,
                job.getCreatedAt(), job.getUpdatedAt());
    }
}
