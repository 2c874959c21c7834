package dev.resumematcher.dto;

import dev.resumematcher.entity.Resume;

import java.time.LocalDateTime;
import java.util.List;

public record ResumeResponse(
        Long id,
        String candidateName,
        String email,
        Long jobPostingId,
        List<String> skills,
        boolean embedded,
        LocalDateTime uploadedAt,
        LocalDateTime processedAt) {

    public static ResumeResponse from(Resume resume) {
        return new ResumeResponse(resume.getId(), resume.getCandidateName(), resume.getEmail(),
                resume.getJobPostingId(), List.copyOf(resume.skillSet()), resume.getEmbedding() != null,
                resume.getUploadedAt(), resume.getProcessedAt());
    }
}
