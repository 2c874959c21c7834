package dev.resumematcher.dto;

import dev.resumematcher.entity.Resume;
import jakarta.validation.constraints.NotBlank;

/**
 * A resume whose text has already been extracted from the uploaded document.
 */
public record ResumeRequest(
        @NotBlank String candidateName,
        String email,
        String content,
        Long jobPostingId) {

    public Resume toEntity() {
        return Resume.builder()
                .candidateName(candidateName)
                .email(email)
                .content(content)
                .jobPostingId(jobPostingId)
                .build();
    }
}
