package dev.resumematcher.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Trigger matching for one pair (resumeId), for a chosen set of resumes (resumeIds), or for
 * every candidate of a job when neither is given.
 */
public record MatchRequest(
        @NotNull Long jobId,
        Long resumeId,
        List<Long> resumeIds,
        @Min(0) @Max(100) Integer minScoreThreshold,
        @Min(1) Integer maxResults) {
}
