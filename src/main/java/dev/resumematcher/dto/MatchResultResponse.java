package dev.resumematcher.dto;

import dev.resumematcher.entity.MatchResult;

import java.time.LocalDateTime;
import java.util.List;

public record MatchResultResponse(
        Long id,
        Long jobId,
        Long resumeId,
        int overallScore,
        double similarityScore,
        double skillCoverageRatio,
        List<String> matchedSkills,
        List<String> missingSkills,
        List<String> additionalSkills,
        String explanation,
        boolean lowConfidence,
        String status,
        LocalDateTime statusUpdatedAt,
        String statusUpdatedBy,
        long processingTimeMs,
        String modelVersion,
        LocalDateTime createdAt,
        LocalDateTime updatedAt) {

    public static MatchResultResponse from(MatchResult match) {
        return new MatchResultResponse(
                match.getId(),
                match.getJobId(),
                match.getResumeId(),
                match.getOverallScore(),
                match.getSimilarityScore(),
                match.getSkillCoverageRatio(),
                List.copyOf(match.matchedSkillSet()),
                List.copyOf(match.missingSkillSet()),
                List.copyOf(match.additionalSkillSet()),
                match.getExplanation(),
                match.isLowConfidence(),
                match.getStatus() != null ? match.getStatus().name() : null,
                match.getStatusUpdatedAt(),
                match.getStatusUpdatedBy(),
                match.getProcessingTimeMs(),
                match.getModelVersion(),
                match.getCreatedAt(),
                match.getUpdatedAt());
    }

    public static List<MatchResultResponse> fromAll(List<MatchResult> matches) {
        return matches.stream().map(MatchResultResponse::from).toList();
    }
}
