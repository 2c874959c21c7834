package dev.resumematcher.model;

public record ResumeSearchHit(Long resumeId, String candidateName, double similarityScore) {
}
