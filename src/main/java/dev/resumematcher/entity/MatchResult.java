package dev.resumematcher.entity;

import dev.resumematcher.model.SkillSet;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.Set;

/**
 * Score and evidence for one (job, resume) pair. At most one row exists per pair.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "match_results",
        uniqueConstraints = @UniqueConstraint(name = "uk_match_job_resume", columnNames = {"job_id", "resume_id"}),
        indexes = {
                @Index(name = "idx_match_job_score", columnList = "job_id, overall_score"),
                @Index(name = "idx_match_resume", columnList = "resume_id")
        })
public class MatchResult {

    /** Highest score first, then earliest created, then id for a stable order. */
    public static final Comparator<MatchResult> RANKING = Comparator
            .comparingInt(MatchResult::getOverallScore).reversed()
            .thenComparing(MatchResult::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(MatchResult::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false)
    private Long jobId;

    @Column(name = "resume_id", nullable = false)
    private Long resumeId;

    @Column(nullable = false)
    private double similarityScore;

    @Column(nullable = false)
    private double skillCoverageRatio;

    @Column(name = "overall_score", nullable = false)
    private int overallScore;

    @Column(length = 4096)
    private String matchedSkills;

    @Column(length = 4096)
    private String missingSkills;

    @Column(length = 4096)
    private String additionalSkills;

    @Column(length = 100_000)
    private String explanation;

    @Column(nullable = false)
    private boolean lowConfidence;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private MatchStatus status = MatchStatus.PENDING;

    private LocalDateTime statusUpdatedAt;

    private String statusUpdatedBy;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private long processingTimeMs;

    private String modelVersion;

    public Set<String> matchedSkillSet() {
        return SkillSet.fromColumn(matchedSkills);
    }

    public Set<String> missingSkillSet() {
        return SkillSet.fromColumn(missingSkills);
    }

    public Set<String> additionalSkillSet() {
        return SkillSet.fromColumn(additionalSkills);
    }
}
