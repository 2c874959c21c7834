package dev.resumematcher.repository;

import dev.resumematcher.entity.MatchResult;
import dev.resumematcher.entity.MatchStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository for match results. Listings are ordered by score, then creation time.
 */
@Repository
public interface MatchResultRepository extends JpaRepository<MatchResult, Long> {

    Optional<MatchResult> findByJobIdAndResumeId(Long jobId, Long resumeId);

    List<MatchResult> findByJobIdOrderByOverallScoreDescCreatedAtAscIdAsc(Long jobId);

    List<MatchResult> findByJobIdAndStatusOrderByOverallScoreDescCreatedAtAscIdAsc(Long jobId, MatchStatus status);

    List<MatchResult> findByResumeIdOrderByOverallScoreDescCreatedAtAscIdAsc(Long resumeId);

    long countByJobId(Long jobId);

    /**
     * Overwrite the computed fields of an existing pair. Status, its audit fields and
     * createdAt are left untouched.
     *
     * @return number of rows updated, 0 when the pair does not exist yet
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            UPDATE MatchResult m SET
                m.similarityScore = :similarityScore,
                m.skillCoverageRatio = :skillCoverageRatio,
                m.overallScore = :overallScore,
                m.matchedSkills = :matchedSkills,
                m.missingSkills = :missingSkills,
                m.additionalSkills = :additionalSkills,
                m.explanation = :explanation,
                m.lowConfidence = :lowConfidence,
                m.processingTimeMs = :processingTimeMs,
                m.modelVersion = :modelVersion,
                m.updatedAt = :updatedAt
            WHERE m.jobId = :jobId AND m.resumeId = :resumeId
            """)
    int updateScores(@Param("jobId") Long jobId,
                     @Param("resumeId") Long resumeId,
                     @Param("similarityScore") double similarityScore,
                     @Param("skillCoverageRatio") double skillCoverageRatio,
                     @Param("overallScore") int overallScore,
                     @Param("matchedSkills") String matchedSkills,
                     @Param("missingSkills") String missingSkills,
                     @Param("additionalSkills") String additionalSkills,
                     @Param("explanation") String explanation,
                     @Param("lowConfidence") boolean lowConfidence,
                     @Param("processingTimeMs") long processingTimeMs,
                     @Param("modelVersion") String modelVersion,
                     @Param("updatedAt") LocalDateTime updatedAt);

    default int updateScores(MatchResult draft, LocalDateTime updatedAt) {
        return updateScores(draft.getJobId(), draft.getResumeId(),
                draft.getSimilarityScore(), draft.getSkillCoverageRatio(), draft.getOverallScore(),
                draft.getMatchedSkills(), draft.getMissingSkills(), draft.getAdditionalSkills(),
                draft.getExplanation(), draft.isLowConfidence(),
                draft.getProcessingTimeMs(), draft.getModelVersion(), updatedAt);
    }
}
