package dev.resumematcher.repository;

import dev.resumematcher.entity.MatchResult;
import dev.resumematcher.entity.MatchStatus;
import dev.resumematcher.exception.MatchPersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Upsert on top of the unique (job_id, resume_id) constraint.
 * <p>
 * The update runs first; when no row exists the result is inserted. An insert that loses a
 * race against a concurrent insert of the same pair is retried as an update in a fresh
 * transaction, since the failed one is already marked rollback-only.
 */
@Slf4j
@Repository
public class JpaMatchResultStore implements MatchResultStore {

    private final MatchResultRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate retryTemplate;

    public JpaMatchResultStore(MatchResultRepository repository, PlatformTransactionManager transactionManager) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.retryTemplate = new TransactionTemplate(transactionManager);
        this.retryTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public MatchResult upsert(MatchResult draft) {
        try {
            return transactionTemplate.execute(status -> updateOrInsert(draft));
        } catch (DataIntegrityViolationException race) {
            log.debug("Concurrent insert for job {} / resume {}, retrying as update",
                    draft.getJobId(), draft.getResumeId());
            return retryAsUpdate(draft);
        } catch (DataAccessException | TransactionException e) {
            throw new MatchPersistenceException(draft.getJobId(), draft.getResumeId(), e);
        }
    }

    @Override
    public Optional<MatchResult> findByPair(Long jobId, Long resumeId) {
        return repository.findByJobIdAndResumeId(jobId, resumeId);
    }

    private MatchResult updateOrInsert(MatchResult draft) {
        LocalDateTime now = LocalDateTime.now();
        if (repository.updateScores(draft, now) > 0) {
            log.debug("Updated match for job {} / resume {}", draft.getJobId(), draft.getResumeId());
            return reload(draft);
        }

        MatchResult inserted = repository.saveAndFlush(MatchResult.builder()
                .jobId(draft.getJobId())
                .resumeId(draft.getResumeId())
                .similarityScore(draft.getSimilarityScore())
                .skillCoverageRatio(draft.getSkillCoverageRatio())
                .overallScore(draft.getOverallScore())
                .matchedSkills(draft.getMatchedSkills())
                .missingSkills(draft.getMissingSkills())
                .additionalSkills(draft.getAdditionalSkills())
                .explanation(draft.getExplanation())
                .lowConfidence(draft.isLowConfidence())
                .processingTimeMs(draft.getProcessingTimeMs())
                .modelVersion(draft.getModelVersion())
                .status(MatchStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.debug("Inserted match {} for job {} / resume {}",
                inserted.getId(), draft.getJobId(), draft.getResumeId());
        return inserted;
    }

    private MatchResult retryAsUpdate(MatchResult draft) {
        try {
            return retryTemplate.execute(status -> {
                if (repository.updateScores(draft, LocalDateTime.now()) == 0) {
                    throw new MatchPersistenceException(draft.getJobId(), draft.getResumeId(),
                            "row vanished after insert conflict");
                }
                return reload(draft);
            });
        } catch (DataAccessException | TransactionException e) {
            throw new MatchPersistenceException(draft.getJobId(), draft.getResumeId(), e);
        }
    }

    private MatchResult reload(MatchResult draft) {
        return repository.findByJobIdAndResumeId(draft.getJobId(), draft.getResumeId())
                .orElseThrow(() -> new MatchPersistenceException(draft.getJobId(), draft.getResumeId(),
                        "row not readable after update"));
    }
}
