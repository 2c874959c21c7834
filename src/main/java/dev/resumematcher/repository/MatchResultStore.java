package dev.resumematcher.repository;

import dev.resumematcher.entity.MatchResult;

import java.util.Optional;

/**
 * Persistence contract for match results, keyed by (jobId, resumeId).
 */
public interface MatchResultStore {

    /**
     * Insert the pair as PENDING, or overwrite the computed fields of the existing row
     * while keeping its status, status audit fields and createdAt.
     *
     * @param draft computed result; id, status and timestamps are ignored
     * @return the stored row
     * @throws dev.resumematcher.exception.MatchPersistenceException when the write fails
     */
    MatchResult upsert(MatchResult draft);

    Optional<MatchResult> findByPair(Long jobId, Long resumeId);
}
