package dev.resumematcher.repository;

import dev.resumematcher.entity.Resume;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for candidate resumes.
 */
@Repository
public interface ResumeRepository extends JpaRepository<Resume, Long> {

    /**
     * Resumes submitted for a specific job.
     */
    List<Resume> findByJobPostingId(Long jobPostingId);

    /**
     * Resumes that have a stored embedding, for similarity search.
     */
    List<Resume> findByEmbeddingIsNotNull();
}
