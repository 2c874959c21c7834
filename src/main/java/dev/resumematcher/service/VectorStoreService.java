package dev.resumematcher.service;

import dev.resumematcher.entity.JobPosting;
import dev.resumematcher.entity.Resume;
import dev.resumematcher.exception.EntityNotFoundException;
import dev.resumematcher.model.EmbeddingKind;
import dev.resumematcher.model.EmbeddingVector;
import dev.resumematcher.model.ResumeSearchHit;
import dev.resumematcher.model.SimilarityOutcome;
import dev.resumematcher.repository.JobPostingRepository;
import dev.resumematcher.repository.ResumeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes the embeddings stored on jobs and resumes, and computes cosine similarity.
 * Zero vectors are never stored; a missing vector is the "embedding unavailable" state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VectorStoreService {

    private final JobPostingRepository jobPostingRepository;
    private final ResumeRepository resumeRepository;

    @Value("${embedding.model-name:all-MiniLM-L6-v2}")
    private String modelName;

    /**
     * Store the embedding of a job or resume, replacing any previous one.
     *
     * @return false when the vector is a zero fallback and was not stored
     * @throws IllegalArgumentException for query embeddings, which are never stored
     */
    @Transactional
    public boolean save(EmbeddingKind kind, Long entityId, EmbeddingVector vector) {
        if (kind == EmbeddingKind.QUERY) {
            throw new IllegalArgumentException("Query embeddings are not persisted");
        }
        if (vector == null || vector.isZero()) {
            log.debug("Skipping store of empty embedding for {} {}", kind, entityId);
            return false;
        }

        if (kind == EmbeddingKind.JOB) {
            JobPosting job = jobPostingRepository.findById(entityId)
                    .orElseThrow(() -> new EntityNotFoundException("Job", entityId));
            job.setEmbedding(vector);
            job.setEmbeddingModel(modelName);
            job.setUpdatedAt(LocalDateTime.now());
            jobPostingRepository.save(job);
        } else {
            Resume resume = resumeRepository.findById(entityId)
                    .orElseThrow(() -> new EntityNotFoundException("Resume", entityId));
            resume.setEmbedding(vector);
            resume.setEmbeddingModel(modelName);
            resume.setProcessedAt(LocalDateTime.now());
            resumeRepository.save(resume);
        }
        return true;
    }

    public Optional<EmbeddingVector> load(EmbeddingKind kind, Long entityId) {
        return switch (kind) {
            case JOB -> jobPostingRepository.findById(entityId).map(JobPosting::getEmbedding);
            case RESUME -> resumeRepository.findById(entityId).map(Resume::getEmbedding);
            case QUERY -> Optional.empty();
        };
    }

    /**
     * Similarity of a stored job and resume embedding. A missing or zero vector on
     * either side yields 0 with low confidence.
     */
    public SimilarityOutcome similarity(Long jobId, Long resumeId) {
        Optional<EmbeddingVector> job = load(EmbeddingKind.JOB, jobId);
        Optional<EmbeddingVector> resume = load(EmbeddingKind.RESUME, resumeId);
        return similarity(job.orElse(null), resume.orElse(null));
    }

    public SimilarityOutcome similarity(EmbeddingVector a, EmbeddingVector b) {
        if (a == null || b == null || a.isZero() || b.isZero() || a.dimension() != b.dimension()) {
            return SimilarityOutcome.missing();
        }
        return new SimilarityOutcome(cosineSimilarity(a, b), false);
    }

    /**
     * Cosine similarity clamped to [0, 1]. Zero-norm inputs and mismatched dimensions give 0.
     */
    public double cosineSimilarity(EmbeddingVector a, EmbeddingVector b) {
        if (a == null || b == null) {
            return 0.0;
        }
        if (a.dimension() != b.dimension()) {
            log.warn("Embedding dimension mismatch: {} vs {}", a.dimension(), b.dimension());
            return 0.0;
        }
        double normA = a.norm();
        double normB = b.norm();
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double cosine = a.dot(b) / (normA * normB);
        if (Double.isNaN(cosine)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, cosine));
    }

    /**
     * Rank every stored resume embedding against a query vector.
     */
    public List<ResumeSearchHit> findNearestResumes(EmbeddingVector query, int limit) {
        if (query == null || query.isZero() || limit <= 0) {
            return List.of();
        }
        return resumeRepository.findByEmbeddingIsNotNull().stream()
                .map(resume -> new ResumeSearchHit(resume.getId(), resume.getCandidateName(),
                        cosineSimilarity(query, resume.getEmbedding())))
                .sorted(Comparator.comparingDouble(ResumeSearchHit::similarityScore).reversed()
                        .thenComparing(ResumeSearchHit::resumeId))
                .limit(limit)
                .toList();
    }
}
