package dev.resumematcher.service;

import dev.resumematcher.config.MatchingConfig;
import dev.resumematcher.embedding.EmbeddingGenerator;
import dev.resumematcher.entity.JobPosting;
import dev.resumematcher.entity.Resume;
import dev.resumematcher.exception.EntityNotFoundException;
import dev.resumematcher.model.EmbeddingKind;
import dev.resumematcher.model.SkillSet;
import dev.resumematcher.model.SkillSource;
import dev.resumematcher.repository.JobPostingRepository;
import dev.resumematcher.repository.ResumeRepository;
import dev.resumematcher.skill.SkillExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDateTime;
import java.util.TreeSet;

/**
 * Stores incoming job postings and resumes with their skill sets and embeddings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    private final JobPostingRepository jobPostingRepository;
    private final ResumeRepository resumeRepository;
    private final SkillExtractor skillExtractor;
    private final EmbeddingGenerator embeddingGenerator;
    private final VectorStoreService vectorStore;
    private final MatchingService matchingService;
    private final MatchingConfig matchingConfig;

    /**
     * Store a job posting, extract its required skills and embed its text.
     * An embedding failure leaves the job without a vector; it is generated again at match time.
     */
    public Mono<JobPosting> ingestJob(JobPosting draft) {
        return Mono.fromCallable(() -> {
                    LocalDateTime now = LocalDateTime.now();
                    TreeSet<String> explicit = new TreeSet<>();
                    draft.explicitSkillSet().forEach(s -> {
                        String normalized = skillExtractor.normalize(s);
                        if (!normalized.isEmpty()) {
                            explicit.add(normalized);
                        }
                    });
                    SkillSet required = skillExtractor.extractRequired(draft.embeddingText(), explicit);

                    draft.setId(null);
                    draft.setRequiredSkills(SkillSet.toColumn(explicit));
                    draft.setSkills(SkillSet.toColumn(required.skills()));
                    draft.setEmbedding(null);
                    draft.setActive(true);
                    draft.setCreatedAt(now);
                    draft.setUpdatedAt(now);
                    JobPosting saved = jobPostingRepository.save(draft);
                    log.info("Ingested job {} '{}' with {} required skills",
                            saved.getId(), saved.getTitle(), required.size());
                    return saved;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(job -> embedAndStore(EmbeddingKind.JOB, job.getId(), job.embeddingText())
                        .then(reloadJob(job.getId())));
    }

    /**
     * Store a resume, extract its skills and embed its content. A resume submitted for a job
     * is matched against it right away when auto-matching is on; a failed match does not fail
     * the ingestion.
     */
    public Mono<Resume> ingestResume(Resume draft) {
        return Mono.fromCallable(() -> {
                    if (draft.getJobPostingId() != null && !jobPostingRepository.existsById(draft.getJobPostingId())) {
                        throw new EntityNotFoundException("Job", draft.getJobPostingId());
                    }
                    SkillSet skills = skillExtractor.extract(draft.getContent(), SkillSource.EXTRACTED);

                    draft.setId(null);
                    draft.setSkills(SkillSet.toColumn(skills.skills()));
                    draft.setEmbedding(null);
                    draft.setUploadedAt(LocalDateTime.now());
                    Resume saved = resumeRepository.save(draft);
                    log.info("Ingested resume {} for '{}' with {} skills",
                            saved.getId(), saved.getCandidateName(), skills.size());
                    return saved;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(resume -> embedAndStore(EmbeddingKind.RESUME, resume.getId(), resume.getContent())
                        .then(autoMatch(resume))
                        .then(reloadResume(resume.getId())));
    }

    /**
     * Mark a job inactive. Its match results are kept.
     */
    public Mono<JobPosting> deactivateJob(Long jobId) {
        return Mono.fromCallable(() -> {
            JobPosting job = jobPostingRepository.findById(jobId)
                    .orElseThrow(() -> new EntityNotFoundException("Job", jobId));
            job.setActive(false);
            job.setUpdatedAt(LocalDateTime.now());
            JobPosting saved = jobPostingRepository.save(job);
            log.info("Deactivated job {} '{}'", jobId, job.getTitle());
            return saved;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<Void> autoMatch(Resume resume) {
        if (resume.getJobPostingId() == null || !matchingConfig.isAutoMatchOnIngestion()) {
            return Mono.empty();
        }
        return matchingService.triggerMatch(resume.getJobPostingId(), resume.getId())
                .doOnNext(match -> log.info("Auto-matched resume {} to job {}: score {}",
                        resume.getId(), resume.getJobPostingId(), match.getOverallScore()))
                .onErrorResume(e -> {
                    log.warn("Auto-match failed for resume {} / job {}: {}",
                            resume.getId(), resume.getJobPostingId(), e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    private Mono<Boolean> embedAndStore(EmbeddingKind kind, Long entityId, String text) {
        return embeddingGenerator.embed(text)
                .flatMap(vector -> Mono.fromCallable(() -> vectorStore.save(kind, entityId, vector))
                        .subscribeOn(Schedulers.boundedElastic()))
                .doOnNext(stored -> {
                    if (!stored) {
                        log.warn("No embedding stored for {} {}; it will be generated at match time", kind, entityId);
                    }
                });
    }

    private Mono<JobPosting> reloadJob(Long jobId) {
        return Mono.fromCallable(() -> jobPostingRepository.findById(jobId)
                        .orElseThrow(() -> new EntityNotFoundException("Job", jobId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<Resume> reloadResume(Long resumeId) {
        return Mono.fromCallable(() -> resumeRepository.findById(resumeId)
                        .orElseThrow(() -> new EntityNotFoundException("Resume", resumeId)))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
