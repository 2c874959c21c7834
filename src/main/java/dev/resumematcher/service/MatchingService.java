package dev.resumematcher.service;

import dev.resumematcher.ai.ExplanationEnhancer;
import dev.resumematcher.ai.ExplanationRequest;
import dev.resumematcher.config.MatchingConfig;
import dev.resumematcher.embedding.EmbeddingGenerator;
import dev.resumematcher.entity.JobPosting;
import dev.resumematcher.entity.MatchResult;
import dev.resumematcher.entity.Resume;
import dev.resumematcher.exception.EntityNotFoundException;
import dev.resumematcher.exception.MatchPersistenceException;
import dev.resumematcher.metrics.MatcherMetrics;
import dev.resumematcher.model.EmbeddingKind;
import dev.resumematcher.model.EmbeddingVector;
import dev.resumematcher.model.SimilarityOutcome;
import dev.resumematcher.model.SkillComparison;
import dev.resumematcher.model.SkillSet;
import dev.resumematcher.model.SkillSource;
import dev.resumematcher.repository.JobPostingRepository;
import dev.resumematcher.repository.MatchResultStore;
import dev.resumematcher.repository.ResumeRepository;
import dev.resumematcher.service.ScoreCombiner.ScoringResult;
import dev.resumematcher.skill.SkillComparator;
import dev.resumematcher.skill.SkillExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Orchestrates the matching pipeline for (job, resume) pairs.
 * <p>
 * Per pair: embeddings (generated on demand when missing), similarity, skill comparison,
 * score, explanation, and finally the upsert into the match result store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MatchingService {

    private static final String SEPARATOR = "========================================";

    private final JobPostingRepository jobPostingRepository;
    private final ResumeRepository resumeRepository;
    private final VectorStoreService vectorStore;
    private final EmbeddingGenerator embeddingGenerator;
    private final SkillExtractor skillExtractor;
    private final SkillComparator skillComparator;
    private final ScoreCombiner scoreCombiner;
    private final ExplanationGenerator explanationGenerator;
    private final ExplanationEnhancer explanationEnhancer;
    private final MatchResultStore matchResultStore;
    private final MatchingConfig matchingConfig;
    private final MatcherMetrics metrics;

    /**
     * Match a single resume against a job.
     *
     * @return Mono with the stored result; errors with EntityNotFoundException for unknown ids
     *         and MatchPersistenceException when the result could not be stored
     */
    public Mono<MatchResult> triggerMatch(Long jobId, Long resumeId) {
        return Mono.zip(loadJob(jobId), loadResume(resumeId))
                .flatMap(pair -> match(pair.getT1(), pair.getT2()));
    }

    /**
     * Match every candidate resume of a job.
     */
    public Mono<List<MatchResult>> triggerMatchForJob(Long jobId) {
        return triggerMatchForJob(jobId, null, null);
    }

    /**
     * Match every candidate resume of a job: the resumes submitted for it, or all resumes when
     * none were. Every computed pair is stored; the filters only narrow the returned list.
     *
     * @param minScore   drop results below this score from the returned list, optional
     * @param maxResults cap on the returned list, optional
     * @return Mono with the ranked results; failed pairs are logged and left out
     */
    public Mono<List<MatchResult>> triggerMatchForJob(Long jobId, Integer minScore, Integer maxResults) {
        return loadJob(jobId).flatMap(job -> candidatesFor(job)
                .flatMap(resumes -> matchAll(job, resumes, minScore, maxResults)));
    }

    /**
     * Match a chosen set of resumes against a job. Null and unknown resume ids are logged and
     * skipped; duplicates are matched once. Filters behave as in
     * {@link #triggerMatchForJob(Long, Integer, Integer)}.
     *
     * @return Mono with the ranked results, empty list when none of the ids resolve
     */
    public Mono<List<MatchResult>> triggerMatchForResumes(Long jobId, List<Long> resumeIds,
                                                          Integer minScore, Integer maxResults) {
        return loadJob(jobId).flatMap(job -> selectedResumes(resumeIds)
                .flatMap(resumes -> matchAll(job, resumes, minScore, maxResults)));
    }

    private Mono<List<MatchResult>> matchAll(JobPosting job, List<Resume> resumes,
                                             Integer minScore, Integer maxResults) {
        if (resumes.isEmpty()) {
            log.warn("No resumes to match for job {}", job.getId());
            metrics.updateLastBatch(0);
            return Mono.just(List.of());
        }

        log.info(SEPARATOR);
        log.info("Matching job {} '{}' against {} resumes", job.getId(), job.getTitle(), resumes.size());

        return Flux.fromIterable(resumes)
                .flatMap(resume -> match(job, resume)
                        .onErrorResume(e -> {
                            log.error("Match failed for job {} / resume {}: {}",
                                    job.getId(), resume.getId(), e.getMessage());
                            return Mono.empty();
                        }), Math.max(1, matchingConfig.getConcurrency()))
                .collectList()
                .map(results -> {
                    metrics.updateLastBatch(results.size());
                    int failed = resumes.size() - results.size();
                    log.info("Job {} matched: {} stored, {} failed", job.getId(), results.size(), failed);
                    log.info(SEPARATOR);
                    return results.stream()
                            .filter(r -> minScore == null || r.getOverallScore() >= minScore)
                            .sorted(MatchResult.RANKING)
                            .limit(maxResults != null && maxResults > 0 ? maxResults : Long.MAX_VALUE)
                            .toList();
                });
    }

    /**
     * Run the pipeline for an already loaded pair.
     */
    public Mono<MatchResult> match(JobPosting job, Resume resume) {
        return Mono.defer(() -> {
            long start = System.currentTimeMillis();

            return Mono.zip(
                            ensureEmbedding(EmbeddingKind.JOB, job.getId(), job.getEmbedding(), job.embeddingText()),
                            ensureEmbedding(EmbeddingKind.RESUME, resume.getId(), resume.getEmbedding(), resume.getContent()))
                    .flatMap(vectors -> {
                        SimilarityOutcome similarity = vectorStore.similarity(vectors.getT1(), vectors.getT2());
                        SkillComparison skills = skillComparator.compare(requiredSkills(job), candidateSkills(resume));
                        ScoringResult scoring = scoreCombiner.combine(similarity.score(), skills.coverageRatio());

                        log.debug("Job {} / resume {}: similarity {} (low confidence {}), coverage {}, score {}",
                                job.getId(), resume.getId(), similarity.score(), similarity.lowConfidence(),
                                skills.coverageRatio(), scoring.overallScore());

                        String template = explanationGenerator.explain(scoring.overallScore(),
                                skills.matched(), skills.missing(), skills.coverageRatio());

                        return explain(job, resume, scoring, skills, template)
                                .map(explanation -> MatchResult.builder()
                                        .jobId(job.getId())
                                        .resumeId(resume.getId())
                                        .similarityScore(similarity.score())
                                        .skillCoverageRatio(skills.coverageRatio())
                                        .overallScore(scoring.overallScore())
                                        .matchedSkills(SkillSet.toColumn(skills.matched()))
                                        .missingSkills(SkillSet.toColumn(skills.missing()))
                                        .additionalSkills(SkillSet.toColumn(skills.additional()))
                                        .explanation(explanation)
                                        .lowConfidence(similarity.lowConfidence())
                                        .processingTimeMs(System.currentTimeMillis() - start)
                                        .modelVersion(embeddingGenerator.modelVersion())
                                        .build());
                    })
                    // The store write is the last step of a match
                    .flatMap(draft -> Mono.fromCallable(() -> matchResultStore.upsert(draft))
                            .subscribeOn(Schedulers.boundedElastic()))
                    .doOnNext(stored -> {
                        metrics.recordMatchComputed();
                        metrics.recordMatchLatency(System.currentTimeMillis() - start);
                        log.debug("Stored match {} (job {} / resume {}, score {})",
                                stored.getId(), stored.getJobId(), stored.getResumeId(), stored.getOverallScore());
                    })
                    .doOnError(MatchPersistenceException.class, e -> metrics.recordMatchFailure());
        });
    }

    private Mono<String> explain(JobPosting job, Resume resume, ScoringResult scoring,
                                 SkillComparison skills, String template) {
        if (!explanationEnhancer.isEnabled()) {
            return Mono.just(template);
        }

        ExplanationRequest request = new ExplanationRequest(job.getTitle(), resume.getCandidateName(),
                scoring.overallScore(), skills.matched(), skills.missing(), skills.coverageRatio(), template);

        return explanationEnhancer.enhance(request)
                .filter(text -> !text.isBlank())
                .defaultIfEmpty(template)
                .onErrorResume(e -> {
                    log.warn("Explanation enhancer failed for job {} / resume {}: {}",
                            job.getId(), resume.getId(), e.getMessage());
                    return Mono.just(template);
                })
                .doOnNext(text -> {
                    if (text.equals(template)) {
                        metrics.recordEnhancerFallback();
                    }
                });
    }

    /**
     * Use the stored vector, or generate one and store it. A zero vector comes back when
     * inference is unavailable; it is never stored.
     */
    private Mono<EmbeddingVector> ensureEmbedding(EmbeddingKind kind, Long entityId,
                                                  EmbeddingVector stored, String text) {
        if (stored != null && !stored.isZero()) {
            return Mono.just(stored);
        }
        return embeddingGenerator.embed(text)
                .flatMap(vector -> {
                    if (vector.isZero()) {
                        return Mono.just(vector);
                    }
                    return Mono.fromCallable(() -> vectorStore.save(kind, entityId, vector))
                            .subscribeOn(Schedulers.boundedElastic())
                            .thenReturn(vector)
                            .onErrorResume(e -> {
                                log.warn("Could not store {} embedding for {}: {}", kind, entityId, e.getMessage());
                                return Mono.just(vector);
                            });
                });
    }

    private SkillSet requiredSkills(JobPosting job) {
        if (job.getSkills() != null) {
            return new SkillSet(job.requiredSkillSet(), SkillSource.REQUIRED);
        }
        return skillExtractor.extractRequired(job.embeddingText(), job.explicitSkillSet());
    }

    private SkillSet candidateSkills(Resume resume) {
        if (resume.getSkills() != null) {
            return new SkillSet(resume.skillSet(), SkillSource.EXTRACTED);
        }
        return skillExtractor.extract(resume.getContent(), SkillSource.EXTRACTED);
    }

    private Mono<List<Resume>> candidatesFor(JobPosting job) {
        return Mono.fromCallable(() -> {
            List<Resume> submitted = resumeRepository.findByJobPostingId(job.getId());
            if (!submitted.isEmpty()) {
                return submitted;
            }
            log.info("No resumes submitted for job {}, matching against all resumes", job.getId());
            return resumeRepository.findAll();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<List<Resume>> selectedResumes(List<Long> resumeIds) {
        return Mono.fromCallable(() -> {
            List<Resume> resumes = new ArrayList<>();
            if (resumeIds == null) {
                return resumes;
            }
            for (Long resumeId : new LinkedHashSet<>(resumeIds)) {
                if (resumeId == null) {
                    log.warn("Skipping empty resume id in match request");
                    continue;
                }
                resumeRepository.findById(resumeId).ifPresentOrElse(resumes::add,
                        () -> log.warn("Resume {} not found, skipping", resumeId));
            }
            return resumes;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<JobPosting> loadJob(Long jobId) {
        return Mono.fromCallable(() -> jobPostingRepository.findById(jobId)
                        .orElseThrow(() -> new EntityNotFoundException("Job", jobId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<Resume> loadResume(Long resumeId) {
        return Mono.fromCallable(() -> resumeRepository.findById(resumeId)
                        .orElseThrow(() -> new EntityNotFoundException("Resume", resumeId)))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
