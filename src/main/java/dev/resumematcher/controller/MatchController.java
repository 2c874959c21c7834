package dev.resumematcher.controller;

import dev.resumematcher.dto.ImprovementRequest;
import dev.resumematcher.dto.MatchRequest;
import dev.resumematcher.dto.MatchResultResponse;
import dev.resumematcher.dto.SimilaritySearchRequest;
import dev.resumematcher.dto.StatusUpdateRequest;
import dev.resumematcher.entity.MatchResult;
import dev.resumematcher.entity.MatchStatus;
import dev.resumematcher.model.ImprovementSuggestions;
import dev.resumematcher.model.MatchStatistics;
import dev.resumematcher.model.ResumeSearchHit;
import dev.resumematcher.service.ImprovementSuggester;
import dev.resumematcher.service.MatchResultService;
import dev.resumematcher.service.MatchingService;
import dev.resumematcher.service.SimilaritySearchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Matching endpoints: trigger, results, review status, statistics, improvement suggestions
 * and similarity search.
 */
@RestController
@RequestMapping("/api/v1/matching")
@RequiredArgsConstructor
@Slf4j
public class MatchController {

    private final MatchingService matchingService;
    private final MatchResultService matchResultService;
    private final SimilaritySearchService similaritySearchService;
    private final ImprovementSuggester improvementSuggester;

    @PostMapping("/match")
    public Mono<List<MatchResultResponse>> match(@Valid @RequestBody MatchRequest request) {
        if (request.resumeId() != null) {
            log.info("Match requested for job {} / resume {}", request.jobId(), request.resumeId());
            return matchingService.triggerMatch(request.jobId(), request.resumeId())
                    .map(match -> List.of(MatchResultResponse.from(match)));
        }
        if (request.resumeIds() != null && !request.resumeIds().isEmpty()) {
            log.info("Match requested for job {} / {} selected resumes", request.jobId(), request.resumeIds().size());
            return matchingService.triggerMatchForResumes(request.jobId(), request.resumeIds(),
                            request.minScoreThreshold(), request.maxResults())
                    .map(MatchResultResponse::fromAll);
        }
        log.info("Match requested for all candidates of job {}", request.jobId());
        return matchingService.triggerMatchForJob(request.jobId(), request.minScoreThreshold(), request.maxResults())
                .map(MatchResultResponse::fromAll);
    }

    @GetMapping("/results/{jobId}")
    public Mono<List<MatchResultResponse>> results(@PathVariable Long jobId) {
        return blocking(() -> MatchResultResponse.fromAll(matchResultService.getMatchResults(jobId)));
    }

    @GetMapping("/results/{jobId}/by-status/{status}")
    public Mono<List<MatchResultResponse>> resultsByStatus(@PathVariable Long jobId, @PathVariable String status) {
        return blocking(() -> MatchResultResponse.fromAll(
                matchResultService.getMatchResultsByStatus(jobId, MatchStatus.parse(status))));
    }

    @GetMapping("/resume/{resumeId}/matches")
    public Mono<List<MatchResultResponse>> matchesForResume(@PathVariable Long resumeId) {
        return blocking(() -> MatchResultResponse.fromAll(matchResultService.getMatchesForResume(resumeId)));
    }

    @GetMapping("/match/{matchId}")
    public Mono<MatchResultResponse> getMatch(@PathVariable Long matchId) {
        return blocking(() -> MatchResultResponse.from(matchResultService.getMatch(matchId)));
    }

    @PatchMapping("/results/{matchId}/status")
    public Mono<MatchResultResponse> updateStatus(@PathVariable Long matchId,
                                                  @Valid @RequestBody StatusUpdateRequest request) {
        return blocking(() -> MatchResultResponse.from(matchResultService.updateStatus(
                matchId, MatchStatus.parse(request.status()), request.updatedBy())));
    }

    @GetMapping("/job/{jobId}/statistics")
    public Mono<MatchStatistics> statistics(@PathVariable Long jobId) {
        return blocking(() -> matchResultService.getStatistics(jobId));
    }

    @PostMapping("/improvement-suggestions")
    public Mono<ImprovementSuggestions> improvementSuggestions(@Valid @RequestBody ImprovementRequest request) {
        return Mono.fromCallable(() -> improvementSuggester.suggest(request.missingSkills(), request.matchScore()));
    }

    @GetMapping("/match/{matchId}/suggestions")
    public Mono<ImprovementSuggestions> suggestionsForMatch(@PathVariable Long matchId) {
        return blocking(() -> {
            MatchResult match = matchResultService.getMatch(matchId);
            return improvementSuggester.suggest(match.missingSkillSet(), match.getOverallScore());
        });
    }

    @PostMapping("/similarity-search")
    public Mono<List<ResumeSearchHit>> similaritySearch(@Valid @RequestBody SimilaritySearchRequest request) {
        return similaritySearchService.search(request.query(), request.limit());
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
