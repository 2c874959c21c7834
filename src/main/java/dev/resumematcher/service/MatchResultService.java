package dev.resumematcher.service;

import dev.resumematcher.entity.MatchResult;
import dev.resumematcher.entity.MatchStatus;
import dev.resumematcher.exception.EntityNotFoundException;
import dev.resumematcher.exception.MatchRejectedException;
import dev.resumematcher.model.MatchStatistics;
import dev.resumematcher.repository.JobPostingRepository;
import dev.resumematcher.repository.MatchResultRepository;
import dev.resumematcher.repository.ResumeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Queries over stored match results and the review status lifecycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MatchResultService {

    private static final int TOP_MISSING_SKILLS = 5;

    private final MatchResultRepository matchResultRepository;
    private final JobPostingRepository jobPostingRepository;
    private final ResumeRepository resumeRepository;

    /**
     * Results for a job, highest score first, ties by earliest creation.
     */
    @Transactional(readOnly = true)
    public List<MatchResult> getMatchResults(Long jobId) {
        requireJob(jobId);
        return matchResultRepository.findByJobIdOrderByOverallScoreDescCreatedAtAscIdAsc(jobId);
    }

    @Transactional(readOnly = true)
    public List<MatchResult> getMatchResultsByStatus(Long jobId, MatchStatus status) {
        requireJob(jobId);
        return matchResultRepository.findByJobIdAndStatusOrderByOverallScoreDescCreatedAtAscIdAsc(jobId, status);
    }

    @Transactional(readOnly = true)
    public List<MatchResult> getMatchesForResume(Long resumeId) {
        if (!resumeRepository.existsById(resumeId)) {
            throw new EntityNotFoundException("Resume", resumeId);
        }
        return matchResultRepository.findByResumeIdOrderByOverallScoreDescCreatedAtAscIdAsc(resumeId);
    }

    @Transactional(readOnly = true)
    public MatchResult getMatch(Long matchId) {
        return matchResultRepository.findById(matchId)
                .orElseThrow(() -> new EntityNotFoundException("Match", matchId));
    }

    /**
     * Move a match to a new review status. Any status may follow any other.
     */
    @Transactional
    public MatchResult updateStatus(Long matchId, MatchStatus newStatus, String updatedBy) {
        if (newStatus == null) {
            throw new IllegalArgumentException("Match status is required");
        }
        MatchResult match = getMatch(matchId);
        MatchStatus previous = match.getStatus();

        LocalDateTime now = LocalDateTime.now();
        match.setStatus(newStatus);
        match.setStatusUpdatedAt(now);
        match.setStatusUpdatedBy(updatedBy);
        match.setUpdatedAt(now);
        MatchResult saved = matchResultRepository.save(match);

        log.info("Match {} status {} -> {} by {}", matchId, previous, newStatus, updatedBy);
        return saved;
    }

    /**
     * Check that a match may be scheduled for interview.
     *
     * @throws MatchRejectedException when the candidate was rejected
     */
    @Transactional(readOnly = true)
    public MatchResult requireSchedulable(Long matchId) {
        MatchResult match = getMatch(matchId);
        if (match.getStatus() == MatchStatus.REJECTED) {
            throw new MatchRejectedException(matchId);
        }
        return match;
    }

    @Transactional(readOnly = true)
    public MatchStatistics getStatistics(Long jobId) {
        List<MatchResult> results = getMatchResults(jobId);
        if (results.isEmpty()) {
            return MatchStatistics.empty(jobId);
        }

        double average = results.stream().mapToInt(MatchResult::getOverallScore).average().orElse(0.0);
        int top = results.stream().mapToInt(MatchResult::getOverallScore).max().orElse(0);
        int above70 = (int) results.stream().filter(r -> r.getOverallScore() >= 70).count();
        int above50 = (int) results.stream().filter(r -> r.getOverallScore() >= 50).count();

        Map<String, Long> missingCounts = results.stream()
                .flatMap(r -> r.missingSkillSet().stream())
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));

        List<String> commonMissing = missingCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry::getKey))
                .limit(TOP_MISSING_SKILLS)
                .map(Map.Entry::getKey)
                .toList();

        return new MatchStatistics(jobId, results.size(), Math.round(average * 10.0) / 10.0, top,
                above70, above50, commonMissing);
    }

    private void requireJob(Long jobId) {
        if (!jobPostingRepository.existsById(jobId)) {
            throw new EntityNotFoundException("Job", jobId);
        }
    }
}
