package dev.resumematcher.controller;

import dev.resumematcher.dto.JobRequest;
import dev.resumematcher.dto.JobResponse;
import dev.resumematcher.exception.EntityNotFoundException;
import dev.resumematcher.repository.JobPostingRepository;
import dev.resumematcher.service.IngestionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
public class JobController {

    private final IngestionService ingestionService;
    private final JobPostingRepository jobPostingRepository;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<JobResponse> create(@Valid @RequestBody JobRequest request) {
        return ingestionService.ingestJob(request.toEntity()).map(JobResponse::from);
    }

    @GetMapping("/{id}")
    public Mono<JobResponse> get(@PathVariable Long id) {
        return Mono.fromCallable(() -> jobPostingRepository.findById(id)
                        .map(JobResponse::from)
                        .orElseThrow(() -> new EntityNotFoundException("Job", id)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PatchMapping("/{id}/deactivate")
    public Mono<JobResponse> deactivate(@PathVariable Long id) {
        return ingestionService.deactivateJob(id).map(JobResponse::from);
    }
}
