package dev.resumematcher.controller;

import dev.resumematcher.dto.ResumeRequest;
import dev.resumematcher.dto.ResumeResponse;
import dev.resumematcher.exception.EntityNotFoundException;
import dev.resumematcher.repository.ResumeRepository;
import dev.resumematcher.service.IngestionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api/v1/resumes")
@RequiredArgsConstructor
public class ResumeController {

    private final IngestionService ingestionService;
    private final ResumeRepository resumeRepository;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ResumeResponse> create(@Valid @RequestBody ResumeRequest request) {
        return ingestionService.ingestResume(request.toEntity()).map(ResumeResponse::from);
    }

    @GetMapping("/{id}")
    public Mono<ResumeResponse> get(@PathVariable Long id) {
        return Mono.fromCallable(() -> resumeRepository.findById(id)
                        .map(ResumeResponse::from)
                        .orElseThrow(() -> new EntityNotFoundException("Resume", id)))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
