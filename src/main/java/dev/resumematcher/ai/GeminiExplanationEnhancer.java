package dev.resumematcher.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Implementation of ExplanationEnhancer that uses Google AI Studio (Gemini) REST API.
 * Uses simple API key authentication.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "gemini")
public class GeminiExplanationEnhancer implements ExplanationEnhancer {

    private final WebClient webClient;
    private final String apiKey;
    private final String model;
    private final String geminiPath;
    private final Duration timeout;
    private final int maxRetries;

    public GeminiExplanationEnhancer(
            @Value("${app.ai.gemini.api-key:}") String apiKey,
            @Value("${app.ai.gemini.model:gemini-flash-latest}") String model,
            @Value("${app.ai.gemini.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
            @Value("${app.ai.gemini.path:/v1beta/models/%s:generateContent}") String geminiPath,
            @Value("${app.ai.timeout:30s}") Duration timeout,
            @Value("${app.ai.max-retries:2}") int maxRetries) {
        this.apiKey = apiKey;
        this.model = model;
        this.geminiPath = Objects.requireNonNull(geminiPath);
        this.timeout = timeout;
        this.maxRetries = maxRetries;

        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Content-Type", "application/json")
                .build();

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Gemini API Key is missing! Explanations will use the template text.");
        } else {
            log.info("Gemini explanation enhancement enabled with model: {} (Key present)", this.model);
        }
    }

    @Override
    public Mono<String> enhance(ExplanationRequest request) {
        String template = request.templateExplanation();
        if (!isEnabled()) {
            return Mono.just(template);
        }

        String uri = String.format(geminiPath, model) + "?key=" + apiKey;

        return webClient.post()
                .uri(uri)
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(buildRequest(buildPrompt(request)))
                .retrieve()
                .bodyToMono(GeminiResponse.class)
                .timeout(timeout)
                .retryWhen(Retry.backoff(maxRetries, Duration.ofSeconds(1))
                        .filter(this::isRetryableError)
                        .doBeforeRetry(retrySignal -> log.info("Retrying explanation for '{}' (Attempt {})",
                                request.candidateName(), retrySignal.totalRetries() + 1)))
                .map(response -> {
                    String text = extractContent(response);
                    if (text == null || text.isBlank()) {
                        log.warn("Gemini returned an empty explanation for '{}', using template",
                                request.candidateName());
                        return template;
                    }
                    return text.strip();
                })
                .onErrorResume(e -> {
                    log.warn("Explanation enhancement failed for '{}': {}", request.candidateName(), e.getMessage());
                    return Mono.just(template);
                });
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    private String buildPrompt(ExplanationRequest request) {
        return String.format(
                """
                        You are an experienced technical recruiter. Rewrite the match assessment below for a hiring manager.
                        Keep the same verdict and recommendation, stay factual, and use at most 150 words.

                        Position: %s
                        Candidate: %s
                        Overall score: %d/100
                        Skill coverage: %d%%
                        Matched skills: %s
                        Missing skills: %s

                        Assessment:
                        %s
                        """,
                request.jobTitle() != null ? request.jobTitle() : "Not provided",
                request.candidateName() != null ? request.candidateName() : "Not provided",
                request.overallScore(),
                Math.round(request.coverageRatio() * 100),
                request.matchedSkills().isEmpty() ? "none" : String.join(", ", request.matchedSkills()),
                request.missingSkills().isEmpty() ? "none" : String.join(", ", request.missingSkills()),
                request.templateExplanation());
    }

    private GeminiRequest buildRequest(String prompt) {
        return new GeminiRequest(List.of(
                new GeminiRequest.Content(List.of(
                        new GeminiRequest.Part(prompt)))),
                new GeminiRequest.GenerationConfig(0.3, 1024));
    }

    private String extractContent(GeminiResponse response) {
        if (response == null || response.candidates() == null || response.candidates().isEmpty()) {
            log.warn("Gemini returned no candidates or null response");
            return null;
        }

        var candidate = response.candidates().get(0);

        if (candidate.finishReason() != null && !candidate.finishReason().equals("STOP")) {
            log.warn("Gemini finish reason: {}", candidate.finishReason());
        }

        if (candidate.content() == null || candidate.content().parts() == null
                || candidate.content().parts().isEmpty()) {
            log.warn("Gemini candidate has no content parts. Finish reason: {}", candidate.finishReason());
            return null;
        }

        return candidate.content().parts().get(0).text();
    }

    private boolean isRetryableError(Throwable e) {
        if (e instanceof WebClientResponseException response) {
            // Retry on rate limits (429) or server errors (5xx)
            return response.getStatusCode().value() == 429 || response.getStatusCode().is5xxServerError();
        }
        return false;
    }

    // Request DTOs
    record GeminiRequest(
            List<Content> contents,
            @JsonProperty("generationConfig") GenerationConfig generationConfig) {
        record Content(List<Part> parts) {
        }

        record Part(String text) {
        }

        record GenerationConfig(double temperature, int maxOutputTokens) {
        }
    }

    // Response DTOs
    @JsonIgnoreProperties(ignoreUnknown = true)
    record GeminiResponse(List<Candidate> candidates) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Candidate(
                Content content,
                String finishReason) {
            @JsonIgnoreProperties(ignoreUnknown = true)
            record Content(List<Part> parts) {
                @JsonIgnoreProperties(ignoreUnknown = true)
                record Part(String text) {
                }
            }
        }
    }
}
