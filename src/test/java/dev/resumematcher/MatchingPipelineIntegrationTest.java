package dev.resumematcher;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.resumematcher.dto.JobResponse;
import dev.resumematcher.dto.MatchResultResponse;
import dev.resumematcher.dto.ResumeResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Runs ingestion, matching, review and search through the HTTP API against an in-memory database.
 * The embedding model is replaced by a bag-of-words hash so similarities are deterministic.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class MatchingPipelineIntegrationTest {

    private static final int DIMENSION = 384;

    @MockitoBean
    private EmbeddingModel embeddingModel;

    @Autowired
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = webTestClient.mutate().responseTimeout(Duration.ofSeconds(30)).build();
        when(embeddingModel.embed(anyString()))
                .thenAnswer(invocation -> Response.from(Embedding.from(bagOfWords(invocation.getArgument(0)))));
    }

    private static float[] bagOfWords(String text) {
        float[] vector = new float[DIMENSION];
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9+#.]+")) {
            if (!token.isEmpty()) {
                vector[Math.floorMod(token.hashCode(), DIMENSION)] += 1f;
            }
        }
        return vector;
    }

    private JobResponse createJob(String body) {
        return webTestClient.post().uri("/api/v1/jobs")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isCreated()
                .expectBody(JobResponse.class)
                .returnResult().getResponseBody();
    }

    private ResumeResponse createResume(Map<String, Object> body) {
        return webTestClient.post().uri("/api/v1/resumes")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isCreated()
                .expectBody(ResumeResponse.class)
                .returnResult().getResponseBody();
    }

    private List<MatchResultResponse> results(Long jobId) {
        return webTestClient.get().uri("/api/v1/matching/results/{jobId}", jobId)
                .exchange()
                .expectStatus().isOk()
                .expectBody(new ParameterizedTypeReference<List<MatchResultResponse>>() {
                })
                .returnResult().getResponseBody();
    }

    @Test
    @DisplayName("Should ingest, auto-match, review and re-match without losing the review")
    void shouldRunFullPipeline() {
        JobResponse job = createJob("""
                {
                  "title": "Data Engineer",
                  "company": "Acme",
                  "description": "Build batch pipelines with Python and SQL on AWS.",
                  "requiredSkills": ["Python", "SQL"]
                }
                """);
        assertThat(job).isNotNull();
        assertThat(job.requiredSkills()).contains("python", "sql", "aws");
        assertThat(job.embedded()).isTrue();

        ResumeResponse strong = createResume(Map.of(
                "candidateName", "Ada",
                "content", "Data engineer. Python, SQL and AWS pipelines for five years.",
                "jobPostingId", job.id()));
        ResumeResponse weak = createResume(Map.of(
                "candidateName", "Linus",
                "content", "Kernel developer writing C++ and Docker tooling.",
                "jobPostingId", job.id()));
        assertThat(strong.skills()).contains("python", "sql", "aws");
        assertThat(strong.embedded()).isTrue();

        // Both resumes were matched on ingestion
        List<MatchResultResponse> ranked = results(job.id());
        assertThat(ranked).hasSize(2);
        assertThat(ranked.get(0).resumeId()).isEqualTo(strong.id());
        assertThat(ranked.get(0).overallScore()).isGreaterThan(ranked.get(1).overallScore());
        assertThat(ranked.get(1).missingSkills()).contains("python", "sql");
        assertThat(ranked.get(0).status()).isEqualTo("PENDING");

        MatchResultResponse top = ranked.get(0);
        webTestClient.patch().uri("/api/v1/matching/results/{id}/status", top.id())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("status", "shortlisted", "updatedBy", "recruiter"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("SHORTLISTED");

        // A whole-job re-match overwrites scores but keeps the review
        webTestClient.post().uri("/api/v1/matching/match")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("jobId", job.id()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2);

        List<MatchResultResponse> after = results(job.id());
        assertThat(after).hasSize(2);
        MatchResultResponse reviewed = after.stream().filter(r -> r.id().equals(top.id())).findFirst().orElseThrow();
        assertThat(reviewed.status()).isEqualTo("SHORTLISTED");
        assertThat(reviewed.statusUpdatedBy()).isEqualTo("recruiter");
        assertThat(reviewed.overallScore()).isEqualTo(top.overallScore());
        assertThat(reviewed.explanation()).isEqualTo(top.explanation());

        webTestClient.get().uri("/api/v1/matching/job/{jobId}/statistics", job.id())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.totalCandidates").isEqualTo(2)
                .jsonPath("$.topScore").isEqualTo(top.overallScore());

        webTestClient.get().uri("/api/v1/matching/results/{jobId}/by-status/shortlisted", job.id())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].resumeId").isEqualTo(strong.id().intValue());
    }

    @Test
    @DisplayName("Should keep results of a deactivated job")
    void shouldKeepResultsOfDeactivatedJob() {
        JobResponse job = createJob("{\"title\": \"Kafka Engineer\", \"description\": \"Kafka and Java\"}");
        createResume(Map.of("candidateName", "Grace", "content", "Java and Kafka", "jobPostingId", job.id()));

        webTestClient.patch().uri("/api/v1/jobs/{id}/deactivate", job.id())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.active").isEqualTo(false);

        assertThat(results(job.id())).hasSize(1);
    }

    @Test
    @DisplayName("Should match only the listed resumes and suggest improvements for a result")
    void shouldMatchSelectedResumesAndSuggest() {
        JobResponse job = createJob("{\"title\": \"Platform Engineer\", \"description\": \"Docker and Kubernetes on AWS\"}");
        ResumeResponse chosen = createResume(Map.of("candidateName", "Margaret", "content", "Docker and AWS operations"));
        createResume(Map.of("candidateName", "Ken", "content", "Docker, Kubernetes and AWS"));

        List<MatchResultResponse> matched = webTestClient.post().uri("/api/v1/matching/match")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("jobId", job.id(), "resumeIds", List.of(chosen.id(), 999999)))
                .exchange()
                .expectStatus().isOk()
                .expectBody(new ParameterizedTypeReference<List<MatchResultResponse>>() {
                })
                .returnResult().getResponseBody();

        assertThat(matched).extracting(MatchResultResponse::resumeId).containsExactly(chosen.id());
        assertThat(results(job.id())).hasSize(1);
        assertThat(matched.get(0).missingSkills()).contains("kubernetes");

        webTestClient.get().uri("/api/v1/matching/match/{id}/suggestions", matched.get(0).id())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.suggestions[0]").isEqualTo("Consider gaining experience in: kubernetes")
                .jsonPath("$.matchScore").isEqualTo(matched.get(0).overallScore());
    }

    @Test
    @DisplayName("Should find resumes by free-text query")
    void shouldSearchResumes() {
        ResumeResponse resume = createResume(Map.of(
                "candidateName", "Barbara",
                "content", "Rust systems programmer building distributed storage engines"));

        webTestClient.post().uri("/api/v1/matching/similarity-search")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "rust distributed storage engines", "limit", 100))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].resumeId").isEqualTo(resume.id().intValue());
    }

    @Test
    @DisplayName("Should return 404 for unknown ids")
    void shouldReturnNotFound() {
        webTestClient.get().uri("/api/v1/jobs/999999")
                .exchange()
                .expectStatus().isNotFound();

        webTestClient.post().uri("/api/v1/resumes")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("candidateName", "Nobody", "content", "x", "jobPostingId", 999999))
                .exchange()
                .expectStatus().isNotFound();

        webTestClient.get().uri("/api/v1/matching/match/999999")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("Should report a healthy embedding model")
    void shouldReportHealth() {
        webTestClient.get().uri("/api/v1/health/embedding")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ok").isEqualTo(true)
                .jsonPath("$.circuitState").isEqualTo("CLOSED");
    }
}
