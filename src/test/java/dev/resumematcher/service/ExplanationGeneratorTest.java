package dev.resumematcher.service;

import dev.resumematcher.service.ExplanationGenerator.Tier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ExplanationGeneratorTest {

    private final ExplanationGenerator generator = new ExplanationGenerator();

    @ParameterizedTest
    @CsvSource({
            "100, EXCELLENT",
            "80, EXCELLENT",
            "79, GOOD",
            "60, GOOD",
            "59, MODERATE",
            "40, MODERATE",
            "39, LIMITED",
            "0, LIMITED"
    })
    @DisplayName("Should pick the tier from the overall score")
    void shouldPickTier(int score, Tier expected) {
        assertThat(Tier.of(score)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should produce identical text for identical inputs")
    void shouldBeDeterministic() {
        String first = generator.explain(65, Set.of("python", "sql"), Set.of("docker"), 0.5);
        String second = generator.explain(65, List.of("sql", "python"), List.of("docker"), 0.5);

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("Should describe a good match with its skills")
    void shouldDescribeGoodMatch() {
        String text = generator.explain(65, Set.of("python"), Set.of("sql"), 0.5);

        assertThat(text)
                .contains(Tier.GOOD.assessment())
                .contains(Tier.GOOD.recommendation())
                .contains("match score of 65%")
                .contains("50% of the required skills")
                .contains("Possesses 1 relevant skills including python")
                .contains("Missing 1 key skills: sql");
    }

    @Test
    @DisplayName("Should name the first three skills and count the rest")
    void shouldTruncateSkillLists() {
        String text = generator.explain(20, Set.of(), Set.of("aws", "docker", "kafka", "python", "sql"), 0.0);

        assertThat(text)
                .contains("Missing 5 key skills: aws, docker, kafka and 2 more")
                .contains("Basic qualifications present in resume")
                .contains(Tier.LIMITED.recommendation());
    }

    @Test
    @DisplayName("Should report no concerns for a full match")
    void shouldReportNoConcerns() {
        String text = generator.explain(92, Set.of("java"), Set.of(), 1.0);

        assertThat(text)
                .contains(Tier.EXCELLENT.assessment())
                .contains("No significant concerns identified");
    }
}
