package dev.resumematcher.service;

import dev.resumematcher.config.MatchingConfig;
import dev.resumematcher.service.ScoreCombiner.ScoringResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreCombinerTest {

    private MatchingConfig matchingConfig;
    private ScoreCombiner scoreCombiner;

    @BeforeEach
    void setUp() {
        matchingConfig = new MatchingConfig();
        matchingConfig.setSimilarityWeight(0.6);
        matchingConfig.setSkillWeight(0.4);
        scoreCombiner = new ScoreCombiner(matchingConfig);
    }

    @Nested
    @DisplayName("Default weights")
    class DefaultWeightsTests {

        @Test
        @DisplayName("Should combine similarity 0.75 and coverage 0.5 into 65")
        void shouldScoreReferenceScenario() {
            ScoringResult result = scoreCombiner.combine(0.75, 0.5);

            assertThat(result.overallScore()).isEqualTo(65);
            assertThat(result.breakdown())
                    .containsEntry("semantic_similarity", 45)
                    .containsEntry("skill_coverage", 20);
        }

        @ParameterizedTest
        @CsvSource({
                "0.0, 0.0, 0",
                "1.0, 1.0, 100",
                "0.0, 1.0, 40",
                "1.0, 0.0, 60",
                "0.5, 0.5, 50"
        })
        @DisplayName("Should weight similarity 60% and coverage 40%")
        void shouldApplyWeights(double similarity, double coverage, int expected) {
            assertThat(scoreCombiner.combine(similarity, coverage).overallScore()).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should round the weighted sum once instead of each weighted part")
        void shouldRoundWeightedSum() {
            ScoringResult result = scoreCombiner.combine(0.005, 0.18);

            assertThat(result.overallScore()).isEqualTo(8);
            assertThat(result.breakdown().get("semantic_similarity") + result.breakdown().get("skill_coverage"))
                    .isEqualTo(8);
        }

        @ParameterizedTest
        @CsvSource({
                "-0.4, 2.0, 40",
                "1.7, -1.0, 60",
                "NaN, 1.0, 40"
        })
        @DisplayName("Should clamp inputs into [0, 1]")
        void shouldClampInputs(double similarity, double coverage, int expected) {
            int score = scoreCombiner.combine(similarity, coverage).overallScore();

            assertThat(score).isEqualTo(expected).isBetween(0, 100);
        }
    }

    @Nested
    @DisplayName("Configured weights")
    class ConfiguredWeightsTests {

        @Test
        @DisplayName("Should normalize weights that do not sum to one")
        void shouldNormalizeWeights() {
            matchingConfig.setSimilarityWeight(3);
            matchingConfig.setSkillWeight(1);

            assertThat(scoreCombiner.combine(1.0, 0.0).overallScore()).isEqualTo(75);
        }

        @Test
        @DisplayName("Should fall back to defaults when both weights are zero")
        void shouldFallBackToDefaults() {
            matchingConfig.setSimilarityWeight(0);
            matchingConfig.setSkillWeight(0);

            assertThat(scoreCombiner.combine(0.75, 0.5).overallScore()).isEqualTo(65);
        }
    }
}
