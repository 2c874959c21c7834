package dev.resumematcher.ai;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class NoOpExplanationEnhancerTest {

    private NoOpExplanationEnhancer enhancer;

    @BeforeEach
    void setUp() {
        enhancer = new NoOpExplanationEnhancer();
    }

    @Test
    @DisplayName("Should always be disabled")
    void shouldBeDisabled() {
        assertThat(enhancer.isEnabled()).isFalse();
    }

    @Test
    @DisplayName("Should return the template explanation unchanged")
    void shouldReturnTemplate() {
        ExplanationRequest request = new ExplanationRequest("QA Engineer", "Grace", 42,
                Set.of("selenium"), Set.of("java"), 0.5, "template text");

        StepVerifier.create(enhancer.enhance(request))
                .expectNext("template text")
                .verifyComplete();
    }
}
