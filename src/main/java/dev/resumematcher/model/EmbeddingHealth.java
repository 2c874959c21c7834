package dev.resumematcher.model;

public record EmbeddingHealth(boolean ok, long latencyMs, String circuitState) {
}
