package dev.resumematcher.model;

/**
 * Input unit for embedding: the owning entity, its text and what kind of entity it is.
 */
public record EmbeddableText(Long entityId, String text, EmbeddingKind kind) {

    public static EmbeddableText query(String text) {
        return new EmbeddableText(null, text, EmbeddingKind.QUERY);
    }
}
