package dev.resumematcher.model;

/**
 * What an embedded text belongs to. Query embeddings are never persisted.
 */
public enum EmbeddingKind {
    JOB,
    RESUME,
    QUERY
}
