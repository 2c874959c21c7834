package dev.resumematcher.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Loads the sentence-embedding model once at startup.
 */
@Slf4j
@Configuration
public class EmbeddingModelConfig {

    @Bean
    public EmbeddingModel embeddingModel(EmbeddingConfig embeddingConfig) {
        log.info("Loading embedding model: {} (dimension {})",
                embeddingConfig.getModelName(), embeddingConfig.getDimension());
        EmbeddingModel model = new AllMiniLmL6V2EmbeddingModel();
        log.info("Embedding model loaded");
        return model;
    }
}
