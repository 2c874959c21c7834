package dev.resumematcher.embedding;

import dev.resumematcher.config.EmbeddingConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Normalizes raw text before it is embedded or used as a cache key.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TextPreprocessor {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final EmbeddingConfig embeddingConfig;

    /**
     * Trim, collapse whitespace runs to a single space and truncate to the configured length.
     *
     * @param raw text as supplied by ingestion, may be null
     * @return normalized text, empty when there is nothing to embed
     */
    public String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }

        String text = WHITESPACE.matcher(raw.strip()).replaceAll(" ");

        int maxLength = embeddingConfig.getMaxTextLength();
        if (maxLength > 0 && text.length() > maxLength) {
            log.debug("Text truncated from {} to {} characters for embedding", text.length(), maxLength);
            text = text.substring(0, maxLength);
        }
        return text;
    }
}
