package dev.resumematcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for score weighting and match orchestration.
 * Loaded from application.yml under 'matching' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "matching")
public class MatchingConfig {

    private double similarityWeight = 0.6;
    private double skillWeight = 0.4;
    private int concurrency = 4;
    private boolean autoMatchOnIngestion = true;
}
