package dev.resumematcher.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Skill vocabulary and synonym table.
 * Loaded from skills.yml under 'skills' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "skills")
public class SkillVocabularyConfig {

    private List<String> technical = new ArrayList<>();
    private List<String> soft = new ArrayList<>();
    private List<String> certifications = new ArrayList<>();
    private List<SynonymGroup> synonyms = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SynonymGroup {
        private String canonical;
        private List<String> variants = new ArrayList<>();
    }
}
