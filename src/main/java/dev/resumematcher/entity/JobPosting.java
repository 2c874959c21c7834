package dev.resumematcher.entity;

import dev.resumematcher.model.EmbeddingVector;
import dev.resumematcher.model.SkillSet;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A job posting with its extracted required skills and embedding.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "job_postings", indexes = {
        @Index(name = "idx_job_active", columnList = "active")
})
public class JobPosting {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String title;

    private String company;

    @Column(length = 100_000)
    private String description;

    @Column(length = 100_000)
    private String requirements;

    @Column(length = 500)
    private String location;

    /** Skills listed explicitly by the recruiter, comma-separated. */
    @Column(length = 2048)
    private String requiredSkills;

    /** Full required skill set (explicit plus extracted), comma-separated. */
    @Column(length = 4096)
    private String skills;

    @ToString.Exclude
    @Convert(converter = EmbeddingVectorConverter.class)
    @Column(length = 16384)
    private EmbeddingVector embedding;

    private String embeddingModel;

    @Builder.Default
    @Column(nullable = false)
    private boolean active = true;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * Text that represents the job for embedding and skill extraction.
     */
    public String embeddingText() {
        return Stream.of(title, description, requirements)
                .filter(part -> part != null && !part.isBlank())
                .collect(Collectors.joining("\n"));
    }

    public Set<String> requiredSkillSet() {
        return SkillSet.fromColumn(skills);
    }

    public Set<String> explicitSkillSet() {
        return SkillSet.fromColumn(requiredSkills);
    }
}
