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

/**
 * A candidate resume. Content is the already-extracted plain text.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "resumes", indexes = {
        @Index(name = "idx_resume_job", columnList = "job_posting_id")
})
public class Resume {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String candidateName;

    private String email;

    @ToString.Exclude
    @Column(length = 100_000)
    private String content;

    /** Job the resume was submitted for, if any. */
    @Column(name = "job_posting_id")
    private Long jobPostingId;

    @Column(length = 4096)
    private String skills;

    @ToString.Exclude
    @Convert(converter = EmbeddingVectorConverter.class)
    @Column(length = 16384)
    private EmbeddingVector embedding;

    private String embeddingModel;

    @Column(nullable = false)
    private LocalDateTime uploadedAt;

    private LocalDateTime processedAt;

    public Set<String> skillSet() {
        return SkillSet.fromColumn(skills);
    }
}
