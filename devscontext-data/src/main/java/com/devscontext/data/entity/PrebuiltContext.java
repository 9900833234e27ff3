package com.devscontext.data.entity;

import com.devscontext.data.converter.StringListConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One pre-built context per task. Rows are written by the preprocessing agent
 * and read by the API process; both open the same database.
 */
@Entity
@Table(name = "prebuilt_context", indexes = {
    @Index(name = "idx_prebuilt_expires_at", columnList = "expires_at"),
    @Index(name = "idx_prebuilt_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PrebuiltContext {

    @Id
    @Column(name = "task_id", nullable = false, length = 128)
    private String taskId;

    @Column(name = "synthesized_context", nullable = false, columnDefinition = "TEXT")
    private String synthesizedContext;

    @Convert(converter = StringListConverter.class)
    @Column(name = "sources_used", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> sourcesUsed = new ArrayList<>();

    @Column(name = "quality_score", nullable = false)
    private Double qualityScore;

    @Convert(converter = StringListConverter.class)
    @Column(name = "gaps", columnDefinition = "TEXT")
    @Builder.Default
    private List<String> gaps = new ArrayList<>();

    @Column(name = "source_data_hash", nullable = false, length = 64)
    private String sourceDataHash;

    @Column(name = "built_at", nullable = false)
    private Instant builtAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    @Builder.Default
    private ContextStatus status = ContextStatus.ACTIVE;

    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }
}
