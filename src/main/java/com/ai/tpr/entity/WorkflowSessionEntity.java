package com.ai.tpr.entity;

import com.ai.tpr.calculation.AgeGroup;
import com.ai.tpr.calculation.FacilityLevel;
import com.ai.tpr.conversation.CompletionReason;
import com.ai.tpr.conversation.WorkflowStage;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Entity
@Table(name = "workflow_session", indexes = {
    @Index(name = "idx_workflow_session_session_id", columnList = "session_id", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WorkflowSessionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false)
    private String sessionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private WorkflowStage stage = WorkflowStage.INITIAL;

    private String selectedState;

    @Enumerated(EnumType.STRING)
    private FacilityLevel facilityLevel;

    @Enumerated(EnumType.STRING)
    private AgeGroup ageGroup;

    private String datasetHandle;

    @Enumerated(EnumType.STRING)
    private CompletionReason completionReason;

    @Version
    private Long version;

    private Instant createdAt;

    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Moves {@code updatedAt} strictly forward, so a save with unchanged
     * workflow fields is still an UPDATE and still bumps {@link #version}.
     */
    public void touch() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        updatedAt = updatedAt != null && !now.isAfter(updatedAt) ? updatedAt.plus(1, ChronoUnit.MICROS) : now;
    }
}
