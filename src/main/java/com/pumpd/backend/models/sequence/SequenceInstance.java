package com.pumpd.backend.models.sequence;

import com.pumpd.backend.enums.InstanceStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;

/**
 * One run of a sequence template against one restaurant.
 */
@Entity
@Table(name = "sequence_instances", indexes = {
        @Index(name = "idx_sequence_instances_org", columnList = "organisation_id"),
        @Index(name = "idx_sequence_instances_restaurant", columnList = "restaurant_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SequenceInstance {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organisation_id", nullable = false)
    private Long organisationId;

    @Column(name = "sequence_template_id", nullable = false)
    private Long sequenceTemplateId;

    @Column(name = "restaurant_id", nullable = false)
    private Long restaurantId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private InstanceStatus status = InstanceStatus.ACTIVE;

    @Column(name = "current_step_order", nullable = false)
    @Builder.Default
    private Integer currentStepOrder = 1;

    @Column(name = "total_steps", nullable = false)
    private Integer totalSteps;

    @Column(name = "assigned_to")
    private String assignedTo;

    @Column(name = "created_by")
    private String createdBy;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "paused_at")
    private OffsetDateTime pausedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "cancelled_at")
    private OffsetDateTime cancelledAt;

    @Version
    @Column(name = "version")
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public void markPaused(OffsetDateTime now) {
        this.status = InstanceStatus.PAUSED;
        this.pausedAt = now;
    }

    public void markResumed() {
        this.status = InstanceStatus.ACTIVE;
        this.pausedAt = null;
    }

    public void markCompleted(OffsetDateTime now) {
        this.status = InstanceStatus.COMPLETED;
        this.completedAt = now;
        this.pausedAt = null;
    }

    public void markCancelled(OffsetDateTime now) {
        this.status = InstanceStatus.CANCELLED;
        this.cancelledAt = now;
        this.pausedAt = null;
    }
}
