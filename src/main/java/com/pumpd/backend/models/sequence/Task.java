package com.pumpd.backend.models.sequence;

import com.pumpd.backend.enums.TaskPriority;
import com.pumpd.backend.enums.TaskStatus;
import com.pumpd.backend.enums.TaskType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;

/**
 * A unit of outreach work. Tasks created from a sequence carry the instance id and
 * the order of the step they came from; standalone tasks have neither.
 */
@Entity
@Table(name = "tasks", indexes = {
        @Index(name = "idx_tasks_sequence_instance", columnList = "sequence_instance_id"),
        @Index(name = "idx_tasks_org_due", columnList = "organisation_id, due_date")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_tasks_instance_step", columnNames = {"sequence_instance_id", "sequence_step_order"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "organisation_id", nullable = false)
    private Long organisationId;

    @Column(name = "restaurant_id", nullable = false)
    private Long restaurantId;

    @Column(name = "sequence_instance_id")
    private Long sequenceInstanceId;

    @Column(name = "sequence_step_order")
    private Integer sequenceStepOrder;

    @Column(name = "message_template_id")
    private Long messageTemplateId;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private TaskType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private TaskPriority priority = TaskPriority.MEDIUM;

    @Column(columnDefinition = "TEXT")
    private String message;

    @Column(name = "message_rendered", columnDefinition = "TEXT")
    private String messageRendered;

    @Column(name = "subject_line")
    private String subjectLine;

    @Column(name = "subject_line_rendered")
    private String subjectLineRendered;

    @Column(name = "due_date")
    private OffsetDateTime dueDate;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "cancelled_at")
    private OffsetDateTime cancelledAt;

    @Column(name = "assigned_to")
    private String assignedTo;

    @Column(name = "created_by")
    private String createdBy;

    @Version
    @Column(name = "version")
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public boolean isPartOfSequence() {
        return sequenceInstanceId != null;
    }

    public void markActive(OffsetDateTime dueDate) {
        this.status = TaskStatus.ACTIVE;
        this.dueDate = dueDate;
    }

    public void markCompleted(OffsetDateTime now) {
        this.status = TaskStatus.COMPLETED;
        this.completedAt = now;
    }

    public void markCancelled(OffsetDateTime now) {
        this.status = TaskStatus.CANCELLED;
        this.cancelledAt = now;
    }
}
