package com.pumpd.backend.models.sequence;

import com.pumpd.backend.enums.DelayUnit;
import com.pumpd.backend.enums.TaskPriority;
import com.pumpd.backend.enums.TaskType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;

@Entity
@Table(name = "sequence_steps",
        uniqueConstraints = @UniqueConstraint(columnNames = {"sequence_template_id", "step_order"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SequenceStep {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "sequence_template_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private SequenceTemplate sequenceTemplate;

    @Column(name = "step_order", nullable = false)
    private Integer stepOrder;

    @Column(nullable = false)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private TaskType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private TaskPriority priority = TaskPriority.MEDIUM;

    // Relative to the previous step
    @Column(name = "delay_value", nullable = false)
    @Builder.Default
    private Integer delayValue = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "delay_unit", nullable = false, length = 10)
    @Builder.Default
    private DelayUnit delayUnit = DelayUnit.DAYS;

    @Column(name = "message_template_id")
    private Long messageTemplateId;

    @Column(name = "custom_message", columnDefinition = "TEXT")
    private String customMessage;

    @Column(name = "subject_line")
    private String subjectLine;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    public MessageSource getMessageSource() {
        return MessageSource.of(messageTemplateId, customMessage);
    }

    public OffsetDateTime dueFrom(OffsetDateTime from) {
        return delayUnit.addTo(from, delayValue != null ? delayValue : 0);
    }

    public String getDelayDescription() {
        return delayUnit.describe(delayValue != null ? delayValue : 0);
    }
}
