package com.pumpd.backend.dto.sequence.response;

import com.pumpd.backend.enums.TaskPriority;
import com.pumpd.backend.enums.TaskStatus;
import com.pumpd.backend.enums.TaskType;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

@Data
@Builder
public class TaskDto {
    private Long id;
    private Long restaurantId;
    private Long sequenceInstanceId;
    private Integer sequenceStepOrder;
    private Long messageTemplateId;
    private String name;
    private String description;
    private TaskType type;
    private TaskStatus status;
    private TaskPriority priority;
    private String message;
    private String messageRendered;
    private String subjectLine;
    private String subjectLineRendered;
    private OffsetDateTime dueDate;
    private OffsetDateTime completedAt;
    private OffsetDateTime cancelledAt;
    private String assignedTo;
    private String createdBy;
}
