package com.pumpd.backend.dto.sequence.response;

import com.pumpd.backend.enums.InstanceStatus;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
public class SequenceInstanceDto {
    private Long id;
    private Long sequenceTemplateId;
    private Long restaurantId;
    private String name;
    private InstanceStatus status;
    private Integer currentStepOrder;
    private Integer totalSteps;
    private String assignedTo;
    private String createdBy;
    private OffsetDateTime startedAt;
    private OffsetDateTime pausedAt;
    private OffsetDateTime completedAt;
    private OffsetDateTime cancelledAt;
    private OffsetDateTime createdAt;

    // Only set when tasks were loaded with the instance
    private List<TaskDto> tasks;
    private SequenceProgressDto.Progress progress;
}
