package com.pumpd.backend.dto.sequence.response;

import com.pumpd.backend.enums.InstanceStatus;
import com.pumpd.backend.enums.TaskStatus;
import com.pumpd.backend.enums.TaskType;
import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
public class SequenceProgressDto {
    private Long instanceId;
    private InstanceStatus status;
    private Integer currentStep;
    private Integer totalSteps;
    private Progress progress;
    private List<TimelineEntry> timeline;

    @Data
    @Builder
    public static class Progress {
        private long completed;
        private int total;
        private int percentage;
    }

    @Data
    @Builder
    public static class TimelineEntry {
        private Long taskId;
        private Integer stepOrder;
        private String name;
        private TaskType type;
        private TaskStatus status;
        private OffsetDateTime dueDate;
        private OffsetDateTime completedAt;
        private OffsetDateTime cancelledAt;
    }
}
