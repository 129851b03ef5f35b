package com.pumpd.backend.dto.sequence.response;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TaskProgressionResultDto {
    private TaskDto task;
    private TaskDto nextTask;
    private boolean sequenceCompleted;
    private String warning;
}
