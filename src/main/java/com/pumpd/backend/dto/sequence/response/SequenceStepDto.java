package com.pumpd.backend.dto.sequence.response;

import com.pumpd.backend.enums.DelayUnit;
import com.pumpd.backend.enums.TaskPriority;
import com.pumpd.backend.enums.TaskType;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SequenceStepDto {
    private Long id;
    private Integer stepOrder;
    private String name;
    private String description;
    private TaskType type;
    private TaskPriority priority;
    private Integer delayValue;
    private DelayUnit delayUnit;
    private String delayDescription;
    private Long messageTemplateId;
    private String customMessage;
    private String subjectLine;
}
