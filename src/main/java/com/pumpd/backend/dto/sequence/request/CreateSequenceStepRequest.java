package com.pumpd.backend.dto.sequence.request;

import com.pumpd.backend.enums.DelayUnit;
import com.pumpd.backend.enums.TaskPriority;
import com.pumpd.backend.enums.TaskType;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSequenceStepRequest {

    @NotNull
    @Min(1)
    private Integer stepOrder;

    @NotBlank
    @Size(max = 255)
    private String name;

    private String description;

    @NotNull
    private TaskType type;

    private TaskPriority priority;

    @NotNull
    @Min(0)
    private Integer delayValue;

    @NotNull
    private DelayUnit delayUnit;

    private Long messageTemplateId;

    private String customMessage;

    @Size(max = 255)
    private String subjectLine;
}
