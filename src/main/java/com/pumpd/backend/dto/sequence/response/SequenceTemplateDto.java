package com.pumpd.backend.dto.sequence.response;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
public class SequenceTemplateDto {
    private Long id;
    private String name;
    private String description;
    private Boolean isActive;
    private Integer usageCount;
    private Integer stepCount;
    private String createdBy;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    private List<SequenceStepDto> steps;
}
