package com.pumpd.backend.dto.sequence.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartSequenceRequest {

    @NotNull
    private Long sequenceTemplateId;

    @NotNull
    private Long restaurantId;

    private String assignedTo;
}
