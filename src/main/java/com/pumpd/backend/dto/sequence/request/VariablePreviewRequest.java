package com.pumpd.backend.dto.sequence.request;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class VariablePreviewRequest {

    @NotNull
    private String text;

    @NotNull
    private Long restaurantId;
}
