package com.pumpd.backend.dto.sequence.request;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class VariableValidationRequest {

    @NotNull
    private String text;
}
