package com.pumpd.backend.dto.sequence.request;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class UpdateTemplateStatusRequest {

    @NotNull
    private Boolean isActive;
}
