package com.pumpd.backend.dto.sequence.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSequenceTemplateRequest {

    @NotBlank
    @Size(min = 3, max = 100)
    private String name;

    private String description;

    private Boolean isActive;

    @NotEmpty
    @Size(max = 50)
    @Valid
    private List<CreateSequenceStepRequest> steps;
}
