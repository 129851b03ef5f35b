package com.pumpd.backend.dto.sequence.request;

import com.pumpd.backend.enums.FinishMode;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinishSequenceRequest {

    @NotNull
    private FinishMode mode;

    // Only read for finish-start-new; defaults to the finished instance's template
    private Long nextTemplateId;
}
