package com.pumpd.backend.dto.sequence.response;

import com.pumpd.backend.enums.FinishMode;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class FinishResultDto {
    private FinishMode mode;
    private SequenceInstanceDto instance;
    private List<TaskDto> completedTasks;
    private List<TaskDto> cancelledTasks;

    // finish-followup
    private FollowUpHandoffDto followUp;

    // finish-start-new
    private SequenceInstanceDto nextInstance;

    @Data
    @Builder
    public static class FollowUpHandoffDto {
        private Long restaurantId;
        private String restaurantName;
        private Long fromTaskId;
    }
}
