package com.pumpd.backend.dto.sequence.response;

import com.pumpd.backend.enums.BulkFailureReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a bulk start. Every requested restaurant id appears once, in either list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkStartResultDto {

    @Builder.Default
    private List<Succeeded> succeeded = new ArrayList<>();

    @Builder.Default
    private List<Failed> failed = new ArrayList<>();

    private Summary summary;

    public boolean allSucceeded() {
        return failed.isEmpty();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Succeeded {
        private Long restaurantId;
        private String restaurantName;
        private Long instanceId;
        private int tasksCreated;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Failed {
        private Long restaurantId;
        private String restaurantName;
        private String error;
        private BulkFailureReason reason;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private int total;
        private int success;
        private int failure;
    }
}
