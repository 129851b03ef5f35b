package com.pumpd.backend.dto.sequence.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Bounds on restaurantIds are checked by the bulk service, which reads the limit from config.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkStartSequenceRequest {

    private Long sequenceTemplateId;

    private List<Long> restaurantIds;

    private String assignedTo;
}
