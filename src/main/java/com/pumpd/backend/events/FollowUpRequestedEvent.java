package com.pumpd.backend.events;

import java.time.Instant;

/**
 * Published when a sequence is finished with a follow-up. Carries what the task side
 * needs to pre-fill a follow-up task for the restaurant.
 */
public record FollowUpRequestedEvent(
        Long organisationId,
        Long sequenceInstanceId,
        Long restaurantId,
        String restaurantName,
        Long fromTaskId,
        String requestedBy,
        Instant occurredAt) {
}
