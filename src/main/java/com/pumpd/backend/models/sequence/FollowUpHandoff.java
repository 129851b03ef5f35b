package com.pumpd.backend.models.sequence;

/**
 * Context handed to task creation after a finish-followup: which restaurant, and the task just completed.
 */
public record FollowUpHandoff(Long restaurantId, String restaurantName, Long fromTaskId) {
}
