package com.pumpd.backend.models.sequence;

/**
 * Result of completing or skipping a task.
 *
 * @param nextTask the task activated as a result, or null
 * @param warning  set when earlier steps of the sequence were still open
 */
public record TaskProgression(Task task, Task nextTask, boolean sequenceCompleted, String warning) {
}
