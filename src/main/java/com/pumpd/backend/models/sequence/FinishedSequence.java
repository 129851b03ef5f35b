package com.pumpd.backend.models.sequence;

import com.pumpd.backend.enums.FinishMode;

import java.util.List;

/**
 * Result of finishing an instance early. {@code followUp} is set for finish-followup,
 * {@code nextSequence} for finish-start-new.
 */
public record FinishedSequence(
        FinishMode mode,
        SequenceInstance instance,
        List<Task> completedTasks,
        List<Task> cancelledTasks,
        FollowUpHandoff followUp,
        InstanceWithTasks nextSequence) {

    public FinishedSequence withFollowUp(FollowUpHandoff handoff) {
        return new FinishedSequence(mode, instance, completedTasks, cancelledTasks, handoff, nextSequence);
    }

    public FinishedSequence withNextSequence(InstanceWithTasks next) {
        return new FinishedSequence(mode, instance, completedTasks, cancelledTasks, followUp, next);
    }
}
