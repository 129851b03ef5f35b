package com.pumpd.backend.models.sequence;

import com.pumpd.backend.enums.TaskStatus;

import java.util.List;

/**
 * An instance together with its tasks, in step order.
 */
public record InstanceWithTasks(SequenceInstance instance, List<Task> tasks) {

    public int taskCount() {
        return tasks.size();
    }

    public long completedCount() {
        return tasks.stream().filter(t -> t.getStatus() == TaskStatus.COMPLETED).count();
    }

    public int percentComplete() {
        Integer total = instance.getTotalSteps();
        if (total == null || total == 0) {
            return 0;
        }
        return (int) Math.round(completedCount() * 100.0 / total);
    }
}
