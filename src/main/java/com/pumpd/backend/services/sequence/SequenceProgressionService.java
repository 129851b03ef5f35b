package com.pumpd.backend.services.sequence;

import com.pumpd.backend.enums.InstanceStatus;
import com.pumpd.backend.enums.TaskStatus;
import com.pumpd.backend.exceptions.InvalidStateTransitionException;
import com.pumpd.backend.exceptions.ResourceNotFoundException;
import com.pumpd.backend.exceptions.SequenceValidationException;
import com.pumpd.backend.models.sequence.SequenceInstance;
import com.pumpd.backend.models.sequence.SequenceStep;
import com.pumpd.backend.models.sequence.Task;
import com.pumpd.backend.models.sequence.TaskProgression;
import com.pumpd.backend.repositories.sequence.SequenceInstanceRepository;
import com.pumpd.backend.repositories.sequence.SequenceStepRepository;
import com.pumpd.backend.repositories.sequence.TaskRepository;
import com.pumpd.backend.security.OrgContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.Optional;

/**
 * Moves a running sequence forward as its tasks are completed or skipped.
 * The next pending task only gets a due date when it is activated: its own delay counted from then.
 */
@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class SequenceProgressionService {

    private final TaskRepository taskRepository;
    private final SequenceInstanceRepository instanceRepository;
    private final SequenceStepRepository stepRepository;
    private final Clock clock;

    public TaskProgression completeTask(OrgContext org, Long taskId) {
        Task task = findTask(org, taskId);
        SequenceInstance instance = lockInstance(org, task);
        assertOpen(task, "complete");
        OffsetDateTime now = OffsetDateTime.now(clock);
        boolean wasActive = task.getStatus() == TaskStatus.ACTIVE;
        String warning = outOfOrderWarning(task);

        task.markCompleted(now);
        taskRepository.save(task);
        log.info("Task {} completed (step {} of instance {})",
                taskId, task.getSequenceStepOrder(), task.getSequenceInstanceId());

        return progress(task, instance, wasActive, warning, now);
    }

    /**
     * Skip a sequence step. The task is cancelled and, if it was the current step, the next one is activated.
     */
    public TaskProgression skipTask(OrgContext org, Long taskId) {
        Task task = findTask(org, taskId);
        if (!task.isPartOfSequence()) {
            throw new SequenceValidationException("Only tasks that belong to a sequence can be skipped");
        }
        SequenceInstance instance = lockInstance(org, task);
        assertOpen(task, "skip");
        OffsetDateTime now = OffsetDateTime.now(clock);
        boolean wasActive = task.getStatus() == TaskStatus.ACTIVE;

        task.markCancelled(now);
        taskRepository.save(task);
        log.info("Task {} skipped (step {} of instance {})",
                taskId, task.getSequenceStepOrder(), task.getSequenceInstanceId());

        return progress(task, instance, wasActive, null, now);
    }

    /**
     * Activate the next pending task after {@code afterStepOrder}, falling back to any earlier pending task.
     * When nothing is left open the instance is completed.
     *
     * @return the activated task, or empty if the instance was completed or still has an active task
     */
    public Optional<Task> activateNext(SequenceInstance instance, int afterStepOrder, OffsetDateTime now) {
        Optional<Task> next = nextPending(instance.getId(), afterStepOrder);
        if (next.isEmpty()) {
            next = nextPending(instance.getId(), 0);
        }

        if (next.isPresent()) {
            Task task = next.get();
            OffsetDateTime dueDate = stepRepository
                    .findBySequenceTemplateIdAndStepOrder(instance.getSequenceTemplateId(), task.getSequenceStepOrder())
                    .map(step -> step.dueFrom(now))
                    .orElse(now);
            task.markActive(dueDate);
            taskRepository.save(task);

            instance.setCurrentStepOrder(task.getSequenceStepOrder());
            instanceRepository.save(instance);
            log.debug("Activated step {} of instance {}, due {}", task.getSequenceStepOrder(), instance.getId(), dueDate);
            return Optional.of(task);
        }

        if (!taskRepository.existsBySequenceInstanceIdAndStatus(instance.getId(), TaskStatus.ACTIVE)) {
            instance.markCompleted(now);
            instanceRepository.save(instance);
            log.info("Sequence instance {} completed, no steps left", instance.getId());
        }
        return Optional.empty();
    }

    private TaskProgression progress(Task task, SequenceInstance instance, boolean wasActive, String warning,
                                     OffsetDateTime now) {
        if (instance == null) {
            return new TaskProgression(task, null, false, warning);
        }

        // Paused instances keep their place; resume picks up the activation
        if (instance.getStatus() != InstanceStatus.ACTIVE || !wasActive) {
            return new TaskProgression(task, null, false, warning);
        }

        Task next = activateNext(instance, task.getSequenceStepOrder(), now).orElse(null);
        return new TaskProgression(task, next, instance.getStatus() == InstanceStatus.COMPLETED, warning);
    }

    private Task findTask(OrgContext org, Long taskId) {
        return taskRepository.findByIdAndOrganisationId(taskId, org.organisationId())
                .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
    }

    /**
     * Sequence tasks are changed under the instance row lock, the same lock instance transitions take.
     * A task read that went stale while waiting fails on its version when flushed.
     */
    private SequenceInstance lockInstance(OrgContext org, Task task) {
        if (!task.isPartOfSequence()) {
            return null;
        }
        return instanceRepository.findForUpdate(task.getSequenceInstanceId(), org.organisationId())
                .orElseThrow(() -> new ResourceNotFoundException("Sequence instance", task.getSequenceInstanceId()));
    }

    private void assertOpen(Task task, String action) {
        if (task.getStatus().isTerminal()) {
            throw new InvalidStateTransitionException(action, task.getStatus().name(),
                    "Task " + task.getId() + " is already " + task.getStatus().getDisplayName().toLowerCase());
        }
    }

    private String outOfOrderWarning(Task task) {
        if (!task.isPartOfSequence() || task.getSequenceStepOrder() == null) {
            return null;
        }
        long open = taskRepository.countBySequenceInstanceIdAndSequenceStepOrderLessThanAndStatusIn(
                task.getSequenceInstanceId(), task.getSequenceStepOrder(),
                EnumSet.of(TaskStatus.PENDING, TaskStatus.ACTIVE));
        if (open == 0) {
            return null;
        }
        return open + " earlier step" + (open == 1 ? " is" : "s are") + " not finished yet";
    }

    private Optional<Task> nextPending(Long instanceId, int afterStepOrder) {
        return taskRepository.findFirstBySequenceInstanceIdAndStatusAndSequenceStepOrderGreaterThanOrderBySequenceStepOrderAsc(
                instanceId, TaskStatus.PENDING, afterStepOrder);
    }
}
