package com.pumpd.backend.services.sequence;

import com.pumpd.backend.config.SequenceProperties;
import com.pumpd.backend.enums.FinishMode;
import com.pumpd.backend.enums.InstanceStatus;
import com.pumpd.backend.enums.PausePolicy;
import com.pumpd.backend.enums.TaskStatus;
import com.pumpd.backend.exceptions.InvalidStateTransitionException;
import com.pumpd.backend.exceptions.ResourceNotFoundException;
import com.pumpd.backend.models.sequence.FinishedSequence;
import com.pumpd.backend.models.sequence.InstanceWithTasks;
import com.pumpd.backend.models.sequence.SequenceInstance;
import com.pumpd.backend.models.sequence.Task;
import com.pumpd.backend.repositories.sequence.SequenceInstanceRepository;
import com.pumpd.backend.repositories.sequence.TaskRepository;
import com.pumpd.backend.security.OrgContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * State changes of a started instance.
 * <pre>
 * ACTIVE  -- pause  --> PAUSED
 * PAUSED  -- resume --> ACTIVE
 * ACTIVE|PAUSED -- cancel --> CANCELLED
 * ACTIVE|PAUSED -- finish --> COMPLETED
 * </pre>
 * Anything else, including repeating a terminal transition, is an {@link InvalidStateTransitionException}.
 * <p>
 * {@link #load} takes a row lock on the instance, so transitions of one instance run one after the other.
 */
@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class SequenceLifecycleService {

    private final SequenceInstanceRepository instanceRepository;
    private final TaskRepository taskRepository;
    private final SequenceProgressionService progressionService;
    private final SequenceProperties properties;
    private final Clock clock;

    public SequenceInstance pause(OrgContext org, Long instanceId) {
        SequenceInstance instance = load(org, instanceId);
        if (instance.getStatus() != InstanceStatus.ACTIVE) {
            throw new InvalidStateTransitionException("pause", instance.getStatus().name());
        }

        instance.markPaused(OffsetDateTime.now(clock));
        log.info("Paused sequence instance {}", instanceId);
        return instanceRepository.save(instance);
    }

    /**
     * Resume a paused instance. Under {@link PausePolicy#FROZEN} the current step's due date moves
     * forward by the time spent paused; under {@link PausePolicy#ELAPSING} it is left alone.
     */
    public SequenceInstance resume(OrgContext org, Long instanceId) {
        SequenceInstance instance = load(org, instanceId);
        if (instance.getStatus() != InstanceStatus.PAUSED) {
            throw new InvalidStateTransitionException("resume", instance.getStatus().name());
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime pausedAt = instance.getPausedAt();
        List<Task> active = taskRepository.findBySequenceInstanceIdAndStatus(instanceId, TaskStatus.ACTIVE);

        if (properties.getPausePolicy() == PausePolicy.FROZEN && pausedAt != null && pausedAt.isBefore(now)) {
            Duration paused = Duration.between(pausedAt, now);
            for (Task task : active) {
                if (task.getDueDate() != null) {
                    task.setDueDate(task.getDueDate().plus(paused));
                }
            }
            taskRepository.saveAll(active);
            log.debug("Shifted {} active task(s) of instance {} by {}", active.size(), instanceId, paused);
        }

        instance.markResumed();
        SequenceInstance saved = instanceRepository.save(instance);

        // The current step may have been completed while paused
        if (active.isEmpty()) {
            progressionService.activateNext(saved, saved.getCurrentStepOrder(), now);
        }

        log.info("Resumed sequence instance {} ({} pause policy)", instanceId, properties.getPausePolicy());
        return saved;
    }

    /**
     * Cancel the instance and every task that has not finished yet.
     */
    public InstanceWithTasks cancel(OrgContext org, Long instanceId) {
        SequenceInstance instance = load(org, instanceId);
        if (!instance.getStatus().isRunning()) {
            throw new InvalidStateTransitionException("cancel", instance.getStatus().name());
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        List<Task> tasks = taskRepository.findBySequenceInstanceIdOrderBySequenceStepOrderAsc(instanceId);
        int cancelled = 0;
        for (Task task : tasks) {
            if (task.getStatus().isOpen()) {
                task.markCancelled(now);
                cancelled++;
            }
        }
        taskRepository.saveAll(tasks);

        instance.markCancelled(now);
        SequenceInstance saved = instanceRepository.save(instance);
        log.info("Cancelled sequence instance {} and {} open task(s)", instanceId, cancelled);
        return new InstanceWithTasks(saved, tasks);
    }

    /**
     * Complete the instance: the active task is completed, pending tasks are cancelled.
     */
    public FinishedSequence finishInstance(SequenceInstance instance, FinishMode mode) {
        if (!instance.getStatus().isRunning()) {
            throw new InvalidStateTransitionException("finish", instance.getStatus().name());
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        List<Task> tasks = taskRepository.findBySequenceInstanceIdOrderBySequenceStepOrderAsc(instance.getId());
        List<Task> completed = new ArrayList<>();
        List<Task> cancelled = new ArrayList<>();

        for (Task task : tasks) {
            if (task.getStatus() == TaskStatus.ACTIVE) {
                task.markCompleted(now);
                completed.add(task);
            } else if (task.getStatus() == TaskStatus.PENDING) {
                task.markCancelled(now);
                cancelled.add(task);
            }
        }
        taskRepository.saveAll(tasks);

        instance.markCompleted(now);
        // Flushed here so a version conflict fails the finish before any start-new commits
        SequenceInstance saved = instanceRepository.saveAndFlush(instance);
        log.info("Finished sequence instance {}: {} task(s) completed, {} cancelled",
                instance.getId(), completed.size(), cancelled.size());

        return new FinishedSequence(mode, saved, completed, cancelled, null, null);
    }

    /**
     * Load the instance for a state change, locking its row until the surrounding transaction ends.
     */
    public SequenceInstance load(OrgContext org, Long instanceId) {
        return instanceRepository.findForUpdate(instanceId, org.organisationId())
                .orElseThrow(() -> new ResourceNotFoundException("Sequence instance", instanceId));
    }
}
