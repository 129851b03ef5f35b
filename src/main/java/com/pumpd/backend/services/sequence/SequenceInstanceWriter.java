package com.pumpd.backend.services.sequence;

import com.pumpd.backend.exceptions.SequencePersistenceException;
import com.pumpd.backend.models.Restaurant;
import com.pumpd.backend.models.sequence.*;
import com.pumpd.backend.repositories.sequence.SequenceInstanceRepository;
import com.pumpd.backend.repositories.sequence.TaskRepository;
import com.pumpd.backend.security.OrgContext;
import jakarta.persistence.PersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * Writes one instance and all of its tasks in their own transaction.
 * Either every row is committed or none is, whatever the caller's transaction does.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SequenceInstanceWriter {

    private final SequenceInstanceRepository instanceRepository;
    private final TaskRepository taskRepository;
    private final SequenceTaskFactory taskFactory;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public InstanceWithTasks write(OrgContext org,
                                   SequenceTemplate template,
                                   Restaurant restaurant,
                                   Map<Long, MessageTemplate> messageTemplates,
                                   String assignedTo,
                                   OffsetDateTime now) {
        SequenceInstance instance = instanceRepository.save(
                taskFactory.newInstance(org, template, restaurant, assignedTo, now));

        List<Task> tasks = taskFactory.buildTasks(template, instance, restaurant, messageTemplates, now);

        List<Task> created;
        try {
            created = taskRepository.saveAll(tasks);
            taskRepository.flush();
        } catch (DataAccessException | PersistenceException e) {
            log.warn("Task insert failed for instance {} (restaurant {}), rolling back: {}",
                    instance.getId(), restaurant.getId(), e.getMessage());
            throw new SequencePersistenceException(
                    "Failed to create tasks for restaurant " + restaurant.getId(), e);
        }

        int expected = template.getStepCount();
        if (created.size() != expected) {
            log.warn("Created {} tasks for instance {} but template {} has {} steps, rolling back",
                    created.size(), instance.getId(), template.getId(), expected);
            throw new SequencePersistenceException(
                    "Expected " + expected + " tasks but created " + created.size());
        }

        return new InstanceWithTasks(instance, created);
    }
}
