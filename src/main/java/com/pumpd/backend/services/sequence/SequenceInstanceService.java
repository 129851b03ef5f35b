package com.pumpd.backend.services.sequence;

import com.pumpd.backend.dto.sequence.response.SequenceProgressDto;
import com.pumpd.backend.enums.InstanceStatus;
import com.pumpd.backend.exceptions.ResourceNotFoundException;
import com.pumpd.backend.exceptions.SequencePersistenceException;
import com.pumpd.backend.models.Restaurant;
import com.pumpd.backend.models.sequence.*;
import com.pumpd.backend.repositories.RestaurantRepository;
import com.pumpd.backend.repositories.sequence.SequenceInstanceRepository;
import com.pumpd.backend.repositories.sequence.TaskRepository;
import com.pumpd.backend.security.OrgContext;
import com.pumpd.backend.util.SequenceMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.*;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class SequenceInstanceService {

    private final SequenceTemplateService templateService;
    private final SequenceTaskFactory taskFactory;
    private final SequenceInstanceWriter instanceWriter;
    private final SequenceInstanceRepository instanceRepository;
    private final TaskRepository taskRepository;
    private final RestaurantRepository restaurantRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Start a template against one restaurant.
     * Starting the same template twice for a restaurant gives two independent instances.
     *
     * @param assignedTo user the tasks are assigned to; the acting user when null
     */
    public InstanceWithTasks start(OrgContext org, Long templateId, Long restaurantId, String assignedTo) {
        SequenceTemplate template = templateService.loadForStart(org, templateId);

        Restaurant restaurant = restaurantRepository.findByIdAndOrganisationId(restaurantId, org.organisationId())
                .orElseThrow(() -> new ResourceNotFoundException("Restaurant", restaurantId));

        Map<Long, MessageTemplate> messageTemplates = taskFactory.loadMessageTemplates(org, template);
        InstanceWithTasks started = createInstance(org, template, restaurant, messageTemplates, assignedTo);

        templateService.recordUsage(template.getId(), 1);

        Counter.builder("sequences.started")
                .description("Sequence instances started")
                .tag("mode", "single")
                .register(meterRegistry)
                .increment();

        log.info("Started sequence instance {} '{}' for restaurant {} with {} tasks",
                started.instance().getId(), template.getName(), restaurantId, started.taskCount());
        return started;
    }

    /**
     * Write the instance and its tasks for an already validated template and restaurant.
     * Shared by single and bulk starts; does not touch the usage counter.
     */
    public InstanceWithTasks createInstance(OrgContext org,
                                            SequenceTemplate template,
                                            Restaurant restaurant,
                                            Map<Long, MessageTemplate> messageTemplates,
                                            String assignedTo) {
        try {
            return instanceWriter.write(org, template, restaurant, messageTemplates, assignedTo, OffsetDateTime.now(clock));
        } catch (DataAccessException | TransactionException e) {
            log.error("Could not persist sequence for restaurant {}: {}", restaurant.getId(), e.getMessage(), e);
            throw new SequencePersistenceException("Failed to create sequence for restaurant " + restaurant.getId(), e);
        }
    }

    @Transactional(readOnly = true)
    public SequenceInstance getInstance(OrgContext org, Long instanceId) {
        return instanceRepository.findByIdAndOrganisationId(instanceId, org.organisationId())
                .orElseThrow(() -> new ResourceNotFoundException("Sequence instance", instanceId));
    }

    @Transactional(readOnly = true)
    public InstanceWithTasks getInstanceWithTasks(OrgContext org, Long instanceId) {
        SequenceInstance instance = getInstance(org, instanceId);
        return new InstanceWithTasks(instance,
                taskRepository.findBySequenceInstanceIdOrderBySequenceStepOrderAsc(instance.getId()));
    }

    /**
     * Instances of the organisation, newest first. Every filter is optional.
     *
     * @param search case-insensitive match on the instance name
     */
    @Transactional(readOnly = true)
    public List<InstanceWithTasks> listInstances(OrgContext org,
                                                 Collection<InstanceStatus> statuses,
                                                 Collection<Long> restaurantIds,
                                                 String assignedTo,
                                                 String search) {
        String needle = search != null && !search.isBlank() ? search.trim().toLowerCase(Locale.ROOT) : null;

        List<SequenceInstance> candidates = restaurantIds == null || restaurantIds.isEmpty()
                ? instanceRepository.findByOrganisationIdOrderByCreatedAtDesc(org.organisationId())
                : instanceRepository.findByOrganisationIdAndRestaurantIdInOrderByCreatedAtDesc(org.organisationId(), restaurantIds);

        List<SequenceInstance> instances = candidates.stream()
                .filter(i -> statuses == null || statuses.isEmpty() || statuses.contains(i.getStatus()))
                .filter(i -> assignedTo == null || assignedTo.equals(i.getAssignedTo()))
                .filter(i -> needle == null || (i.getName() != null && i.getName().toLowerCase(Locale.ROOT).contains(needle)))
                .collect(Collectors.toList());

        if (instances.isEmpty()) {
            return Collections.emptyList();
        }

        Map<Long, List<Task>> tasksByInstance = taskRepository.findBySequenceInstanceIdInOrderBySequenceStepOrderAsc(
                        instances.stream().map(SequenceInstance::getId).collect(Collectors.toList()))
                .stream()
                .collect(Collectors.groupingBy(Task::getSequenceInstanceId));

        return instances.stream()
                .map(i -> new InstanceWithTasks(i, tasksByInstance.getOrDefault(i.getId(), Collections.emptyList())))
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public SequenceProgressDto getProgress(OrgContext org, Long instanceId) {
        InstanceWithTasks loaded = getInstanceWithTasks(org, instanceId);
        SequenceInstance instance = loaded.instance();

        List<SequenceProgressDto.TimelineEntry> timeline = loaded.tasks().stream()
                .map(task -> SequenceProgressDto.TimelineEntry.builder()
                        .taskId(task.getId())
                        .stepOrder(task.getSequenceStepOrder())
                        .name(task.getName())
                        .type(task.getType())
                        .status(task.getStatus())
                        .dueDate(task.getDueDate())
                        .completedAt(task.getCompletedAt())
                        .cancelledAt(task.getCancelledAt())
                        .build())
                .collect(Collectors.toList());

        return SequenceProgressDto.builder()
                .instanceId(instance.getId())
                .status(instance.getStatus())
                .currentStep(instance.getCurrentStepOrder())
                .totalSteps(instance.getTotalSteps())
                .progress(SequenceMapper.toProgress(loaded))
                .timeline(timeline)
                .build();
    }
}
