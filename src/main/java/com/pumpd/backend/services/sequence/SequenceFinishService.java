package com.pumpd.backend.services.sequence;

import com.pumpd.backend.enums.FinishMode;
import com.pumpd.backend.events.FollowUpRequestedEvent;
import com.pumpd.backend.exceptions.InvalidStateTransitionException;
import com.pumpd.backend.exceptions.SequenceValidationException;
import com.pumpd.backend.models.Restaurant;
import com.pumpd.backend.models.sequence.*;
import com.pumpd.backend.repositories.RestaurantRepository;
import com.pumpd.backend.security.OrgContext;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Ends a running sequence early and optionally hands the restaurant on:
 * <ul>
 *   <li>{@code finish-only}: nothing else happens</li>
 *   <li>{@code finish-followup}: publishes a {@link FollowUpRequestedEvent} for the task that was just completed</li>
 *   <li>{@code finish-start-new}: starts another template for the same restaurant</li>
 * </ul>
 */
@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class SequenceFinishService {

    private final SequenceLifecycleService lifecycleService;
    private final SequenceInstanceService instanceService;
    private final SequenceTemplateService templateService;
    private final RestaurantRepository restaurantRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * @param nextTemplateId template to start for finish-start-new; the finished instance's template when null
     */
    public FinishedSequence finish(OrgContext org, Long instanceId, FinishMode mode, Long nextTemplateId) {
        if (mode == null) {
            throw new SequenceValidationException("Finish mode is required");
        }

        SequenceInstance instance = lifecycleService.load(org, instanceId);
        if (!instance.getStatus().isRunning()) {
            throw new InvalidStateTransitionException("finish", instance.getStatus().name());
        }

        // Reject a bad next template before anything is written
        Long templateToStart = null;
        if (mode == FinishMode.FINISH_START_NEW) {
            templateToStart = nextTemplateId != null ? nextTemplateId : instance.getSequenceTemplateId();
            templateService.loadForStart(org, templateToStart);
        }

        FinishedSequence finished = lifecycleService.finishInstance(instance, mode);

        switch (mode) {
            case FINISH_FOLLOWUP:
                finished = finished.withFollowUp(requestFollowUp(org, finished));
                break;
            case FINISH_START_NEW:
                InstanceWithTasks next = instanceService.start(
                        org, templateToStart, instance.getRestaurantId(), instance.getAssignedTo());
                log.info("Instance {} finished, started instance {} for restaurant {}",
                        instanceId, next.instance().getId(), instance.getRestaurantId());
                finished = finished.withNextSequence(next);
                break;
            default:
                break;
        }

        Counter.builder("sequences.finished")
                .description("Sequence instances finished early")
                .tag("mode", mode.getValue())
                .register(meterRegistry)
                .increment();

        return finished;
    }

    private FollowUpHandoff requestFollowUp(OrgContext org, FinishedSequence finished) {
        SequenceInstance instance = finished.instance();
        String restaurantName = restaurantRepository
                .findByIdAndOrganisationId(instance.getRestaurantId(), org.organisationId())
                .map(Restaurant::getName)
                .orElse(null);

        List<Task> completed = finished.completedTasks();
        Long fromTaskId = completed.isEmpty() ? null : completed.get(completed.size() - 1).getId();

        FollowUpHandoff handoff = new FollowUpHandoff(instance.getRestaurantId(), restaurantName, fromTaskId);
        eventPublisher.publishEvent(new FollowUpRequestedEvent(
                org.organisationId(),
                instance.getId(),
                handoff.restaurantId(),
                handoff.restaurantName(),
                handoff.fromTaskId(),
                org.userId(),
                clock.instant()));

        log.info("Follow-up requested for restaurant {} from task {}", handoff.restaurantId(), fromTaskId);
        return handoff;
    }
}
