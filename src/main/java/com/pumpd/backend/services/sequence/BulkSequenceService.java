package com.pumpd.backend.services.sequence;

import com.pumpd.backend.config.SequenceProperties;
import com.pumpd.backend.dto.sequence.response.BulkStartResultDto;
import com.pumpd.backend.enums.BulkFailureReason;
import com.pumpd.backend.exceptions.ResourceNotFoundException;
import com.pumpd.backend.exceptions.SequenceValidationException;
import com.pumpd.backend.models.Restaurant;
import com.pumpd.backend.models.sequence.InstanceWithTasks;
import com.pumpd.backend.models.sequence.MessageTemplate;
import com.pumpd.backend.models.sequence.SequenceTemplate;
import com.pumpd.backend.repositories.RestaurantRepository;
import com.pumpd.backend.security.OrgContext;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Starts one template for many restaurants.
 * <p>
 * The request and the template are checked once, up front; either failing rejects the whole call.
 * After that each restaurant is written in its own transaction and a failure is recorded
 * against that restaurant only. Restaurants are processed in request order within a time
 * budget that grows with the number of restaurants; once it runs out the rest are reported
 * as failed without being attempted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BulkSequenceService {

    static final String BUDGET_EXCEEDED = "Time budget exceeded before this restaurant was processed";

    private final SequenceTemplateService templateService;
    private final SequenceInstanceService instanceService;
    private final SequenceTaskFactory taskFactory;
    private final RestaurantRepository restaurantRepository;
    private final SequenceProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public BulkStartResultDto startBulk(OrgContext org, Long templateId, List<Long> restaurantIds, String assignedTo) {
        validateRequest(templateId, restaurantIds);

        SequenceTemplate template = templateService.loadForStart(org, templateId);
        Map<Long, MessageTemplate> messageTemplates = taskFactory.loadMessageTemplates(org, template);

        Map<Long, Restaurant> restaurants = restaurantRepository
                .findByOrganisationIdAndIdIn(org.organisationId(), new LinkedHashSet<>(restaurantIds))
                .stream()
                .collect(Collectors.toMap(Restaurant::getId, Function.identity()));

        log.info("Bulk start of template {} '{}' for {} restaurants ({} found) in organisation {}",
                templateId, template.getName(), restaurantIds.size(), restaurants.size(), org.organisationId());

        Timer.Sample sample = Timer.start(meterRegistry);
        Instant deadline = clock.instant().plus(properties.getBulk().budgetFor(restaurantIds.size()));

        List<BulkStartResultDto.Succeeded> succeeded = new ArrayList<>();
        List<BulkStartResultDto.Failed> failed = new ArrayList<>();

        for (Long restaurantId : restaurantIds) {
            Restaurant restaurant = restaurants.get(restaurantId);
            if (restaurant == null) {
                failed.add(failure(restaurantId, null, "Restaurant not found", BulkFailureReason.NOT_FOUND));
                continue;
            }

            if (clock.instant().isAfter(deadline)) {
                failed.add(failure(restaurantId, restaurant.getName(), BUDGET_EXCEEDED, BulkFailureReason.SERVER_ERROR));
                continue;
            }

            try {
                InstanceWithTasks started = instanceService.createInstance(
                        org, template, restaurant, messageTemplates, assignedTo);
                succeeded.add(BulkStartResultDto.Succeeded.builder()
                        .restaurantId(restaurantId)
                        .restaurantName(restaurant.getName())
                        .instanceId(started.instance().getId())
                        .tasksCreated(started.taskCount())
                        .build());
            } catch (SequenceValidationException e) {
                log.warn("Bulk start: restaurant {} rejected: {}", restaurantId, e.getMessage());
                failed.add(failure(restaurantId, restaurant.getName(), e.getMessage(), BulkFailureReason.VALIDATION_ERROR));
            } catch (ResourceNotFoundException e) {
                failed.add(failure(restaurantId, restaurant.getName(), e.getMessage(), BulkFailureReason.NOT_FOUND));
            } catch (RuntimeException e) {
                log.warn("Bulk start: restaurant {} failed: {}", restaurantId, e.getMessage(), e);
                failed.add(failure(restaurantId, restaurant.getName(), e.getMessage(), BulkFailureReason.SERVER_ERROR));
            }
        }

        recordUsage(templateId, succeeded.size());

        sample.stop(Timer.builder("sequences.bulk.duration")
                .description("Time taken to start a bulk sequence request")
                .register(meterRegistry));
        Counter.builder("sequences.started")
                .description("Sequence instances started")
                .tag("mode", "bulk")
                .register(meterRegistry)
                .increment(succeeded.size());
        Counter.builder("sequences.bulk.failures")
                .description("Restaurants that failed within bulk starts")
                .register(meterRegistry)
                .increment(failed.size());

        log.info("Bulk start of template {} finished: {} succeeded, {} failed",
                templateId, succeeded.size(), failed.size());

        return BulkStartResultDto.builder()
                .succeeded(succeeded)
                .failed(failed)
                .summary(BulkStartResultDto.Summary.builder()
                        .total(restaurantIds.size())
                        .success(succeeded.size())
                        .failure(failed.size())
                        .build())
                .build();
    }

    private void validateRequest(Long templateId, List<Long> restaurantIds) {
        if (templateId == null) {
            throw new SequenceValidationException("sequenceTemplateId is required");
        }
        if (restaurantIds == null || restaurantIds.isEmpty()) {
            throw new SequenceValidationException("At least one restaurant id is required");
        }
        int max = properties.getBulk().getMaxRestaurants();
        if (restaurantIds.size() > max) {
            throw new SequenceValidationException(
                    "A bulk start is limited to " + max + " restaurants, got " + restaurantIds.size());
        }
        if (restaurantIds.stream().anyMatch(Objects::isNull)) {
            throw new SequenceValidationException("Restaurant ids must not be null");
        }
    }

    private void recordUsage(Long templateId, int successes) {
        // Instances are already committed at this point, so a counter failure must not fail the call
        try {
            templateService.recordUsage(templateId, successes);
        } catch (DataAccessException e) {
            log.error("Failed to add {} to usage count of template {}: {}", successes, templateId, e.getMessage(), e);
        }
    }

    private static BulkStartResultDto.Failed failure(Long restaurantId, String restaurantName,
                                                     String error, BulkFailureReason reason) {
        return BulkStartResultDto.Failed.builder()
                .restaurantId(restaurantId)
                .restaurantName(restaurantName)
                .error(error)
                .reason(reason)
                .build();
    }
}
