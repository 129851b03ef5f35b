package com.pumpd.backend.services.sequence;

import com.pumpd.backend.config.SequenceProperties;
import com.pumpd.backend.enums.InstanceStatus;
import com.pumpd.backend.enums.TaskStatus;
import com.pumpd.backend.models.Restaurant;
import com.pumpd.backend.models.sequence.*;
import com.pumpd.backend.repositories.sequence.MessageTemplateRepository;
import com.pumpd.backend.security.OrgContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns a template's steps into the instance row and task rows for one restaurant.
 * Builds objects only; persisting them is up to the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SequenceTaskFactory {

    private final VariableResolutionService variableResolutionService;
    private final MessageTemplateRepository messageTemplateRepository;
    private final SequenceProperties properties;

    /**
     * Message templates referenced by any step, keyed by id. Loaded once per start or bulk start.
     * Templates that no longer exist are simply absent, and those steps fall back to their own text.
     */
    public Map<Long, MessageTemplate> loadMessageTemplates(OrgContext org, SequenceTemplate template) {
        Set<Long> ids = template.getSteps().stream()
                .map(SequenceStep::getMessageTemplateId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());

        if (ids.isEmpty()) {
            return Collections.emptyMap();
        }

        return messageTemplateRepository.findByOrganisationIdAndIdIn(org.organisationId(), ids).stream()
                .collect(Collectors.toMap(MessageTemplate::getId, Function.identity()));
    }

    public SequenceInstance newInstance(OrgContext org, SequenceTemplate template, Restaurant restaurant,
                                        String assignedTo, OffsetDateTime now) {
        String date = now.atZoneSameInstant(properties.resolveZone()).format(DateTimeFormatter.ISO_LOCAL_DATE);

        return SequenceInstance.builder()
                .organisationId(org.organisationId())
                .sequenceTemplateId(template.getId())
                .restaurantId(restaurant.getId())
                .name(template.getName() + " - " + restaurant.getName() + " - " + date)
                .status(InstanceStatus.ACTIVE)
                .currentStepOrder(1)
                .totalSteps(template.getStepCount())
                .assignedTo(assignedTo != null ? assignedTo : org.userId())
                .createdBy(org.userId())
                .startedAt(now)
                .build();
    }

    /**
     * One task per step, in step order. The first task is active and due after its own delay;
     * the rest stay pending with no due date until they are activated.
     */
    public List<Task> buildTasks(SequenceTemplate template, SequenceInstance instance, Restaurant restaurant,
                                 Map<Long, MessageTemplate> messageTemplates, OffsetDateTime now) {
        List<SequenceStep> steps = new ArrayList<>(template.getSteps());
        steps.sort(Comparator.comparing(SequenceStep::getStepOrder));

        List<Task> tasks = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            tasks.add(buildTask(steps.get(i), i == 0, instance, restaurant, messageTemplates, now));
        }
        return tasks;
    }

    private Task buildTask(SequenceStep step, boolean first, SequenceInstance instance, Restaurant restaurant,
                           Map<Long, MessageTemplate> messageTemplates, OffsetDateTime now) {
        MessageTemplate messageTemplate = selectTemplate(step, messageTemplates);
        String message = messageTemplate != null ? messageTemplate.getMessageContent() : inlineText(step);

        String subjectLine = null;
        String subjectLineRendered = null;
        if (step.getType().isEmail()) {
            subjectLine = step.getSubjectLine();
            if (messageTemplate != null && messageTemplate.getSubjectLine() != null) {
                subjectLine = messageTemplate.getSubjectLine();
            }
            if (subjectLine != null) {
                subjectLineRendered = variableResolutionService.resolve(subjectLine, restaurant);
            }
        }

        return Task.builder()
                .organisationId(instance.getOrganisationId())
                .restaurantId(restaurant.getId())
                .sequenceInstanceId(instance.getId())
                .sequenceStepOrder(step.getStepOrder())
                .messageTemplateId(messageTemplate != null ? messageTemplate.getId() : null)
                .name(step.getName())
                .description(step.getDescription())
                .type(step.getType())
                .priority(step.getPriority())
                .status(first ? TaskStatus.ACTIVE : TaskStatus.PENDING)
                .message(message)
                .messageRendered(variableResolutionService.resolve(message, restaurant))
                .subjectLine(subjectLine)
                .subjectLineRendered(subjectLineRendered)
                .dueDate(first ? step.dueFrom(now) : null)
                .assignedTo(instance.getAssignedTo())
                .createdBy(instance.getCreatedBy())
                .build();
    }

    private MessageTemplate selectTemplate(SequenceStep step, Map<Long, MessageTemplate> messageTemplates) {
        MessageSource source = step.getMessageSource();
        if (source instanceof MessageSource.TemplateRef ref) {
            MessageTemplate template = messageTemplates.get(ref.messageTemplateId());
            if (template == null) {
                log.warn("Message template {} for step {} not found, using the step's own message",
                        ref.messageTemplateId(), step.getStepOrder());
            }
            return template;
        }
        return null;
    }

    private static String inlineText(SequenceStep step) {
        MessageSource source = step.getMessageSource();
        if (source instanceof MessageSource.TemplateRef ref) {
            return ref.fallbackText();
        }
        return ((MessageSource.Inline) source).text();
    }
}
