package com.pumpd.backend.services.sequence;

import com.pumpd.backend.dto.sequence.request.CreateSequenceStepRequest;
import com.pumpd.backend.dto.sequence.request.CreateSequenceTemplateRequest;
import com.pumpd.backend.enums.TaskPriority;
import com.pumpd.backend.exceptions.ResourceNotFoundException;
import com.pumpd.backend.exceptions.SequenceValidationException;
import com.pumpd.backend.models.sequence.SequenceStep;
import com.pumpd.backend.models.sequence.SequenceTemplate;
import com.pumpd.backend.repositories.sequence.SequenceTemplateRepository;
import com.pumpd.backend.security.OrgContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class SequenceTemplateService {

    static final int MIN_NAME_LENGTH = 3;
    static final int MAX_NAME_LENGTH = 100;
    static final int MAX_STEPS = 50;

    private final SequenceTemplateRepository templateRepository;

    /**
     * Load a template of the caller's organisation with its steps in order.
     */
    @Transactional(readOnly = true)
    public SequenceTemplate getTemplate(OrgContext org, Long templateId) {
        return templateRepository.findWithStepsByIdAndOrganisationId(templateId, org.organisationId())
                .orElseThrow(() -> new ResourceNotFoundException("Sequence template", templateId));
    }

    @Transactional(readOnly = true)
    public List<SequenceTemplate> listTemplates(OrgContext org, boolean activeOnly, String search) {
        List<SequenceTemplate> templates = templateRepository.findAllWithStepsByOrganisationId(org.organisationId());
        boolean filtered = search != null && !search.isBlank();
        if (!activeOnly && !filtered) {
            return templates;
        }

        String needle = filtered ? search.trim().toLowerCase(Locale.ROOT) : null;
        return templates.stream()
                .filter(t -> !activeOnly || Boolean.TRUE.equals(t.getIsActive()))
                .filter(t -> needle == null || (t.getName() != null && t.getName().toLowerCase(Locale.ROOT).contains(needle)))
                .collect(Collectors.toList());
    }

    /**
     * Pre-flight check shared by single and bulk starts. Runs before anything is written.
     */
    @Transactional(readOnly = true)
    public SequenceTemplate loadForStart(OrgContext org, Long templateId) {
        if (templateId == null) {
            throw new SequenceValidationException("sequenceTemplateId is required");
        }
        SequenceTemplate template = getTemplate(org, templateId);
        assertInstantiable(template);
        return template;
    }

    public void assertInstantiable(SequenceTemplate template) {
        if (template.isInstantiable()) {
            return;
        }
        if (!Boolean.TRUE.equals(template.getIsActive())) {
            throw new SequenceValidationException(
                    "Sequence template '" + template.getName() + "' is not active");
        }
        if (!template.hasSteps()) {
            throw new SequenceValidationException(
                    "Sequence template '" + template.getName() + "' has no steps");
        }
    }

    public SequenceTemplate createTemplate(OrgContext org, CreateSequenceTemplateRequest request) {
        validateTemplateRequest(request);

        SequenceTemplate template = SequenceTemplate.builder()
                .organisationId(org.organisationId())
                .name(request.getName().trim())
                .description(request.getDescription())
                .isActive(request.getIsActive() == null || request.getIsActive())
                .createdBy(org.userId())
                .build();

        request.getSteps().stream()
                .sorted(Comparator.comparing(CreateSequenceStepRequest::getStepOrder))
                .map(this::toStep)
                .forEach(template::addStep);

        SequenceTemplate saved = templateRepository.save(template);
        log.info("Created sequence template {} '{}' with {} steps for organisation {}",
                saved.getId(), saved.getName(), saved.getStepCount(), org.organisationId());
        return saved;
    }

    public SequenceTemplate setActive(OrgContext org, Long templateId, boolean active) {
        SequenceTemplate template = getTemplate(org, templateId);
        template.setIsActive(active);
        SequenceTemplate saved = templateRepository.save(template);
        log.info("Sequence template {} {}", templateId, active ? "activated" : "deactivated");
        return saved;
    }

    /**
     * Adds {@code count} starts to the template's usage counter in a single UPDATE.
     */
    public void recordUsage(Long templateId, int count) {
        if (count <= 0) {
            return;
        }
        templateRepository.incrementUsageCount(templateId, count);
        log.debug("Usage count of template {} incremented by {}", templateId, count);
    }

    private void validateTemplateRequest(CreateSequenceTemplateRequest request) {
        String name = request.getName() != null ? request.getName().trim() : "";
        if (name.length() < MIN_NAME_LENGTH || name.length() > MAX_NAME_LENGTH) {
            throw new SequenceValidationException(
                    "Template name must be between " + MIN_NAME_LENGTH + " and " + MAX_NAME_LENGTH + " characters");
        }

        List<CreateSequenceStepRequest> steps = request.getSteps();
        if (steps == null || steps.isEmpty()) {
            throw new SequenceValidationException("A sequence template needs at least one step");
        }
        if (steps.size() > MAX_STEPS) {
            throw new SequenceValidationException("A sequence template can have at most " + MAX_STEPS + " steps");
        }

        List<CreateSequenceStepRequest> ordered = steps.stream()
                .sorted(Comparator.comparing(CreateSequenceStepRequest::getStepOrder,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .collect(Collectors.toList());

        for (int i = 0; i < ordered.size(); i++) {
            CreateSequenceStepRequest step = ordered.get(i);
            if (step.getStepOrder() == null || step.getStepOrder() != i + 1) {
                throw new SequenceValidationException("Step orders must be sequential starting from 1");
            }
            validateStep(step);
        }
    }

    private void validateStep(CreateSequenceStepRequest step) {
        String label = "Step " + step.getStepOrder();
        if (step.getName() == null || step.getName().isBlank()) {
            throw new SequenceValidationException(label + ": name is required");
        }
        if (step.getType() == null) {
            throw new SequenceValidationException(label + ": type is required");
        }
        if (step.getDelayValue() == null || step.getDelayValue() < 0 || step.getDelayUnit() == null) {
            throw new SequenceValidationException(label + ": delay must be a non-negative value with a unit");
        }
        boolean hasInline = step.getCustomMessage() != null && !step.getCustomMessage().isBlank();
        if (step.getMessageTemplateId() == null && !hasInline) {
            throw new SequenceValidationException(label + ": a message template or custom message is required");
        }
        if (step.getSubjectLine() != null && !step.getSubjectLine().isBlank() && !step.getType().isEmail()) {
            throw new SequenceValidationException(label + ": only email steps can have a subject line");
        }
    }

    private SequenceStep toStep(CreateSequenceStepRequest request) {
        return SequenceStep.builder()
                .stepOrder(request.getStepOrder())
                .name(request.getName().trim())
                .description(request.getDescription())
                .type(request.getType())
                .priority(request.getPriority() != null ? request.getPriority() : TaskPriority.MEDIUM)
                .delayValue(request.getDelayValue())
                .delayUnit(request.getDelayUnit())
                .messageTemplateId(request.getMessageTemplateId())
                .customMessage(request.getCustomMessage())
                .subjectLine(request.getSubjectLine())
                .build();
    }
}
