package com.pumpd.backend.util;

import com.pumpd.backend.dto.sequence.response.*;
import com.pumpd.backend.models.sequence.*;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public class SequenceMapper {

    public static SequenceInstanceDto toDto(SequenceInstance instance) {
        if (instance == null) {
            return null;
        }

        return SequenceInstanceDto.builder()
                .id(instance.getId())
                .sequenceTemplateId(instance.getSequenceTemplateId())
                .restaurantId(instance.getRestaurantId())
                .name(instance.getName())
                .status(instance.getStatus())
                .currentStepOrder(instance.getCurrentStepOrder())
                .totalSteps(instance.getTotalSteps())
                .assignedTo(instance.getAssignedTo())
                .createdBy(instance.getCreatedBy())
                .startedAt(instance.getStartedAt())
                .pausedAt(instance.getPausedAt())
                .completedAt(instance.getCompletedAt())
                .cancelledAt(instance.getCancelledAt())
                .createdAt(instance.getCreatedAt())
                .build();
    }

    public static SequenceInstanceDto toDto(InstanceWithTasks loaded) {
        if (loaded == null) {
            return null;
        }

        SequenceInstanceDto dto = toDto(loaded.instance());
        dto.setTasks(toTaskDtos(loaded.tasks()));
        dto.setProgress(toProgress(loaded));
        return dto;
    }

    public static SequenceProgressDto.Progress toProgress(InstanceWithTasks loaded) {
        Integer total = loaded.instance().getTotalSteps();
        return SequenceProgressDto.Progress.builder()
                .completed(loaded.completedCount())
                .total(total != null ? total : 0)
                .percentage(loaded.percentComplete())
                .build();
    }

    public static TaskDto toDto(Task task) {
        if (task == null) {
            return null;
        }

        return TaskDto.builder()
                .id(task.getId())
                .restaurantId(task.getRestaurantId())
                .sequenceInstanceId(task.getSequenceInstanceId())
                .sequenceStepOrder(task.getSequenceStepOrder())
                .messageTemplateId(task.getMessageTemplateId())
                .name(task.getName())
                .description(task.getDescription())
                .type(task.getType())
                .status(task.getStatus())
                .priority(task.getPriority())
                .message(task.getMessage())
                .messageRendered(task.getMessageRendered())
                .subjectLine(task.getSubjectLine())
                .subjectLineRendered(task.getSubjectLineRendered())
                .dueDate(task.getDueDate())
                .completedAt(task.getCompletedAt())
                .cancelledAt(task.getCancelledAt())
                .assignedTo(task.getAssignedTo())
                .createdBy(task.getCreatedBy())
                .build();
    }

    public static List<TaskDto> toTaskDtos(List<Task> tasks) {
        if (tasks == null) {
            return Collections.emptyList();
        }
        return tasks.stream().map(SequenceMapper::toDto).collect(Collectors.toList());
    }

    public static FinishResultDto toDto(FinishedSequence finished) {
        FollowUpHandoff followUp = finished.followUp();

        return FinishResultDto.builder()
                .mode(finished.mode())
                .instance(toDto(finished.instance()))
                .completedTasks(toTaskDtos(finished.completedTasks()))
                .cancelledTasks(toTaskDtos(finished.cancelledTasks()))
                .followUp(followUp == null ? null : FinishResultDto.FollowUpHandoffDto.builder()
                        .restaurantId(followUp.restaurantId())
                        .restaurantName(followUp.restaurantName())
                        .fromTaskId(followUp.fromTaskId())
                        .build())
                .nextInstance(toDto(finished.nextSequence()))
                .build();
    }

    public static TaskProgressionResultDto toDto(TaskProgression progression) {
        return TaskProgressionResultDto.builder()
                .task(toDto(progression.task()))
                .nextTask(toDto(progression.nextTask()))
                .sequenceCompleted(progression.sequenceCompleted())
                .warning(progression.warning())
                .build();
    }

    public static SequenceTemplateDto toDto(SequenceTemplate template) {
        if (template == null) {
            return null;
        }

        return SequenceTemplateDto.builder()
                .id(template.getId())
                .name(template.getName())
                .description(template.getDescription())
                .isActive(template.getIsActive())
                .usageCount(template.getUsageCount())
                .stepCount(template.getStepCount())
                .createdBy(template.getCreatedBy())
                .createdAt(template.getCreatedAt())
                .updatedAt(template.getUpdatedAt())
                .steps(template.getSteps().stream().map(SequenceMapper::toDto).collect(Collectors.toList()))
                .build();
    }

    public static SequenceStepDto toDto(SequenceStep step) {
        return SequenceStepDto.builder()
                .id(step.getId())
                .stepOrder(step.getStepOrder())
                .name(step.getName())
                .description(step.getDescription())
                .type(step.getType())
                .priority(step.getPriority())
                .delayValue(step.getDelayValue())
                .delayUnit(step.getDelayUnit())
                .delayDescription(step.getDelayDescription())
                .messageTemplateId(step.getMessageTemplateId())
                .customMessage(step.getCustomMessage())
                .subjectLine(step.getSubjectLine())
                .build();
    }
}
