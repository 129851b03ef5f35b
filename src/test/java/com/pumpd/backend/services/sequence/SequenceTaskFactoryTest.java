package com.pumpd.backend.services.sequence;

import com.pumpd.backend.config.SequenceProperties;
import com.pumpd.backend.enums.DelayUnit;
import com.pumpd.backend.enums.InstanceStatus;
import com.pumpd.backend.enums.TaskPriority;
import com.pumpd.backend.enums.TaskStatus;
import com.pumpd.backend.enums.TaskType;
import com.pumpd.backend.models.Restaurant;
import com.pumpd.backend.models.sequence.*;
import com.pumpd.backend.repositories.sequence.MessageTemplateRepository;
import com.pumpd.backend.security.OrgContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SequenceTaskFactoryTest {

    // Already 16 January in Auckland
    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-15T20:00:00Z");

    @Mock
    private MessageTemplateRepository messageTemplateRepository;

    private SequenceTaskFactory taskFactory;

    private OrgContext org;
    private Restaurant restaurant;
    private SequenceTemplate template;

    @BeforeEach
    void setUp() {
        SequenceProperties properties = new SequenceProperties();
        VariableResolutionService variables = new VariableResolutionService(
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC), properties);
        taskFactory = new SequenceTaskFactory(variables, messageTemplateRepository, properties);

        org = new OrgContext(1L, "user-1");

        restaurant = Restaurant.builder()
                .id(5L)
                .organisationId(1L)
                .name("Pizza Palace")
                .city("Wellington")
                .contactName("Maria Rossi")
                .build();

        template = SequenceTemplate.builder()
                .id(10L)
                .organisationId(1L)
                .name("Demo Follow-up")
                .build();
        template.addStep(SequenceStep.builder()
                .stepOrder(1).name("Send demo recap").type(TaskType.EMAIL)
                .delayValue(0).delayUnit(DelayUnit.DAYS)
                .customMessage("Hi {first_name}, thanks for your time")
                .subjectLine("Your {restaurant_name} demo")
                .build());
        template.addStep(SequenceStep.builder()
                .stepOrder(2).name("Follow-up call").type(TaskType.CALL).priority(TaskPriority.HIGH)
                .delayValue(2).delayUnit(DelayUnit.DAYS)
                .customMessage("Call {contact_name}")
                .build());
        template.addStep(SequenceStep.builder()
                .stepOrder(3).name("Final email").type(TaskType.EMAIL)
                .delayValue(5).delayUnit(DelayUnit.DAYS)
                .messageTemplateId(7L)
                .customMessage("Fallback for {restaurant_name}")
                .subjectLine("Step subject")
                .build());
    }

    @Test
    void loadMessageTemplates_OnlyReferencedIds() {
        // Given
        MessageTemplate mt = MessageTemplate.builder().id(7L).messageContent("x").build();
        when(messageTemplateRepository.findByOrganisationIdAndIdIn(eq(1L), eq(Set.of(7L)))).thenReturn(List.of(mt));

        // When
        Map<Long, MessageTemplate> loaded = taskFactory.loadMessageTemplates(org, template);

        // Then
        assertThat(loaded).containsOnlyKeys(7L);
    }

    @Test
    void loadMessageTemplates_NoReferences_SkipsQuery() {
        SequenceTemplate inline = SequenceTemplate.builder().id(11L).name("Inline").build();
        inline.addStep(SequenceStep.builder().stepOrder(1).name("Call").type(TaskType.CALL).customMessage("Hi").build());

        assertThat(taskFactory.loadMessageTemplates(org, inline)).isEmpty();
        verifyNoInteractions(messageTemplateRepository);
    }

    @Test
    void newInstance_NamedAfterTemplateRestaurantAndLocalDate() {
        // When
        SequenceInstance instance = taskFactory.newInstance(org, template, restaurant, null, NOW);

        // Then
        assertThat(instance.getName()).isEqualTo("Demo Follow-up - Pizza Palace - 2025-01-16");
        assertThat(instance.getStatus()).isEqualTo(InstanceStatus.ACTIVE);
        assertThat(instance.getCurrentStepOrder()).isEqualTo(1);
        assertThat(instance.getTotalSteps()).isEqualTo(3);
        assertThat(instance.getAssignedTo()).isEqualTo("user-1");
        assertThat(instance.getStartedAt()).isEqualTo(NOW);
    }

    @Test
    void newInstance_ExplicitAssignee() {
        SequenceInstance instance = taskFactory.newInstance(org, template, restaurant, "user-2", NOW);

        assertThat(instance.getAssignedTo()).isEqualTo("user-2");
        assertThat(instance.getCreatedBy()).isEqualTo("user-1");
    }

    @Test
    void buildTasks_FirstActiveRestPendingWithoutDueDate() {
        // Given
        SequenceInstance instance = taskFactory.newInstance(org, template, restaurant, null, NOW);
        instance.setId(100L);

        // When
        List<Task> tasks = taskFactory.buildTasks(template, instance, restaurant, Collections.emptyMap(), NOW);

        // Then
        assertThat(tasks).hasSize(3);
        assertThat(tasks).extracting(Task::getStatus)
                .containsExactly(TaskStatus.ACTIVE, TaskStatus.PENDING, TaskStatus.PENDING);
        assertThat(tasks.get(0).getDueDate()).isEqualTo(NOW);
        assertThat(tasks.get(1).getDueDate()).isNull();
        assertThat(tasks.get(2).getDueDate()).isNull();
        assertThat(tasks).allMatch(t -> t.getSequenceInstanceId().equals(100L));
        assertThat(tasks).extracting(Task::getSequenceStepOrder).containsExactly(1, 2, 3);
        assertThat(tasks.get(1).getPriority()).isEqualTo(TaskPriority.HIGH);
    }

    @Test
    void buildTasks_RendersMessagesAndEmailSubjects() {
        SequenceInstance instance = taskFactory.newInstance(org, template, restaurant, null, NOW);

        List<Task> tasks = taskFactory.buildTasks(template, instance, restaurant, Collections.emptyMap(), NOW);

        Task email = tasks.get(0);
        assertThat(email.getMessage()).isEqualTo("Hi {first_name}, thanks for your time");
        assertThat(email.getMessageRendered()).isEqualTo("Hi Maria, thanks for your time");
        assertThat(email.getSubjectLineRendered()).isEqualTo("Your Pizza Palace demo");

        Task call = tasks.get(1);
        assertThat(call.getMessageRendered()).isEqualTo("Call Maria Rossi");
        assertThat(call.getSubjectLine()).isNull();
        assertThat(call.getSubjectLineRendered()).isNull();
    }

    @Test
    void buildTasks_MessageTemplateWinsOverStepText() {
        // Given
        MessageTemplate mt = MessageTemplate.builder()
                .id(7L)
                .type(TaskType.EMAIL)
                .messageContent("Last chance, {first_name}")
                .subjectLine("Still keen in {city}?")
                .build();
        SequenceInstance instance = taskFactory.newInstance(org, template, restaurant, null, NOW);

        // When
        Task last = taskFactory.buildTasks(template, instance, restaurant, Map.of(7L, mt), NOW).get(2);

        // Then
        assertThat(last.getMessageTemplateId()).isEqualTo(7L);
        assertThat(last.getMessageRendered()).isEqualTo("Last chance, Maria");
        assertThat(last.getSubjectLineRendered()).isEqualTo("Still keen in Wellington?");
    }

    @Test
    void buildTasks_MissingMessageTemplate_FallsBackToStepText() {
        SequenceInstance instance = taskFactory.newInstance(org, template, restaurant, null, NOW);

        Task last = taskFactory.buildTasks(template, instance, restaurant, Collections.emptyMap(), NOW).get(2);

        assertThat(last.getMessageTemplateId()).isNull();
        assertThat(last.getMessageRendered()).isEqualTo("Fallback for Pizza Palace");
        assertThat(last.getSubjectLineRendered()).isEqualTo("Step subject");
    }
}
