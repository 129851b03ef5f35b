package com.pumpd.backend.services.sequence;

import com.pumpd.backend.dto.sequence.response.SequenceProgressDto;
import com.pumpd.backend.enums.InstanceStatus;
import com.pumpd.backend.enums.TaskStatus;
import com.pumpd.backend.enums.TaskType;
import com.pumpd.backend.exceptions.ResourceNotFoundException;
import com.pumpd.backend.exceptions.SequencePersistenceException;
import com.pumpd.backend.exceptions.SequenceValidationException;
import com.pumpd.backend.models.Restaurant;
import com.pumpd.backend.models.sequence.*;
import com.pumpd.backend.repositories.RestaurantRepository;
import com.pumpd.backend.repositories.sequence.SequenceInstanceRepository;
import com.pumpd.backend.repositories.sequence.TaskRepository;
import com.pumpd.backend.security.OrgContext;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SequenceInstanceServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-16T00:00:00Z");

    @Mock
    private SequenceTemplateService templateService;

    @Mock
    private SequenceTaskFactory taskFactory;

    @Mock
    private SequenceInstanceWriter instanceWriter;

    @Mock
    private SequenceInstanceRepository instanceRepository;

    @Mock
    private TaskRepository taskRepository;

    @Mock
    private RestaurantRepository restaurantRepository;

    private MeterRegistry meterRegistry = new SimpleMeterRegistry();

    private SequenceInstanceService instanceService;

    private OrgContext org;
    private SequenceTemplate template;
    private Restaurant restaurant;

    @BeforeEach
    void setUp() {
        instanceService = new SequenceInstanceService(
                templateService,
                taskFactory,
                instanceWriter,
                instanceRepository,
                taskRepository,
                restaurantRepository,
                meterRegistry,
                Clock.fixed(NOW, ZoneOffset.UTC)
        );

        org = new OrgContext(1L, "user-1");

        template = SequenceTemplate.builder()
                .id(10L)
                .organisationId(1L)
                .name("Demo Follow-up")
                .build();
        template.addStep(SequenceStep.builder().stepOrder(1).name("Email").type(TaskType.EMAIL).customMessage("Hi").build());

        restaurant = Restaurant.builder()
                .id(5L)
                .organisationId(1L)
                .name("Pizza Palace")
                .build();
    }

    @Test
    void start_WritesInstanceAndRecordsUsage() {
        // Given
        when(templateService.loadForStart(org, 10L)).thenReturn(template);
        when(restaurantRepository.findByIdAndOrganisationId(5L, 1L)).thenReturn(Optional.of(restaurant));
        when(taskFactory.loadMessageTemplates(org, template)).thenReturn(Collections.emptyMap());
        InstanceWithTasks written = started(100L);
        when(instanceWriter.write(eq(org), eq(template), eq(restaurant), anyMap(), eq("user-2"), any(OffsetDateTime.class)))
                .thenReturn(written);

        // When
        InstanceWithTasks result = instanceService.start(org, 10L, 5L, "user-2");

        // Then
        assertThat(result).isSameAs(written);
        verify(templateService).recordUsage(10L, 1);
        assertThat(meterRegistry.get("sequences.started").tag("mode", "single").counter().count()).isEqualTo(1.0);
    }

    @Test
    void start_SameTemplateTwice_CreatesTwoInstances() {
        // Given
        when(templateService.loadForStart(org, 10L)).thenReturn(template);
        when(restaurantRepository.findByIdAndOrganisationId(5L, 1L)).thenReturn(Optional.of(restaurant));
        when(taskFactory.loadMessageTemplates(org, template)).thenReturn(Collections.emptyMap());
        when(instanceWriter.write(any(), any(), any(), anyMap(), any(), any()))
                .thenReturn(started(100L), started(101L));

        // When
        InstanceWithTasks first = instanceService.start(org, 10L, 5L, null);
        InstanceWithTasks second = instanceService.start(org, 10L, 5L, null);

        // Then
        assertThat(first.instance().getId()).isNotEqualTo(second.instance().getId());
        verify(templateService, times(2)).recordUsage(10L, 1);
    }

    @Test
    void start_RestaurantNotFound_NothingWritten() {
        when(templateService.loadForStart(org, 10L)).thenReturn(template);
        when(restaurantRepository.findByIdAndOrganisationId(5L, 1L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> instanceService.start(org, 10L, 5L, null))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("Restaurant");
        verifyNoInteractions(instanceWriter);
        verify(templateService, never()).recordUsage(anyLong(), anyInt());
    }

    @Test
    void start_TemplateRejected_RestaurantNeverLoaded() {
        when(templateService.loadForStart(org, 10L)).thenThrow(new SequenceValidationException("not active"));

        assertThatThrownBy(() -> instanceService.start(org, 10L, 5L, null))
                .isInstanceOf(SequenceValidationException.class);
        verifyNoInteractions(restaurantRepository, instanceWriter);
    }

    @Test
    void start_WriteFails_PersistenceErrorAndNoUsage() {
        // Given
        when(templateService.loadForStart(org, 10L)).thenReturn(template);
        when(restaurantRepository.findByIdAndOrganisationId(5L, 1L)).thenReturn(Optional.of(restaurant));
        when(taskFactory.loadMessageTemplates(org, template)).thenReturn(Collections.emptyMap());
        when(instanceWriter.write(any(), any(), any(), anyMap(), any(), any()))
                .thenThrow(new DataIntegrityViolationException("tasks_name_not_null"));

        // When / Then
        assertThatThrownBy(() -> instanceService.start(org, 10L, 5L, null))
                .isInstanceOf(SequencePersistenceException.class)
                .hasCauseInstanceOf(DataIntegrityViolationException.class);
        verify(templateService, never()).recordUsage(anyLong(), anyInt());
    }

    @Test
    void listInstances_AppliesFiltersAndGroupsTasks() {
        // Given
        SequenceInstance active = instance(100L, 5L, InstanceStatus.ACTIVE, "Demo Follow-up - Pizza Palace - 2025-01-16");
        SequenceInstance paused = instance(101L, 6L, InstanceStatus.PAUSED, "Demo Follow-up - Sushi Bar - 2025-01-16");
        SequenceInstance done = instance(102L, 5L, InstanceStatus.COMPLETED, "Cold outreach - Pizza Palace - 2025-01-10");
        when(instanceRepository.findByOrganisationIdOrderByCreatedAtDesc(1L)).thenReturn(List.of(active, paused, done));
        when(taskRepository.findBySequenceInstanceIdInOrderBySequenceStepOrderAsc(List.of(100L, 101L)))
                .thenReturn(List.of(task(100L, 1, TaskStatus.ACTIVE), task(101L, 1, TaskStatus.COMPLETED)));

        // When
        List<InstanceWithTasks> result = instanceService.listInstances(
                org, List.of(InstanceStatus.ACTIVE, InstanceStatus.PAUSED), null, null, "demo");

        // Then
        assertThat(result).extracting(i -> i.instance().getId()).containsExactly(100L, 101L);
        assertThat(result.get(0).tasks()).hasSize(1);
        assertThat(result.get(1).completedCount()).isEqualTo(1);
    }

    @Test
    void listInstances_RestaurantFilter_QueriesOnlyThoseRestaurants() {
        // Given
        SequenceInstance pizza = instance(100L, 5L, InstanceStatus.ACTIVE, "Demo Follow-up - Pizza Palace - 2025-01-16");
        when(instanceRepository.findByOrganisationIdAndRestaurantIdInOrderByCreatedAtDesc(1L, List.of(5L)))
                .thenReturn(List.of(pizza));
        when(taskRepository.findBySequenceInstanceIdInOrderBySequenceStepOrderAsc(List.of(100L)))
                .thenReturn(List.of(task(100L, 1, TaskStatus.ACTIVE)));

        // When
        List<InstanceWithTasks> result = instanceService.listInstances(org, null, List.of(5L), null, null);

        // Then
        assertThat(result).extracting(i -> i.instance().getId()).containsExactly(100L);
        verify(instanceRepository, never()).findByOrganisationIdOrderByCreatedAtDesc(anyLong());
    }

    @Test
    void listInstances_NoMatches_SkipsTaskQuery() {
        when(instanceRepository.findByOrganisationIdAndRestaurantIdInOrderByCreatedAtDesc(1L, List.of(5L)))
                .thenReturn(Collections.emptyList());

        assertThat(instanceService.listInstances(org, null, List.of(5L), "user-1", null)).isEmpty();
        verifyNoInteractions(taskRepository);
    }

    @Test
    void getProgress_CountsCompletedSteps() {
        // Given
        SequenceInstance instance = instance(100L, 5L, InstanceStatus.ACTIVE, "Demo");
        instance.setTotalSteps(3);
        instance.setCurrentStepOrder(2);
        when(instanceRepository.findByIdAndOrganisationId(100L, 1L)).thenReturn(Optional.of(instance));
        when(taskRepository.findBySequenceInstanceIdOrderBySequenceStepOrderAsc(100L)).thenReturn(List.of(
                task(100L, 1, TaskStatus.COMPLETED),
                task(100L, 2, TaskStatus.ACTIVE),
                task(100L, 3, TaskStatus.PENDING)));

        // When
        SequenceProgressDto progress = instanceService.getProgress(org, 100L);

        // Then
        assertThat(progress.getCurrentStep()).isEqualTo(2);
        assertThat(progress.getProgress().getCompleted()).isEqualTo(1);
        assertThat(progress.getProgress().getTotal()).isEqualTo(3);
        assertThat(progress.getProgress().getPercentage()).isEqualTo(33);
        assertThat(progress.getTimeline()).hasSize(3);
    }

    @Test
    void getInstance_OtherOrganisation_NotFound() {
        when(instanceRepository.findByIdAndOrganisationId(100L, 1L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> instanceService.getInstance(org, 100L))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    private InstanceWithTasks started(Long instanceId) {
        SequenceInstance instance = instance(instanceId, 5L, InstanceStatus.ACTIVE, "Demo");
        return new InstanceWithTasks(instance, List.of(task(instanceId, 1, TaskStatus.ACTIVE)));
    }

    private static SequenceInstance instance(Long id, Long restaurantId, InstanceStatus status, String name) {
        return SequenceInstance.builder()
                .id(id)
                .organisationId(1L)
                .sequenceTemplateId(10L)
                .restaurantId(restaurantId)
                .name(name)
                .status(status)
                .totalSteps(1)
                .assignedTo("user-1")
                .build();
    }

    private static Task task(Long instanceId, int stepOrder, TaskStatus status) {
        return Task.builder()
                .id(instanceId * 10 + stepOrder)
                .organisationId(1L)
                .restaurantId(5L)
                .sequenceInstanceId(instanceId)
                .sequenceStepOrder(stepOrder)
                .name("Step " + stepOrder)
                .type(TaskType.EMAIL)
                .status(status)
                .build();
    }
}
