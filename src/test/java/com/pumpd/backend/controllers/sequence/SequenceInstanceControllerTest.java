package com.pumpd.backend.controllers.sequence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pumpd.backend.enums.DelayUnit;
import com.pumpd.backend.enums.TaskType;
import com.pumpd.backend.models.Restaurant;
import com.pumpd.backend.models.sequence.SequenceStep;
import com.pumpd.backend.models.sequence.SequenceTemplate;
import com.pumpd.backend.repositories.RestaurantRepository;
import com.pumpd.backend.repositories.sequence.SequenceInstanceRepository;
import com.pumpd.backend.repositories.sequence.SequenceTemplateRepository;
import com.pumpd.backend.repositories.sequence.TaskRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class SequenceInstanceControllerTest {

    private static final String ORG = "X-Organisation-Id";
    private static final String USER = "X-User-Id";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private RestaurantRepository restaurantRepository;

    @Autowired
    private SequenceTemplateRepository templateRepository;

    @Autowired
    private SequenceInstanceRepository instanceRepository;

    @Autowired
    private TaskRepository taskRepository;

    private Long templateId;
    private Long restaurantId;

    @BeforeEach
    void setUp() {
        SequenceTemplate template = SequenceTemplate.builder()
                .organisationId(1L)
                .name("Demo Follow-up")
                .build();
        template.addStep(SequenceStep.builder()
                .stepOrder(1).name("Send demo recap").type(TaskType.EMAIL)
                .delayValue(0).delayUnit(DelayUnit.DAYS).customMessage("Hi {first_name}").build());
        template.addStep(SequenceStep.builder()
                .stepOrder(2).name("Follow-up call").type(TaskType.CALL)
                .delayValue(2).delayUnit(DelayUnit.DAYS).customMessage("Call {contact_name}").build());
        templateId = templateRepository.save(template).getId();

        restaurantId = restaurantRepository.save(Restaurant.builder()
                .organisationId(1L)
                .name("Pizza Palace")
                .contactName("Maria Rossi")
                .build()).getId();
    }

    @AfterEach
    void tearDown() {
        taskRepository.deleteAll();
        instanceRepository.deleteAll();
        templateRepository.deleteAll();
        restaurantRepository.deleteAll();
    }

    @Test
    void start_ReturnsCreatedInstanceWithTasks() throws Exception {
        mockMvc.perform(post("/api/sequence-instances")
                        .header(ORG, "1").header(USER, "user-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sequenceTemplateId\":" + templateId + ",\"restaurantId\":" + restaurantId + "}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.tasks.length()").value(2))
                .andExpect(jsonPath("$.tasks[0].status").value("ACTIVE"))
                .andExpect(jsonPath("$.tasks[0].messageRendered").value("Hi Maria"))
                .andExpect(jsonPath("$.progress.total").value(2));
    }

    @Test
    void start_MissingOrganisationHeader_BadRequest() throws Exception {
        mockMvc.perform(post("/api/sequence-instances")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sequenceTemplateId\":" + templateId + ",\"restaurantId\":" + restaurantId + "}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void start_TemplateOfAnotherOrganisation_NotFound() throws Exception {
        mockMvc.perform(post("/api/sequence-instances")
                        .header(ORG, "2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sequenceTemplateId\":" + templateId + ",\"restaurantId\":" + restaurantId + "}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void bulk_NoRestaurants_BadRequest() throws Exception {
        mockMvc.perform(post("/api/sequence-instances/bulk")
                        .header(ORG, "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sequenceTemplateId\":" + templateId + ",\"restaurantIds\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    void bulk_PartialFailure_MultiStatus() throws Exception {
        mockMvc.perform(post("/api/sequence-instances/bulk")
                        .header(ORG, "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sequenceTemplateId\":" + templateId
                                + ",\"restaurantIds\":[" + restaurantId + ",999999]}"))
                .andExpect(status().isMultiStatus())
                .andExpect(jsonPath("$.summary.total").value(2))
                .andExpect(jsonPath("$.summary.success").value(1))
                .andExpect(jsonPath("$.failed[0].restaurantId").value(999999))
                .andExpect(jsonPath("$.failed[0].reason").value("not_found"));
    }

    @Test
    void finish_Twice_SecondIsConflict() throws Exception {
        // Given
        Long instanceId = startInstance();
        String body = "{\"mode\":\"finish-only\"}";

        // When / Then
        mockMvc.perform(post("/api/sequence-instances/{id}/finish", instanceId)
                        .header(ORG, "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("finish-only"))
                .andExpect(jsonPath("$.instance.status").value("COMPLETED"))
                .andExpect(jsonPath("$.completedTasks.length()").value(1))
                .andExpect(jsonPath("$.cancelledTasks.length()").value(1));

        mockMvc.perform(post("/api/sequence-instances/{id}/finish", instanceId)
                        .header(ORG, "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INVALID_STATE"))
                .andExpect(jsonPath("$.currentState").value("COMPLETED"));
    }

    @Test
    void finish_UnknownMode_BadRequest() throws Exception {
        Long instanceId = startInstance();

        mockMvc.perform(post("/api/sequence-instances/{id}/finish", instanceId)
                        .header(ORG, "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"mode\":\"finish-later\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void pauseThenResume() throws Exception {
        Long instanceId = startInstance();

        mockMvc.perform(post("/api/sequence-instances/{id}/pause", instanceId).header(ORG, "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PAUSED"));
        mockMvc.perform(post("/api/sequence-instances/{id}/pause", instanceId).header(ORG, "1"))
                .andExpect(status().isConflict());
        mockMvc.perform(post("/api/sequence-instances/{id}/resume", instanceId).header(ORG, "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACTIVE"));
    }

    @Test
    void getProgress_UnknownInstance_NotFound() throws Exception {
        mockMvc.perform(get("/api/sequence-instances/{id}/progress", 123456).header(ORG, "1"))
                .andExpect(status().isNotFound());
    }

    @Test
    void validateVariables() throws Exception {
        mockMvc.perform(post("/api/variables/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Hi {first_name}, {nope}\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.unknownVariables[0]").value("nope"));
    }

    private Long startInstance() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/sequence-instances")
                        .header(ORG, "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sequenceTemplateId\":" + templateId + ",\"restaurantId\":" + restaurantId + "}"))
                .andExpect(status().isCreated())
                .andReturn();
        JsonNode json = objectMapper.readTree(result.getResponse().getContentAsString());
        assertThat(json.get("id").isNumber()).isTrue();
        return json.get("id").asLong();
    }
}
