package io.github.riemr.autoschedule.presentation.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.riemr.autoschedule.application.dto.AutoScheduleCommand;
import io.github.riemr.autoschedule.application.dto.AutoScheduleResult;
import io.github.riemr.autoschedule.application.service.AutoScheduleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = AutoScheduleController.class)
@AutoConfigureMockMvc(addFilters = false)
class AutoScheduleControllerTest {

    @SpringBootConfiguration
    @Import({AutoScheduleController.class, GlobalExceptionHandler.class})
    static class TestApplication {}

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @MockBean
    AutoScheduleService autoScheduleService;

    private final UUID groupType = UUID.fromString("0e6a1c52-8a1f-4f3b-9d7e-3c1e2b4a5f60");
    private final UUID scheduler = UUID.fromString("5b7d9f11-2c3e-4a5b-8c9d-0e1f2a3b4c5d");

    @BeforeEach
    void setup() {
        Mockito.reset(autoScheduleService);
    }

    @Test
    void run_usesDefaultWeeks_andReturnsSummary() throws Exception {
        when(autoScheduleService.run(any())).thenReturn(
                new AutoScheduleResult(false, 14, 14, 1, 20, 3, List.of()));

        var req = new LinkedHashMap<String, Object>();
        req.put("groupTypeGuid", groupType);
        req.put("schedulerAliasGuid", scheduler);

        mockMvc.perform(post("/api/auto-schedule/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.aborted").value(false))
                .andExpect(jsonPath("$.occurrenceCount").value(14))
                .andExpect(jsonPath("$.confirmedCount").value(3))
                .andExpect(jsonPath("$.errorMessages").isEmpty());

        ArgumentCaptor<AutoScheduleCommand> captor = ArgumentCaptor.forClass(AutoScheduleCommand.class);
        verify(autoScheduleService).run(captor.capture());
        AutoScheduleCommand command = captor.getValue();
        assertThat(command.groupTypeGuid()).isEqualTo(groupType);
        assertThat(command.schedulerAliasGuid()).isEqualTo(scheduler);
        assertThat(command.weeksOut()).isEqualTo(7);
        assertThat(command.autoScheduleAttributeKey()).isNull();
    }

    @Test
    void run_passesExplicitWeeksAndAttribute() throws Exception {
        when(autoScheduleService.run(any())).thenReturn(
                AutoScheduleResult.abortedWith(List.of("No group type was provided")));

        var req = new LinkedHashMap<String, Object>();
        req.put("groupTypeGuid", groupType);
        req.put("schedulerAliasGuid", scheduler);
        req.put("weeksOut", 2);
        req.put("autoScheduleAttributeKey", "AutoSchedule");

        mockMvc.perform(post("/api/auto-schedule/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.aborted").value(true))
                .andExpect(jsonPath("$.errorMessages[0]").value("No group type was provided"));

        ArgumentCaptor<AutoScheduleCommand> captor = ArgumentCaptor.forClass(AutoScheduleCommand.class);
        verify(autoScheduleService).run(captor.capture());
        assertThat(captor.getValue().weeksOut()).isEqualTo(2);
        assertThat(captor.getValue().autoScheduleAttributeKey()).isEqualTo("AutoSchedule");
    }

    @Test
    void run_returns400_whenSchedulerMissing() throws Exception {
        var req = new LinkedHashMap<String, Object>();
        req.put("groupTypeGuid", groupType);

        mockMvc.perform(post("/api/auto-schedule/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation failed"));

        verifyNoInteractions(autoScheduleService);
    }

    @Test
    void run_returns400_whenWeeksNegative() throws Exception {
        var req = new LinkedHashMap<String, Object>();
        req.put("groupTypeGuid", groupType);
        req.put("schedulerAliasGuid", scheduler);
        req.put("weeksOut", -1);

        mockMvc.perform(post("/api/auto-schedule/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(req)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation failed"));

        verifyNoInteractions(autoScheduleService);
    }

    @Test
    void run_returns400_onMalformedBody() throws Exception {
        mockMvc.perform(post("/api/auto-schedule/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"groupTypeGuid\": \"not-a-uuid\""))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));
    }
}
