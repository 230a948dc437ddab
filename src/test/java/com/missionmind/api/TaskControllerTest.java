package com.missionmind.api;

import com.missionmind.engine.model.AuthoritySuggestion;
import com.missionmind.engine.model.RiskInsight;
import com.missionmind.engine.model.RiskTier;
import com.missionmind.entity.Assignment;
import com.missionmind.entity.Task;
import com.missionmind.service.TaskService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TaskController.class)
class TaskControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private TaskService taskService;

    private Task sampleTask() {
        Task task = Task.builder()
                .id("T-25-000001")
                .title("Prepare readiness review")
                .description("Compile the quarterly readiness slides for the commander.")
                .suspenseDate(LocalDate.of(2025, 3, 15))
                .originator("HQDA G-3")
                .orgUnitId("BDE")
                .status("open")
                .priorityScore(0.79)
                .tags(new ArrayList<>(List.of("training")))
                .build();
        task.addAssignment(Assignment.builder()
                .id(1L)
                .assigneeId("OPS_G3")
                .role("owner")
                .rationale("Matched keyword 'training' with org OPS_G3")
                .build());
        return task;
    }

    @Test
    void testCreateTask() throws Exception {
        when(taskService.create(any())).thenReturn(sampleTask());
        String body = """
                {"title": "Prepare readiness review",
                 "description": "Compile the quarterly readiness slides for the commander.",
                 "suspenseDate": "2025-03-15",
                 "originator": "HQDA G-3",
                 "orgUnitId": "BDE",
                 "tags": ["training"]}
                """;

        mockMvc.perform(post("/api/tasks").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("T-25-000001"))
                .andExpect(jsonPath("$.priorityScore").value(0.79))
                .andExpect(jsonPath("$.classification").value("unclassified"))
                .andExpect(jsonPath("$.assignments[0].assigneeId").value("OPS_G3"))
                .andExpect(jsonPath("$.assignments[0].assigneeType").value("org"))
                .andExpect(jsonPath("$.assignments[0].state").value("pending"));
    }

    @Test
    void testCreateTaskRejectsMissingFields() throws Exception {
        mockMvc.perform(post("/api/tasks").contentType(MediaType.APPLICATION_JSON).content("{\"title\": \"x\"}"))
                .andExpect(status().isBadRequest());

        verify(taskService, never()).create(any());
    }

    @Test
    void testListPassesFilters() throws Exception {
        when(taskService.list(eq("open"), eq(LocalDate.of(2025, 4, 1)), eq("BDE"))).thenReturn(List.of(sampleTask()));

        mockMvc.perform(get("/api/tasks")
                        .param("status", "open")
                        .param("dueBefore", "2025-04-01")
                        .param("org", "BDE"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("T-25-000001"));
    }

    @Test
    void testMissingTaskIsNotFound() throws Exception {
        when(taskService.get(anyString())).thenThrow(new ResponseStatusException(HttpStatus.NOT_FOUND, "Task not found."));

        mockMvc.perform(get("/api/tasks/T-99-000001"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testAuthoritySuggestions() throws Exception {
        when(taskService.authoritySuggestions(eq("T-25-000001"), eq(2))).thenReturn(List.of(
                new AuthoritySuggestion("A1", "Brigade Commander", "BDE", "O-6", 0.9,
                        "Authority aligned with org BDE (tier 1)")));

        mockMvc.perform(get("/api/tasks/T-25-000001/authority-suggestions").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].authorityId").value("A1"))
                .andExpect(jsonPath("$[0].confidence").value(0.9));
    }

    @Test
    void testAuthoritySuggestionsWithoutLimit() throws Exception {
        when(taskService.authoritySuggestions(eq("T-25-000001"), isNull())).thenReturn(List.of());

        mockMvc.perform(get("/api/tasks/T-25-000001/authority-suggestions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }

    @Test
    void testRisk() throws Exception {
        when(taskService.risk("T-25-000001")).thenReturn(new RiskInsight("T-25-000001", RiskTier.RED, 0.9,
                List.of("Task already overdue"), List.of("Confirm staffing plan")));

        mockMvc.perform(get("/api/tasks/T-25-000001/risk"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.riskLevel").value("red"))
                .andExpect(jsonPath("$.lateProbability").value(0.9))
                .andExpect(jsonPath("$.drivers[0]").value("Task already overdue"));
    }
}
