package com.missionmind;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;

import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class MissionMindApplicationTest extends BaseIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    private void postJson(String path, String body) throws Exception {
        mockMvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated());
    }

    @Test
    void testTaskFlowAgainstPostgres() throws Exception {
        postJson("/api/orgunits", "{\"id\": \"HQ\", \"name\": \"Headquarters\", \"echelon\": \"corps\"}");
        postJson("/api/orgunits", "{\"id\": \"OPS_G3\", \"name\": \"Operations G3\", \"echelon\": \"staff\", \"parentId\": \"HQ\"}");
        postJson("/api/orgunits", "{\"id\": \"BDE\", \"name\": \"1st Brigade\", \"echelon\": \"brigade\", \"parentId\": \"HQ\"}");
        postJson("/api/authorities", "{\"id\": \"A1\", \"title\": \"Brigade Commander\", \"orgUnitId\": \"BDE\", \"grade\": \"O-6\"}");
        postJson("/api/authorities", "{\"id\": \"A2\", \"title\": \"Commanding General\", \"orgUnitId\": \"HQ\", \"grade\": \"O-8\"}");

        String suspense = LocalDate.now().plusDays(5).toString();
        mockMvc.perform(post("/api/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title": "Quarterly readiness review",
                                 "description": "Compile readiness slides and training status for the brigade commander.",
                                 "suspenseDate": "%s",
                                 "originator": "HQDA G-3",
                                 "orgUnitId": "BDE",
                                 "tags": ["training"]}
                                """.formatted(suspense)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id", startsWith("T-")))
                .andExpect(jsonPath("$.status").value("open"))
                .andExpect(jsonPath("$.priorityScore", greaterThan(0.0)))
                .andExpect(jsonPath("$.assignments", hasSize(1)))
                .andExpect(jsonPath("$.assignments[0].assigneeId").value("OPS_G3"))
                .andExpect(jsonPath("$.assignments[0].role").value("owner"));

        mockMvc.perform(get("/api/tasks").param("org", "BDE"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)));

        String taskId = "T-%02d-000001".formatted(LocalDate.now().getYear() % 100);
        mockMvc.perform(get("/api/tasks/{id}/authority-suggestions", taskId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].authorityId").value("A1"))
                .andExpect(jsonPath("$[0].confidence").value(0.9))
                .andExpect(jsonPath("$[1].authorityId").value("A2"))
                .andExpect(jsonPath("$[1].confidence").value(0.8));

        mockMvc.perform(get("/api/tasks/{id}/quality-check", taskId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.passed").value(true))
                .andExpect(jsonPath("$.issues[0].code").value("ARIMS_TAG"));

        mockMvc.perform(get("/api/orgunits/BDE/ancestors"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[1].id").value("HQ"));
    }
}
