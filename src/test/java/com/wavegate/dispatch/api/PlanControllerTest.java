package com.wavegate.dispatch.api;

import com.wavegate.core.plan.CharacterDevelopmentPlan;
import com.wavegate.core.plan.WavePlan;
import com.wavegate.core.plan.WavePlanRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PlanController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class PlanControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WavePlanRegistry registry;

    @Test
    @DisplayName("GET /plans describes waves, tasks and checkpoint count")
    void listPlans() throws Exception {
        when(registry.all()).thenReturn(List.of(CharacterDevelopmentPlan.plan()));

        mockMvc.perform(get("/api/v1/plans"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].name").value(CharacterDevelopmentPlan.NAME))
                .andExpect(jsonPath("$[0].waves", hasSize(3)))
                .andExpect(jsonPath("$[0].waves[0].tasks", contains("personality", "backstory_motivation")))
                .andExpect(jsonPath("$[0].waves[2].wave").value(3))
                .andExpect(jsonPath("$[0].final_task").value(WavePlan.FINAL_TASK))
                .andExpect(jsonPath("$[0].total_checkpoints").value(7));
    }

    @Test
    @DisplayName("GET /plans with no registered plans returns an empty list")
    void noPlans() throws Exception {
        when(registry.all()).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/plans"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }
}
