package com.hindsight.setforget.controller;

import com.hindsight.setforget.SquadFixtures;
import com.hindsight.setforget.service.OptimalSquadService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = OptimalSquadController.class)
@ActiveProfiles("test")
class OptimalSquadControllerTest {

    @Autowired private MockMvc mockMvc;
    @MockBean private OptimalSquadService optimalSquadService;

    @Test
    void latestSquadForSeason() throws Exception {
        when(optimalSquadService.latestForSeason("2023-2024"))
                .thenReturn(OptimalSquadService.toRows("job-1", "2023-2024", SquadFixtures.sampleSquad()));

        mockMvc.perform(get("/api/squads/2023-2024"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(15))
                .andExpect(jsonPath("$[0].position").value("GK"))
                .andExpect(jsonPath("$[0].captain").value(true));
    }

    @Test
    void seasonWithoutStoredSquadIsNotFound() throws Exception {
        when(optimalSquadService.latestForSeason("1999-2000")).thenReturn(List.of());

        mockMvc.perform(get("/api/squads/1999-2000"))
                .andExpect(status().isNotFound());
    }

    @Test
    void squadByJob() throws Exception {
        when(optimalSquadService.forJob("job-1"))
                .thenReturn(OptimalSquadService.toRows("job-1", "2023-2024", SquadFixtures.sampleSquad()));

        mockMvc.perform(get("/api/squads/jobs/job-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[14].slot").value(3));
    }
}
