package com.catalog.harvester.controller;

import com.catalog.harvester.exception.ConfigurationException;
import com.catalog.harvester.model.ScrapeJob;
import com.catalog.harvester.service.HarvestOrchestrator;
import com.catalog.harvester.service.JobRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class HarvestControllerTest {

    @Mock
    private HarvestOrchestrator orchestrator;

    private final JobRegistry jobs = new JobRegistry();

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new HarvestController(orchestrator, jobs)).build();
    }

    @Test
    void startAnswersAcceptedWithTheJob() throws Exception {
        when(orchestrator.submit("lululemon", 50, true)).thenAnswer(inv -> jobs.create("lululemon"));

        mvc.perform(post("/api/harvest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"site\":\"lululemon\",\"maxItems\":50,\"sync\":true}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.siteId").value("lululemon"))
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    void optionalFieldsDefault() throws Exception {
        when(orchestrator.submit("nike", 0, false)).thenAnswer(inv -> jobs.create("nike"));

        mvc.perform(post("/api/harvest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"site\":\"nike\"}"))
                .andExpect(status().isAccepted());
    }

    @Test
    void blankSiteIsRejected() throws Exception {
        mvc.perform(post("/api/harvest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"site\":\" \"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(orchestrator);
    }

    @Test
    void unknownSiteIsABadRequest() throws Exception {
        when(orchestrator.submit(anyString(), anyInt(), anyBoolean()))
                .thenThrow(new ConfigurationException("No <sites.configs.acme> section found in application.yml"));

        mvc.perform(post("/api/harvest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"site\":\"acme\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No <sites.configs.acme> section found in application.yml"));
    }

    @Test
    void jobsAreListedNewestFirstAndLookedUpById() throws Exception {
        ScrapeJob first = jobs.create("nike");
        first.markFailed("listing endpoint moved", 100);
        jobs.create("lululemon");

        mvc.perform(get("/api/harvest/jobs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].siteId").value("lululemon"))
                .andExpect(jsonPath("$[1].status").value("FAILED"));
        mvc.perform(get("/api/harvest/jobs/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.errorMessage").value("listing endpoint moved"));
        mvc.perform(get("/api/harvest/jobs/99"))
                .andExpect(status().isNotFound());
    }
}
