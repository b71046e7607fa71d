package com.delta.lottracker.discovery.api;

import com.delta.lottracker.discovery.model.DiscoveryRunStatus;
import com.delta.lottracker.discovery.persistence.DiscoveryRunRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.WebApplicationContext;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class DiscoveryControllerTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private DiscoveryRunRepository runRepository;

    @Autowired
    private ObjectMapper objectMapper;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void startedRunIsTrackedUntilItFinishes() throws Exception {
        MvcResult started = mockMvc.perform(post("/api/discovery/run"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.status").value("RUNNING"))
            .andReturn();
        JsonNode body = objectMapper.readTree(started.getResponse().getContentAsString());
        long runId = body.path("runId").asLong();
        assertThat(body.path("statusUrl").asText()).isEqualTo("/api/discovery/runs/" + runId);

        // no channel is configured in the test profile, so the run ends quickly
        DiscoveryRunStatus finished = awaitTerminal(runId);
        assertThat(finished).isNotNull();

        mockMvc.perform(get("/api/discovery/runs/{runId}", runId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.runId").value(runId))
            .andExpect(jsonPath("$.phase").value("FAILED"))
            .andExpect(jsonPath("$.notes").value("no_sources_configured"));
    }

    @Test
    @Transactional
    void secondRunIsRejectedWhileOneIsRunning() throws Exception {
        runRepository.insertRun(Instant.now());

        mockMvc.perform(post("/api/discovery/run"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("active_discovery_run"));
    }

    @Test
    void unknownRunIsNotFound() throws Exception {
        mockMvc.perform(get("/api/discovery/runs/{runId}", -1))
            .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/discovery/runs/{runId}/cancel", -1))
            .andExpect(status().isNotFound());
    }

    private DiscoveryRunStatus awaitTerminal(long runId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            Optional<DiscoveryRunStatus> run = runRepository.findRun(runId);
            if (run.isPresent() && run.get().phase().isTerminal()) {
                return run.get();
            }
            Thread.sleep(50);
        }
        return null;
    }
}
