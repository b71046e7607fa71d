package com.delta.lottracker.discovery.api;

import com.delta.lottracker.discovery.model.DiscoveryRunStartResponse;
import com.delta.lottracker.discovery.model.DiscoveryRunStatus;
import com.delta.lottracker.discovery.service.DiscoveryOrchestratorService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/discovery")
public class DiscoveryController {
    private final DiscoveryOrchestratorService orchestratorService;

    public DiscoveryController(DiscoveryOrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @PostMapping("/run")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public DiscoveryRunStartResponse startRun() {
        long runId = orchestratorService.startAsync();
        return new DiscoveryRunStartResponse(runId, "RUNNING", "/api/discovery/runs/" + runId);
    }

    @GetMapping("/runs/{runId}")
    public DiscoveryRunStatus getRun(@PathVariable("runId") long runId) {
        return orchestratorService.getRunStatus(runId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "discovery run not found: " + runId));
    }

    @PostMapping("/runs/{runId}/cancel")
    public Map<String, Object> cancelRun(@PathVariable("runId") long runId) {
        if (!orchestratorService.cancel(runId)) {
            throw new ResponseStatusException(NOT_FOUND, "no active discovery run with id " + runId);
        }
        return Map.of("runId", runId, "status", "CANCELLING");
    }
}
