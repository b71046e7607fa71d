package com.delta.lottracker.discovery.model;

public record DiscoveryRunStartResponse(
    long runId,
    String status,
    String statusUrl
) {
}
