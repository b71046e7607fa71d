package com.delta.lottracker.discovery.model;

import java.time.Instant;
import java.util.List;

public record DiscoveryRunStatus(
    long runId,
    Instant startedAt,
    Instant finishedAt,
    RunPhase phase,
    DiscoveryRunCounters counters,
    boolean sessionExpired,
    List<SourceTag> failedSources,
    String notes,
    List<SourceStreamResult> streams
) {
}
