package com.delta.lottracker.discovery.model;

import java.time.Instant;
import java.util.List;

public record DiscoveryRunSummary(
    long runId,
    Instant startedAt,
    Instant finishedAt,
    RunPhase status,
    DiscoveryRunCounters counters,
    boolean sessionExpired,
    List<SourceTag> failedSources,
    List<SourceStreamResult> streams,
    List<Lot> rankedLots
) {
}
